package com.sheetengine.app.models;

/**
 * Workbook-wide calculation settings.
 */
public class WorkbookSettings {
    private CalculationMode calculationMode = CalculationMode.AUTO;
    // Significant digits kept on cached numeric results
    private int precision = 15;
    private DateSystem dateSystem = DateSystem.SYSTEM_1900;

    public WorkbookSettings() {
    }

    public WorkbookSettings(CalculationMode calculationMode, int precision, DateSystem dateSystem) {
        this.calculationMode = calculationMode;
        this.precision = precision;
        this.dateSystem = dateSystem;
    }

    public CalculationMode getCalculationMode() {
        return calculationMode;
    }

    public void setCalculationMode(CalculationMode calculationMode) {
        this.calculationMode = calculationMode;
    }

    public int getPrecision() {
        return precision;
    }

    public void setPrecision(int precision) {
        this.precision = precision;
    }

    public DateSystem getDateSystem() {
        return dateSystem;
    }

    public void setDateSystem(DateSystem dateSystem) {
        this.dateSystem = dateSystem;
    }
}
