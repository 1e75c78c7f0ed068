package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.ErrorCode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * TODAY, NOW, YEAR, MONTH, DAY.
 * <p>
 * The current time always comes from the evaluator's clock. Dates are
 * returned as ISO text; YEAR/MONTH/DAY also take serial day numbers in the
 * workbook's date system.
 */
final class DateFunctions {

    private static final LocalDate EPOCH_1900 = LocalDate.of(1899, 12, 31);
    private static final LocalDate EPOCH_1900_AFTER_LEAP_BUG = LocalDate.of(1899, 12, 30);
    private static final LocalDate EPOCH_1904 = LocalDate.of(1904, 1, 1);

    // Serial 60 is 1900-02-29, a day that never existed
    private static final long PHANTOM_LEAP_DAY = 60;

    private DateFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("TODAY", 0, 0,
                (args, ev) -> CellValue.string(LocalDate.now(ev.clock()).toString()));
        registry.register("NOW", 0, 0,
                (args, ev) -> CellValue.string(Instant.now(ev.clock()).truncatedTo(ChronoUnit.SECONDS).toString()));
        registry.register("YEAR", 1, 1, (args, ev) -> datePart(args, ev, Part.YEAR));
        registry.register("MONTH", 1, 1, (args, ev) -> datePart(args, ev, Part.MONTH));
        registry.register("DAY", 1, 1, (args, ev) -> datePart(args, ev, Part.DAY));
    }

    private enum Part {
        YEAR, MONTH, DAY
    }

    private static CellValue datePart(List<FormulaNode> args, Evaluator evaluator, Part part) {
        CellValue value = evaluator.evaluate(args.get(0));
        if (value.isError()) {
            return value;
        }
        int[] ymd = toYearMonthDay(value, evaluator.dateSystem());
        if (ymd == null) {
            return CellValue.error(ErrorCode.ERROR);
        }
        switch (part) {
            case YEAR:
                return CellValue.number(ymd[0]);
            case MONTH:
                return CellValue.number(ymd[1]);
            default:
                return CellValue.number(ymd[2]);
        }
    }

    /**
     * Returns {year, month, day} or null when the value is not a date.
     */
    static int[] toYearMonthDay(CellValue value, DateSystem system) {
        if (value.isNumber() || (value.isString() && value.isNumeric())) {
            return fromSerial((long) Math.floor(value.toNumber()), system);
        }
        if (!value.isString()) {
            return null;
        }
        String text = value.getString().trim();
        LocalDate date = parseDate(text);
        if (date == null) {
            return null;
        }
        return new int[]{date.getYear(), date.getMonthValue(), date.getDayOfMonth()};
    }

    static int[] fromSerial(long serial, DateSystem system) {
        if (serial < 0) {
            return null;
        }
        if (system == DateSystem.SYSTEM_1904) {
            return ymd(EPOCH_1904.plusDays(serial));
        }
        if (serial == 0) {
            return new int[]{1900, 1, 0};
        }
        if (serial < PHANTOM_LEAP_DAY) {
            return ymd(EPOCH_1900.plusDays(serial));
        }
        if (serial == PHANTOM_LEAP_DAY) {
            return new int[]{1900, 2, 29};
        }
        return ymd(EPOCH_1900_AFTER_LEAP_BUG.plusDays(serial));
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeException notADate) {
            try {
                // Date-times with or without an offset, e.g. NOW()'s "2024-03-15T10:30:45Z"
                return LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(text));
            } catch (DateTimeException notADateTime) {
                return null;
            }
        }
    }

    private static int[] ymd(LocalDate date) {
        return new int[]{date.getYear(), date.getMonthValue(), date.getDayOfMonth()};
    }
}
