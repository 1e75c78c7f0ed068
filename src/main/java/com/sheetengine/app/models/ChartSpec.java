package com.sheetengine.app.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chart metadata. Stored as-is; nothing here is computed.
 */
public class ChartSpec {
    private String id;
    private String type;
    private String title;
    private String dataRange;
    private Map<String, Object> position = new LinkedHashMap<>();
    private Map<String, Object> size = new LinkedHashMap<>();
    private Map<String, Object> options = new LinkedHashMap<>();
    private String createdAt;
    private String updatedAt;

    public ChartSpec() {
    }

    public ChartSpec(String type, String title, String dataRange) {
        this.type = type;
        this.title = title;
        this.dataRange = dataRange;
    }

    /**
     * Copies every non-null field of {@code patch} onto this chart. The id
     * and creation time are kept.
     */
    public void merge(ChartSpec patch) {
        if (patch.type != null) {
            this.type = patch.type;
        }
        if (patch.title != null) {
            this.title = patch.title;
        }
        if (patch.dataRange != null) {
            this.dataRange = patch.dataRange;
        }
        if (patch.position != null && !patch.position.isEmpty()) {
            this.position = patch.position;
        }
        if (patch.size != null && !patch.size.isEmpty()) {
            this.size = patch.size;
        }
        if (patch.options != null && !patch.options.isEmpty()) {
            this.options = patch.options;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDataRange() {
        return dataRange;
    }

    public void setDataRange(String dataRange) {
        this.dataRange = dataRange;
    }

    public Map<String, Object> getPosition() {
        return position;
    }

    public void setPosition(Map<String, Object> position) {
        this.position = position;
    }

    public Map<String, Object> getSize() {
        return size;
    }

    public void setSize(Map<String, Object> size) {
        this.size = size;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }
}
