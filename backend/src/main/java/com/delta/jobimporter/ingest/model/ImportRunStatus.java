package com.delta.jobimporter.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImportRunStatus {
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    ImportRunStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static ImportRunStatus fromDbValue(String value) {
        for (ImportRunStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown import run status: " + value);
    }
}
