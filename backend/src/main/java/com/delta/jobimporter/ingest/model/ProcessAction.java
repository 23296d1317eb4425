package com.delta.jobimporter.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProcessAction {
    CREATED,
    UPDATED,
    FAILED;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
