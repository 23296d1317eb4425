package com.delta.jobimporter.ingest.service;

public class ImportFailedException extends RuntimeException {
    private final long importRunId;

    public ImportFailedException(long importRunId, String message, Throwable cause) {
        super(message, cause);
        this.importRunId = importRunId;
    }

    public long getImportRunId() {
        return importRunId;
    }
}
