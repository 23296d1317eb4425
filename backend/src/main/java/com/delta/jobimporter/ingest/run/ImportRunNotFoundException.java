package com.delta.jobimporter.ingest.run;

public class ImportRunNotFoundException extends RuntimeException {
    private final long runId;

    public ImportRunNotFoundException(long runId) {
        super("Import run not found: " + runId);
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
