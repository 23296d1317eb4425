package com.delta.jobimporter.ingest.model;

/**
 * Result of reconciling one candidate. {@code retryable} is only meaningful for failures.
 */
public record ProcessOutcome(ProcessAction action, String reason, boolean retryable) {

    public static ProcessOutcome created() {
        return new ProcessOutcome(ProcessAction.CREATED, null, false);
    }

    public static ProcessOutcome updated() {
        return new ProcessOutcome(ProcessAction.UPDATED, null, false);
    }

    public static ProcessOutcome failed(String reason, boolean retryable) {
        return new ProcessOutcome(ProcessAction.FAILED, reason, retryable);
    }

    public boolean isSuccess() {
        return action != ProcessAction.FAILED;
    }
}
