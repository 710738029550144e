package com.tasksmith.core.run;

/**
 * Result of a cancellation request.
 *
 * @param ok      false only when there was nothing to cancel
 * @param outcome how the run ended
 * @param reason  display message
 */
public record CancelResult(boolean ok, Outcome outcome, String reason) {

    public enum Outcome {
        /** The execution stopped and finalized itself as cancelled. */
        INTERRUPTED,
        /** The run was finalized as cancelled without waiting for the execution. */
        FORCED,
        /** Another path finalized the run first. */
        ALREADY_FINALIZED,
        NOT_ACTIVE
    }

    public static final String NOT_ACTIVE_REASON = "Run is not active.";

    static CancelResult notActive() {
        return new CancelResult(false, Outcome.NOT_ACTIVE, NOT_ACTIVE_REASON);
    }

    static CancelResult interrupted() {
        return new CancelResult(true, Outcome.INTERRUPTED, "Run interrupted.");
    }

    static CancelResult forced() {
        return new CancelResult(true, Outcome.FORCED, "Run cancelled (forced).");
    }

    static CancelResult alreadyFinalized() {
        return new CancelResult(true, Outcome.ALREADY_FINALIZED, "Run had already finished.");
    }
}
