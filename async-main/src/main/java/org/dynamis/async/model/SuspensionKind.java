package org.dynamis.async.model;

/**
 * What a suspension point waits for.
 */
public enum SuspensionKind {
    TIMED_DELAY,
    FRAME_DELAY,
    YIELD_ONE_STEP,
    JOIN_ALL,
    JOIN_ANY,
    DELEGATE_TO_PROCEDURE;

    /**
     * Whether resumption depends on another task finishing, so the awaited task needs an awaiter slot.
     */
    public boolean isCompletionBased() {
        return this == JOIN_ALL || this == JOIN_ANY || this == DELEGATE_TO_PROCEDURE;
    }
}
