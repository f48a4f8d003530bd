package org.dynamis.async.runtime;

/**
 * Lifecycle stage of a {@link Task}. The last three values are terminal.
 */
public enum TaskStatus {
    CREATED,
    WAITING_FOR_ACTIVATION,
    WAITING_TO_RUN,
    RUNNING,
    RAN_TO_COMPLETION,
    /** Cancellation was observed cooperatively; no exception is involved. */
    CANCELED,
    /** The task stopped with an error message. */
    FAULTED;

    public boolean isTerminal() {
        return compareTo(RAN_TO_COMPLETION) >= 0;
    }
}
