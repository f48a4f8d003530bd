package org.dynamis.async.emit;

/**
 * How the dispatcher waits for an awaited task.
 */
public enum JoinStrategy {
    /** Resume once the scheduler observes the awaited task finished. */
    COMPLETION_SIGNAL,
    /** Resume on the next frame and re-check; re-schedules until the task is done. */
    NEXT_TICK
}
