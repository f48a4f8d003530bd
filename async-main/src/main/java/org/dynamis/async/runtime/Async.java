package org.dynamis.async.runtime;

/**
 * Marker operations recognised by the lowering pass. Calling them at run time means the enclosing
 * procedure was never lowered.
 */
public final class Async {

    private Async() {}

    /**
     * Suspends the enclosing async procedure until {@code task} completes, then yields its value.
     */
    public static <T> T await(Task<T> task) {
        throw new IllegalStateException("await(...) reached at run time; the enclosing procedure was not lowered");
    }

    /**
     * Generator-style yield, handled by a separate generator pass. A procedure may not combine it
     * with {@link #await(Task)}.
     */
    public static <T> void yieldValue(T value) {
        throw new IllegalStateException("yieldValue(...) reached at run time; the enclosing generator was not lowered");
    }
}
