package org.dynamis.async.runtime;

/**
 * Cooperative cancellation handle. Lowered dispatchers check it before running each segment;
 * a segment already running is never interrupted.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationTokenSource source;

    CancellationToken(CancellationTokenSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancellationRequested();
    }

    public boolean canBeCanceled() {
        return source != null;
    }
}
