package org.dynamis.async.runtime;

public class CancellationTokenSource {

    private boolean canceled;

    public CancellationToken getToken() {
        return new CancellationToken(this);
    }

    public boolean isCancellationRequested() {
        return canceled;
    }

    public void cancel() {
        canceled = true;
    }

    public void reset() {
        canceled = false;
    }
}
