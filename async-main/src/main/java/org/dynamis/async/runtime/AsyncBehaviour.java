package org.dynamis.async.runtime;

/**
 * Base class for types declaring async procedures. Lowered dispatchers reach the host scheduler
 * through {@link #schedule(Resumption, Timing)}.
 */
public abstract class AsyncBehaviour {

    private Scheduler scheduler;

    public void attach(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    protected final void schedule(Resumption resumption, Timing timing) {
        if (scheduler == null) {
            throw new IllegalStateException(getClass().getName() + " has no scheduler attached");
        }
        scheduler.schedule(resumption, timing);
    }
}
