package org.dynamis.async.classify;

/**
 * Qualified identities of the runtime methods and types the lowering recognises.
 */
public final class Primitives {

    public static final String TASK = "org.dynamis.async.runtime.Task";
    public static final String TIMING = "org.dynamis.async.runtime.Timing";
    public static final String RESUMPTION = "org.dynamis.async.runtime.Resumption";
    public static final String CANCELLATION_TOKEN = "org.dynamis.async.runtime.CancellationToken";
    public static final String ASYNC_BEHAVIOUR = "org.dynamis.async.runtime.AsyncBehaviour";
    public static final String ASYNC_PROCEDURE = "org.dynamis.async.runtime.AsyncProcedure";
    public static final String ASYNC_PROCEDURE_SIMPLE_NAME = "AsyncProcedure";

    public static final String AWAIT = "org.dynamis.async.runtime.Async.await";
    public static final String AWAIT_SIMPLE_NAME = "await";

    public static final String DELAY = TASK + ".delay";
    public static final String DELAY_FRAMES = TASK + ".delayFrames";
    public static final String YIELD_FRAME = TASK + ".yieldFrame";
    public static final String WHEN_ALL = TASK + ".whenAll";
    public static final String WHEN_ANY = TASK + ".whenAny";

    private Primitives() {}
}
