package org.dynamis.async.runtime;

import java.util.Objects;

/**
 * Explicit handle to a dispatcher: the owning instance plus the procedure to re-invoke. Replaces
 * looking the dispatcher up by name.
 */
public record Resumption(Object owner, Runnable procedure) {

    public Resumption {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(procedure, "procedure");
    }

    public static Resumption of(Object owner, Runnable procedure) {
        return new Resumption(owner, procedure);
    }

    public void resume() {
        procedure.run();
    }
}
