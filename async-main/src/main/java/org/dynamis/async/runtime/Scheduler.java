package org.dynamis.async.runtime;

/**
 * Host primitive consumed by lowered code: run {@code resumption} once, later, according to
 * {@code timing}. Implementations are single-threaded and never run a resumption re-entrantly
 * from inside {@code schedule}.
 */
@FunctionalInterface
public interface Scheduler {

    void schedule(Resumption resumption, Timing timing);
}
