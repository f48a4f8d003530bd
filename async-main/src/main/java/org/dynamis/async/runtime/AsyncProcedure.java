package org.dynamis.async.runtime;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code Task}-returning method of an {@link AsyncBehaviour} as an async procedure: its body
 * may {@link Async#await(Task) await} and is lowered into a state machine. Unmarked methods that
 * return {@code Task} are ordinary methods and are never rewritten.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AsyncProcedure {
}
