package org.dynamis.async.liveness;

public enum HoistingStrategy {
    /**
     * Hoist a local when a suspension lies between its declaration and a later reference.
     */
    POSITIONAL,
    /**
     * Hoist a local only when its value is live across a segment boundary.
     */
    DATAFLOW
}
