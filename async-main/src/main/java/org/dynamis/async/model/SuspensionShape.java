package org.dynamis.async.model;

/**
 * The statement forms a suspension may take.
 */
public enum SuspensionShape {
    /** {@code await(E);} */
    BARE,
    /** {@code x = await(E);} */
    ASSIGN,
    /** {@code T x = await(E);} */
    DECLARE,
    /** {@code return await(E);} */
    RETURN;

    public boolean usesValue() {
        return this != BARE;
    }
}
