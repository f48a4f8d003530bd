package org.dynamis.async.model;

public enum SlotOrigin {
    PARAMETER,
    LOCAL,
    AWAITED
}
