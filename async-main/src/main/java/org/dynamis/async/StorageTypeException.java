package org.dynamis.async;

import com.github.javaparser.Range;

import java.util.Optional;

/**
 * A variable that must outlive a suspension has a type the per-instance storage cannot declare.
 */
public class StorageTypeException extends AsyncLoweringException {

    private final String variableName;
    private final String typeName;
    private final Range range;

    public StorageTypeException(String variableName, String typeName, String reason, Range range) {
        super("Cannot hoist '" + variableName + "' of type '" + typeName + "' into persistent storage: " + reason);
        this.variableName = variableName;
        this.typeName = typeName;
        this.range = range;
    }

    public String getVariableName() {
        return variableName;
    }

    public String getTypeName() {
        return typeName;
    }

    public Optional<Range> getRange() {
        return Optional.ofNullable(range);
    }
}
