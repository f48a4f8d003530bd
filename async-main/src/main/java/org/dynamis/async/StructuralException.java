package org.dynamis.async;

import org.dynamis.async.diagnostic.Diagnostic;

import java.util.List;

/**
 * The procedure has a shape the segmenting model cannot lower. Carries every violation found,
 * the message is taken from the first one.
 */
public class StructuralException extends AsyncLoweringException {

    private final String procedureName;
    private final List<Diagnostic> violations;

    public StructuralException(String procedureName, List<Diagnostic> violations) {
        super(messageOf(procedureName, violations));
        this.procedureName = procedureName;
        this.violations = List.copyOf(violations);
    }

    public String getProcedureName() {
        return procedureName;
    }

    public List<Diagnostic> getViolations() {
        return violations;
    }

    private static String messageOf(String procedureName, List<Diagnostic> violations) {
        if (violations.isEmpty()) {
            return "Async procedure '" + procedureName + "' cannot be lowered";
        }
        String first = violations.get(0).message();
        return violations.size() == 1
                ? "Async procedure '" + procedureName + "' cannot be lowered: " + first
                : "Async procedure '" + procedureName + "' cannot be lowered: " + first
                  + " (and " + (violations.size() - 1) + " more)";
    }
}
