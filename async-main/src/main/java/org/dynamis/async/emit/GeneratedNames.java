package org.dynamis.async.emit;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Member names generated for one procedure. All of them start with {@code <prefix><procedure>_}.
 */
public final class GeneratedNames {

    private static final Set<String> RESERVED = Set.of("state", "result", "dispatch");
    private static final Pattern AWAITER = Pattern.compile("await\\d+");

    private final String base;

    public GeneratedNames(String prefix, String procedureName) {
        this.base = prefix + procedureName + "_";
    }

    public String state() {
        return base + "state";
    }

    public String result() {
        return base + "result";
    }

    public String dispatch() {
        return base + "dispatch";
    }

    public String awaiter(int pointIndex) {
        return base + "await" + pointIndex;
    }

    /**
     * Field name for a hoisted variable. Variables whose name would clash with the fixed members
     * get a trailing underscore.
     */
    public String slot(String variableName) {
        if (RESERVED.contains(variableName) || AWAITER.matcher(variableName).matches()) {
            return base + variableName + "_";
        }
        return base + variableName;
    }

    public boolean isGenerated(String memberName) {
        return memberName.startsWith(base);
    }

    public String base() {
        return base;
    }
}
