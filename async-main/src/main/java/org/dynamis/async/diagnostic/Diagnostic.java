package org.dynamis.async.diagnostic;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * One message about one async procedure, reported through a {@link DiagnosticSink}.
 *
 * @param severity  how serious the finding is
 * @param code      stable identifier, e.g. {@code ASYNC002}
 * @param message   what is wrong
 * @param procedure name of the procedure the finding belongs to
 * @param range     source location, {@code null} when the node was synthesized
 * @param hint      suggested rewrite, {@code null} when there is none
 */
public record Diagnostic(Severity severity, String code, String message, String procedure, Range range, String hint) {

    public static Diagnostic error(DiagnosticCode code, String procedure, Node at, String message) {
        return new Diagnostic(Severity.ERROR, code.id(), message, procedure, rangeOf(at), code.hint());
    }

    public static Diagnostic errorAt(DiagnosticCode code, String procedure, Range range, String message) {
        return new Diagnostic(Severity.ERROR, code.id(), message, procedure, range, code.hint());
    }

    public static Diagnostic warning(DiagnosticCode code, String procedure, Node at, String message) {
        return new Diagnostic(Severity.WARNING, code.id(), message, procedure, rangeOf(at), code.hint());
    }

    public static Diagnostic info(DiagnosticCode code, String procedure, Node at, String message) {
        return new Diagnostic(Severity.INFO, code.id(), message, procedure, rangeOf(at), null);
    }

    public Optional<Range> location() {
        return Optional.ofNullable(range);
    }

    public Optional<String> remediation() {
        return Optional.ofNullable(hint);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    private static Range rangeOf(Node node) {
        return node == null ? null : node.getRange().orElse(null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(code);
        if (range != null) {
            sb.append(" at ").append(range.begin.line).append(':').append(range.begin.column);
        }
        sb.append(" [").append(procedure).append("] ").append(message);
        if (hint != null) {
            sb.append(" Hint: ").append(hint);
        }
        return sb.toString();
    }
}
