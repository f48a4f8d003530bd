package org.dynamis.async.diagnostic;

/**
 * Receives validation and classification findings. Implementations must not throw; a report is
 * never allowed to abort the surrounding compilation.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    static DiagnosticSink discarding() {
        return diagnostic -> { };
    }
}
