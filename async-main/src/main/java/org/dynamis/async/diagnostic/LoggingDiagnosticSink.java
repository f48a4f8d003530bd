package org.dynamis.async.diagnostic;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forwards diagnostics to Log4j, optionally teeing them into another sink.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LogManager.getLogger(LoggingDiagnosticSink.class);

    private final DiagnosticSink next;

    public LoggingDiagnosticSink() {
        this(DiagnosticSink.discarding());
    }

    public LoggingDiagnosticSink(DiagnosticSink next) {
        this.next = next;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> log.error("{}", diagnostic);
            case WARNING -> log.warn("{}", diagnostic);
            default -> log.debug("{}", diagnostic);
        }
        next.report(diagnostic);
    }
}
