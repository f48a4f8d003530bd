package org.dynamis.async.model;

import com.github.javaparser.ast.stmt.Statement;

import java.util.List;
import java.util.Optional;

/**
 * A maximal run of statements between suspensions. Every segment but the last ends at a
 * suspension point whose operands are already rewritten to slot references.
 */
public record Segment(int index, List<Statement> statements, SuspensionPoint terminator) {

    public Segment {
        statements = List.copyOf(statements);
    }

    public Optional<SuspensionPoint> terminatorPoint() {
        return Optional.ofNullable(terminator);
    }

    public boolean isTerminal() {
        return terminator == null;
    }
}
