package org.dynamis.async;

import com.github.javaparser.Range;

import java.util.Optional;

public class ClassificationException extends AsyncLoweringException {

    private final String expression;
    private final Range range;

    public ClassificationException(String message, String expression, Range range) {
        super(message);
        this.expression = expression;
        this.range = range;
    }

    public String getExpression() {
        return expression;
    }

    public Optional<Range> getRange() {
        return Optional.ofNullable(range);
    }
}
