package org.dynamis.async;

public class SourceParseException extends AsyncLoweringException {

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
