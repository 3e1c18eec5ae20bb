package io.planduck.commons.plan;

public class PlanParseException extends Exception {

    private final String line;
    private final int lineNumber;

    public PlanParseException(String line, int lineNumber) {
        super("Invalid operation at line %d: %s".formatted(lineNumber, line));
        this.line = line;
        this.lineNumber = lineNumber;
    }

    /**
     * The offending statement, trimmed.
     */
    public String getLine() {
        return line;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
