package com.templateformatter.api.error;

/**
 * A problem found while formatting, linting or fixing a template.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String ruleName;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String ruleName) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.ruleName = ruleName;
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getRuleName() { return ruleName; }

    @Override
    public String toString() {
        String prefix = ruleName == null ? "" : "[" + ruleName + "] ";
        return severity + " " + line + ":" + column + " " + prefix + message;
    }
}
