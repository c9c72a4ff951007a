package com.templateformatter.lint;

import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.Location;
import com.templateformatter.autofix.FixDescriptor;

/**
 * One problem reported by a rule, with an optional fix.
 */
public class Diagnostic {
    private final String ruleName;
    private final String message;
    private final Severity severity;
    private final Location location;
    private final FixDescriptor fix;

    public Diagnostic(String ruleName, String message, Severity severity, Location location, FixDescriptor fix) {
        this.ruleName = ruleName;
        this.message = message;
        this.severity = severity;
        this.location = location;
        this.fix = fix;
    }

    public String getRuleName() { return ruleName; }
    public String getMessage() { return message; }
    public Severity getSeverity() { return severity; }
    public Location getLocation() { return location; }
    public FixDescriptor getFix() { return fix; }

    public boolean isFixable() {
        return fix != null && fix.getRule().getFixSafety() != FixSafety.NONE;
    }

    public FormatterError toFormatterError() {
        int line = location == null ? 0 : location.getStart().getLine();
        int column = location == null ? 0 : location.getStart().getColumn();
        return new FormatterError(severity, message, line, column, ruleName);
    }

    @Override
    public String toString() {
        return ruleName + "@" + location + ": " + message;
    }
}
