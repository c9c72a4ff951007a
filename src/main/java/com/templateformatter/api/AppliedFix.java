package com.templateformatter.api;

/**
 * A fix that was applied to a template.
 */
public class AppliedFix {
    private final String ruleName;
    private final int startLine;
    private final int endLine;
    private final String description;

    public AppliedFix(String ruleName, int startLine, int endLine, String description) {
        this.ruleName = ruleName;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    // Getters
    public String getRuleName() { return ruleName; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return ruleName + " (" + startLine + "-" + endLine + "): " + description;
    }
}
