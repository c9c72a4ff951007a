package com.templateformatter.lint;

import java.util.List;

import com.templateformatter.ast.ParseResult;

/**
 * Diagnostics of one template, in discovery order, with the parse result they refer to.
 */
public class LintResult {
    private final ParseResult parseResult;
    private final List<Diagnostic> diagnostics;
    private final boolean ignored;

    public LintResult(ParseResult parseResult, List<Diagnostic> diagnostics, boolean ignored) {
        this.parseResult = parseResult;
        this.diagnostics = List.copyOf(diagnostics);
        this.ignored = ignored;
    }

    public ParseResult getParseResult() { return parseResult; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public boolean isIgnored() { return ignored; }

    public boolean hasParseErrors() {
        return parseResult.hasErrors();
    }

    public long countFixable() {
        return diagnostics.stream().filter(Diagnostic::isFixable).count();
    }
}
