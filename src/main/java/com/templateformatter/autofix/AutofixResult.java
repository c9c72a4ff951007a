package com.templateformatter.autofix;

import java.util.List;

import com.templateformatter.lint.Diagnostic;

/**
 * Final text of a fix run and the partition of its diagnostics.
 */
public class AutofixResult {
    private final String source;
    private final List<Diagnostic> fixed;
    private final List<Diagnostic> unfixed;

    public AutofixResult(String source, List<Diagnostic> fixed, List<Diagnostic> unfixed) {
        this.source = source;
        this.fixed = List.copyOf(fixed);
        this.unfixed = List.copyOf(unfixed);
    }

    public String getSource() { return source; }
    public List<Diagnostic> getFixed() { return fixed; }
    public List<Diagnostic> getUnfixed() { return unfixed; }

    public boolean hasFixes() {
        return !fixed.isEmpty();
    }
}
