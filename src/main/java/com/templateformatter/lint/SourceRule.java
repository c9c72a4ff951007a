package com.templateformatter.lint;

import java.util.ArrayList;
import java.util.List;

import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.autofix.FixDescriptor;

/**
 * A rule that works on the raw source text and fixes by character offsets.
 *
 * <p>An offset fix never trusts its recorded offsets: the text at {@code [start, end)} must
 * still satisfy {@link #matchesFix(String, int, int)} before {@link #replacementFor(String)} is
 * spliced in. Offsets are verified, never recomputed.
 */
public abstract class SourceRule implements Rule {
    private List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public Severity getDefaultSeverity() {
        return Severity.WARNING;
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.SAFE;
    }

    @Override
    public List<Diagnostic> check(ParseResult parseResult, LintContext context) {
        this.diagnostics = new ArrayList<>();
        checkSource(context.getSource(), context);
        return diagnostics;
    }

    protected abstract void checkSource(String source, LintContext context);

    /**
     * Whether {@code source} still holds, at {@code [start, end)}, the text this rule reported.
     * The range is within bounds.
     */
    protected abstract boolean matchesFix(String source, int start, int end);

    protected abstract String replacementFor(String slice);

    @Override
    public final String autofixSource(FixDescriptor fix, String source) {
        if (fix.getEnd() > source.length()) {
            return null;
        }
        if (!matchesFix(source, fix.getStart(), fix.getEnd())) {
            return null;
        }
        String slice = source.substring(fix.getStart(), fix.getEnd());
        return source.substring(0, fix.getStart()) + replacementFor(slice) + source.substring(fix.getEnd());
    }

    protected void addOffense(String message, LintContext context, int start, int end) {
        FixDescriptor fix = getFixSafety() == FixSafety.NONE ? null : FixDescriptor.forOffsets(this, start, end);
        diagnostics.add(new Diagnostic(getName(), message, getDefaultSeverity(),
                context.getSourceIndex().locationOf(start, end), fix));
    }
}
