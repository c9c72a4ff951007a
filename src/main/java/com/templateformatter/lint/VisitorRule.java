package com.templateformatter.lint;

import java.util.ArrayList;
import java.util.List;

import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.ast.Visitor;
import com.templateformatter.autofix.FixDescriptor;

/**
 * A rule that walks the tree. Subclasses override the visit hooks they care about, call the
 * super hook to keep descending, and report problems with {@link #addOffense}.
 *
 * <p>Instances keep per-run state and must not be shared between threads.
 */
public abstract class VisitorRule extends Visitor implements Rule {
    private List<Diagnostic> diagnostics = new ArrayList<>();
    private LintContext context;

    @Override
    public Severity getDefaultSeverity() {
        return Severity.ERROR;
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.NONE;
    }

    @Override
    public List<Diagnostic> check(ParseResult parseResult, LintContext context) {
        this.diagnostics = new ArrayList<>();
        this.context = context;
        visit(parseResult.getValue());
        return diagnostics;
    }

    protected LintContext getContext() {
        return context;
    }

    /**
     * Reports a problem at {@code node}. Unless the rule has no fix, the diagnostic carries a
     * reference to the node for the fix pipeline.
     */
    protected void addOffense(String message, Node node) {
        FixDescriptor fix = getFixSafety() == FixSafety.NONE ? null : FixDescriptor.forNode(this, node);
        diagnostics.add(new Diagnostic(getName(), message, getDefaultSeverity(), node.getLocation(), fix));
    }
}
