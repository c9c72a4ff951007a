package com.templateformatter.autofix;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.lint.Diagnostic;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.Rule;
import com.templateformatter.printer.IdentityPrinter;
import com.templateformatter.util.LoggerUtil;

/**
 * Applies the fixes attached to diagnostics in two phases.
 *
 * <p>Tree fixes run first, in discovery order, against the parse result the diagnostics were
 * produced from; the tree is then reprinted once. Offset fixes run second, in discovery order,
 * against that text: each one re-verifies its recorded slice and is skipped when an earlier
 * edit moved the text under it. There is no second pass.
 */
public class Autofixer {
    private static final Logger logger = LoggerUtil.getLogger(Autofixer.class);

    public AutofixResult apply(ParseResult parseResult, List<Diagnostic> diagnostics) {
        return apply(parseResult, diagnostics, false);
    }

    public AutofixResult apply(ParseResult parseResult, List<Diagnostic> diagnostics, boolean unsafe) {
        List<Diagnostic> fixed = new ArrayList<>();
        List<Diagnostic> unfixed = new ArrayList<>();
        List<Diagnostic> offsetFixes = new ArrayList<>();

        DocumentNode root = parseResult.getValue();
        boolean treeChanged = false;

        for (Diagnostic diagnostic : diagnostics) {
            FixDescriptor fix = diagnostic.getFix();
            if (fix == null || !isAdmitted(fix.getRule(), unsafe)) {
                unfixed.add(diagnostic);
            } else if (fix.isOffsetFix()) {
                offsetFixes.add(diagnostic);
            } else if (_applyNodeFix(fix, root)) {
                fixed.add(diagnostic);
                treeChanged = true;
            } else {
                unfixed.add(diagnostic);
            }
        }

        String source = treeChanged ? IdentityPrinter.printNode(root) : parseResult.getSource();

        for (Diagnostic diagnostic : offsetFixes) {
            String updated = _applyOffsetFix(diagnostic.getFix(), source);
            if (updated == null) {
                unfixed.add(diagnostic);
            } else {
                source = updated;
                fixed.add(diagnostic);
            }
        }

        logger.fine("Applied " + fixed.size() + " fixes, " + unfixed.size() + " left unfixed");
        return new AutofixResult(source, fixed, unfixed);
    }

    /**
     * Safe fixes are always admitted, unsafe ones only on request, and rules without a fix never.
     */
    public static boolean isAdmitted(Rule rule, boolean unsafe) {
        FixSafety safety = rule.getFixSafety();
        return safety == FixSafety.SAFE || (safety == FixSafety.UNSAFE && unsafe);
    }

    private boolean _applyNodeFix(FixDescriptor fix, DocumentNode root) {
        try {
            boolean applied = fix.getRule().autofix(fix.getNode(), root);
            if (!applied) {
                logger.fine(() -> "Fix not applied: " + fix);
            }
            return applied;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Rule " + fix.getRule().getName() + " failed while fixing", e);
            return false;
        }
    }

    private String _applyOffsetFix(FixDescriptor fix, String source) {
        try {
            String updated = fix.getRule().autofixSource(fix, source);
            if (updated == null) {
                logger.fine(() -> "Text at " + fix + " no longer matches");
            }
            return updated;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Rule " + fix.getRule().getName() + " failed while fixing", e);
            return null;
        }
    }
}
