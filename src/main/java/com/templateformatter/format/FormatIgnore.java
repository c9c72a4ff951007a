package com.templateformatter.format;

import java.util.regex.Pattern;

import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Visitor;

/**
 * Finds file-level opt-out directives written as ERB comments: {@code <%# herb:formatter ignore %>}
 * for the formatter and {@code <%# herb:linter ignore %>} for the linter.
 */
public final class FormatIgnore extends Visitor {
    public static final String FORMATTER_IGNORE = "herb:formatter ignore";
    public static final String LINTER_IGNORE = "herb:linter ignore";

    private static final Pattern FORMATTER_PATTERN = Pattern.compile(Pattern.quote(FORMATTER_IGNORE));
    private static final Pattern LINTER_PATTERN = Pattern.compile("herb:linter\\s+ignore");

    private final Pattern directive;
    private boolean found = false;

    private FormatIgnore(Pattern directive) {
        this.directive = directive;
    }

    public static boolean hasFormatterIgnoreDirective(Node root) {
        return _hasDirective(root, FORMATTER_PATTERN);
    }

    public static boolean hasLinterIgnoreDirective(Node root) {
        return _hasDirective(root, LINTER_PATTERN);
    }

    private static boolean _hasDirective(Node root, Pattern directive) {
        FormatIgnore detector = new FormatIgnore(directive);
        detector.visit(root);
        return detector.found;
    }

    @Override
    public void visit(Node node) {
        if (!found) {
            super.visit(node);
        }
    }

    @Override
    public void visitErbContentNode(ErbContentNode node) {
        if (node.isComment() && directive.matcher(node.getContentValue().strip()).matches()) {
            found = true;
        }
    }
}
