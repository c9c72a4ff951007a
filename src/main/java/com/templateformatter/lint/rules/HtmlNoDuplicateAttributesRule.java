package com.templateformatter.lint.rules;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.templateformatter.ast.HtmlAttributeNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.Node;
import com.templateformatter.lint.VisitorRule;

/**
 * Reports an attribute name used more than once on the same tag. There is no automatic fix:
 * which occurrence to keep is the author's call.
 */
public class HtmlNoDuplicateAttributesRule extends VisitorRule {
    public static final String NAME = "html-no-duplicate-attributes";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Attributes must not be repeated on the same element";
    }

    @Override
    public void visitHtmlOpenTagNode(HtmlOpenTagNode node) {
        Set<String> seen = new HashSet<>();
        for (Node child : node.getChildren()) {
            if (!(child instanceof HtmlAttributeNode)) {
                continue;
            }
            String name = ((HtmlAttributeNode) child).getName().getStaticName();
            if (name == null) {
                continue;
            }
            String key = name.toLowerCase(Locale.ROOT);
            if (!seen.add(key)) {
                addOffense("Duplicate attribute `" + key + "` on `<" + node.getTagName().getValue() + ">`.", child);
            }
        }
        super.visitHtmlOpenTagNode(node);
    }
}
