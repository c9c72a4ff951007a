package com.templateformatter.lint;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Visitor;

/**
 * Collects {@code <%# herb:disable rule-a, rule-b %>} comments. Each one silences the named rules,
 * or every rule for {@code all}, on the line that follows it.
 */
public final class DisableDirectives extends Visitor {
    public static final String ALL = "all";

    private static final Pattern DISABLE = Pattern.compile("herb:disable\\s+(.+)");

    // target line -> disabled rule names
    private final Map<Integer, Set<String>> disabled = new HashMap<>();

    private DisableDirectives() {
    }

    public static DisableDirectives collect(Node root) {
        DisableDirectives directives = new DisableDirectives();
        directives.visit(root);
        return directives;
    }

    public boolean isDisabled(int line, String ruleName) {
        Set<String> rules = disabled.get(line);
        return rules != null && (rules.contains(ALL) || rules.contains(ruleName));
    }

    public boolean isEmpty() {
        return disabled.isEmpty();
    }

    @Override
    public void visitErbContentNode(ErbContentNode node) {
        if (!node.isComment()) {
            return;
        }
        Matcher matcher = DISABLE.matcher(node.getContentValue().strip());
        if (!matcher.matches()) {
            return;
        }
        int targetLine = node.getLocation().getStart().getLine() + 1;
        Set<String> rules = disabled.computeIfAbsent(targetLine, line -> new LinkedHashSet<>());
        for (String rule : matcher.group(1).split(",")) {
            if (!rule.isBlank()) {
                rules.add(rule.strip());
            }
        }
    }
}
