package com.templateformatter.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.templateformatter.ast.ErbBlockNode;
import com.templateformatter.ast.ErbCaseNode;
import com.templateformatter.ast.ErbElseNode;
import com.templateformatter.ast.ErbEndNode;
import com.templateformatter.ast.ErbIfNode;
import com.templateformatter.ast.ErbLoopNode;
import com.templateformatter.ast.ErbWhenNode;
import com.templateformatter.ast.HtmlAttributeNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.LiteralNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.WhitespaceNode;

/**
 * Element tables and small text utilities shared by the formatter.
 */
public final class FormatHelpers {
    public static final Set<String> INLINE_ELEMENTS = Set.of(
            "a", "abbr", "acronym", "b", "bdo", "big", "br", "cite", "code", "dfn", "em", "hr", "i", "img",
            "kbd", "label", "map", "object", "q", "samp", "small", "span", "strong", "sub", "sup", "tt", "var",
            "del", "ins", "mark", "s", "u", "time", "wbr");

    public static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source",
            "track", "wbr");

    public static final Set<String> CONTENT_PRESERVING_ELEMENTS = Set.of("script", "style", "pre", "textarea");

    /** Attributes whose value is a whitespace-separated token list. */
    public static final Set<String> TOKEN_LIST_ATTRIBUTES = Set.of("class", "data-controller", "data-action");

    private FormatHelpers() {
    }

    public static String tagName(HtmlElementNode element) {
        return element.getTagNameValue().toLowerCase(Locale.ROOT);
    }

    public static boolean isControlFlow(Node node) {
        return node instanceof ErbIfNode
                || node instanceof ErbElseNode
                || node instanceof ErbCaseNode
                || node instanceof ErbWhenNode
                || node instanceof ErbLoopNode
                || node instanceof ErbBlockNode
                || node instanceof ErbEndNode;
    }

    public static boolean hasControlFlow(List<Node> nodes) {
        for (Node node : nodes) {
            if (isControlFlow(node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts the attribute-like children of an open tag: attributes and embedded tags.
     */
    public static int countAttributes(HtmlOpenTagNode openTag) {
        int count = 0;
        for (Node child : openTag.getChildren()) {
            if (!(child instanceof WhitespaceNode) && !isStraySlash(child)) {
                count++;
            }
        }
        return count;
    }

    /**
     * A lone {@code /} inside an open tag that does not end it, such as {@code <input / value="x">}.
     * Browsers ignore it, so the formatter drops it.
     */
    public static boolean isStraySlash(Node node) {
        if (!(node instanceof HtmlAttributeNode) || ((HtmlAttributeNode) node).getValue() != null) {
            return false;
        }
        List<Node> nameChildren = ((HtmlAttributeNode) node).getName().getChildren();
        return nameChildren.size() == 1 && nameChildren.get(0) instanceof LiteralNode
                && ((LiteralNode) nameChildren.get(0)).getContent().matches("/+");
    }

    public static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    public static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ");
    }

    public static String stripTrailingWhitespace(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Splits the inner text of a multi-line construct into lines with the common indentation
     * removed. Text on the opening line is taken as-is and does not count toward the common
     * indentation; leading and trailing blank lines are dropped.
     */
    public static List<String> dedentBlock(String text) {
        String[] raw = text.replace("\r\n", "\n").split("\n", -1);
        List<String> rest = new ArrayList<>();
        for (int i = 1; i < raw.length; i++) {
            rest.add(stripTrailingWhitespace(raw[i]));
        }

        int common = Integer.MAX_VALUE;
        for (String line : rest) {
            if (!line.isBlank()) {
                int indent = 0;
                while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
                    indent++;
                }
                common = Math.min(common, indent);
            }
        }

        List<String> lines = new ArrayList<>();
        String first = raw[0].strip();
        if (!first.isEmpty()) {
            lines.add(first);
        }
        for (String line : rest) {
            lines.add(line.isBlank() ? "" : line.substring(common));
        }

        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
