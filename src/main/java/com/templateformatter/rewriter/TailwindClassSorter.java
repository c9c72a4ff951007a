package com.templateformatter.rewriter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.HtmlAttributeNode;
import com.templateformatter.ast.HtmlAttributeValueNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Visitor;
import com.templateformatter.autofix.NodeCopier;
import com.templateformatter.autofix.NodeReplacer;
import com.templateformatter.format.FormatContext;
import com.templateformatter.util.LoggerUtil;

/**
 * Sorts the classes of static {@code class} attributes by Tailwind CSS category: layout,
 * position, sizing, flexbox and grid, spacing, typography, backgrounds, borders, effects,
 * filters, transitions, transforms, interactivity, SVG, accessibility. Unknown classes go last.
 * Classes with the same rank sort alphabetically.
 *
 * <p>Attributes whose value contains ERB are left alone.
 */
public class TailwindClassSorter extends AstRewriter {
    private static final Logger logger = LoggerUtil.getLogger(TailwindClassSorter.class);

    public static final String NAME = "tailwind-class-sorter";

    static final int UNKNOWN_RANK = 999;

    private static final Map<String, Integer> CLASS_GROUPS = new HashMap<>();

    static {
        _group(0, "aspect", "block", "box", "break", "clear", "collapse", "columns", "container", "contents",
                "flex", "float", "flow", "grid", "hidden", "inline", "invisible", "isolation", "list", "object",
                "overflow", "overscroll", "table", "truncate", "visible");
        _group(1, "absolute", "bottom", "fixed", "inset", "left", "relative", "right", "static", "sticky", "top",
                "z");
        _group(2, "h", "max", "min", "size", "w");
        _group(3, "auto", "basis", "col", "content", "gap", "grow", "items", "justify", "order", "place", "row",
                "self", "shrink");
        _group(4, "m", "mb", "me", "ml", "mr", "ms", "mt", "mx", "my", "p", "pb", "pe", "pl", "pr", "ps", "pt",
                "px", "py", "space");
        _group(5, "accent", "align", "antialiased", "capitalize", "caret", "decoration", "font", "hyphens",
                "indent", "italic", "leading", "lowercase", "normal", "not", "overline", "placeholder",
                "subpixel", "tab", "text", "tracking", "underline", "uppercase", "whitespace", "word");
        _group(6, "bg", "from", "gradient", "to", "via");
        _group(7, "border", "divide", "outline", "ring", "rounded");
        _group(8, "mix", "opacity", "shadow");
        _group(9, "backdrop", "blur", "brightness", "contrast", "drop", "filter", "grayscale", "hue", "invert",
                "saturate", "sepia");
        _group(10, "animate", "delay", "duration", "ease", "transition");
        _group(11, "origin", "rotate", "scale", "skew", "transform", "translate");
        _group(12, "appearance", "cursor", "pointer", "resize", "scroll", "select", "snap", "touch", "will");
        _group(13, "fill", "stroke");
        _group(14, "sr");
    }

    private static void _group(int rank, String... prefixes) {
        for (String prefix : prefixes) {
            CLASS_GROUPS.put(prefix, rank);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Sort Tailwind CSS classes by recommended order";
    }

    @Override
    public DocumentNode rewrite(DocumentNode root, FormatContext context) {
        List<HtmlAttributeValueNode> classValues = new ArrayList<>();
        new Visitor() {
            @Override
            public void visitHtmlAttributeNode(HtmlAttributeNode node) {
                if ("class".equals(node.getName().getStaticName()) && node.getValue() != null) {
                    classValues.add(node.getValue());
                }
                super.visitHtmlAttributeNode(node);
            }
        }.visit(root);

        for (HtmlAttributeValueNode value : classValues) {
            _sortClassValue(root, value);
        }
        return root;
    }

    /**
     * Rank of a class: the variant prefix ({@code hover:}) is ignored and the first dash-separated
     * segment is looked up.
     */
    static int sortKey(String className) {
        String effective = className.substring(className.lastIndexOf(':') + 1);
        int dash = effective.indexOf('-');
        String prefix = dash < 0 ? effective : effective.substring(0, dash);
        return CLASS_GROUPS.getOrDefault(prefix, UNKNOWN_RANK);
    }

    static String sortClasses(String classes) {
        String trimmed = classes.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        List<String> classList = new ArrayList<>(Arrays.asList(trimmed.split("\\s+")));
        classList.sort(Comparator.<String>comparingInt(TailwindClassSorter::sortKey)
                .thenComparing(Comparator.naturalOrder()));
        return String.join(" ", classList);
    }

    private void _sortClassValue(DocumentNode root, HtmlAttributeValueNode value) {
        String classText = value.getStaticValue();
        if (classText == null) {
            return;
        }
        String sorted = sortClasses(classText);
        if (classText.strip().equals(sorted)) {
            return;
        }

        List<Node> children = new ArrayList<>();
        children.add(NodeCopier.literal(value, sorted));
        HtmlAttributeValueNode replacement = NodeCopier.attributeValue(value, value.getOpenQuote(), children,
                value.getCloseQuote());
        if (!NodeReplacer.replaceStructural(root, value, replacement)) {
            logger.warning("Could not replace class attribute at " + value.getLocation());
        }
    }
}
