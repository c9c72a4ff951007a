package com.templateformatter.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.templateformatter.ast.CdataNode;
import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.ErbBlockNode;
import com.templateformatter.ast.ErbCaseNode;
import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.ErbElseNode;
import com.templateformatter.ast.ErbEndNode;
import com.templateformatter.ast.ErbIfNode;
import com.templateformatter.ast.ErbLoopNode;
import com.templateformatter.ast.ErbNode;
import com.templateformatter.ast.ErbWhenNode;
import com.templateformatter.ast.HtmlAttributeNode;
import com.templateformatter.ast.HtmlAttributeValueNode;
import com.templateformatter.ast.HtmlCloseTagNode;
import com.templateformatter.ast.HtmlCommentNode;
import com.templateformatter.ast.HtmlDoctypeNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.HtmlTextNode;
import com.templateformatter.ast.LiteralNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.WhitespaceNode;
import com.templateformatter.printer.IdentityPrinter;
import com.templateformatter.printer.PrintContext;
import com.templateformatter.printer.Printer;

/**
 * Prints a template in normalized layout.
 *
 * <p>Every hook has two modes. In inline mode (inside {@link #renderInline(Node)}) a node writes
 * itself onto the current line. In block mode it pushes whole lines at the current indent,
 * guided by the {@link ElementAnalyzer}. Sibling sequences are laid out by
 * {@link #_printBlockChildren(List)}, which keeps source line breaks between inline content,
 * collapses runs of blank lines to one and puts block-level nodes on their own lines.
 */
public class FormatPrinter extends Printer {
    private final FormatOptions options;
    private final ElementAnalyzer analyzer;

    public FormatPrinter(FormatOptions options) {
        super(new PrintContext(options.getIndentWidth()));
        this.options = options;
        this.analyzer = new ElementAnalyzer(this, options);
    }

    public ElementAnalyzer getAnalyzer() {
        return analyzer;
    }

    @Override
    public String print(Node node, boolean ignoreErrors) {
        analyzer.reset();
        String output = super.print(node, ignoreErrors);
        return _normalizeOutput(output);
    }

    /**
     * Renders a node on a single line without touching the output buffer.
     */
    public String renderInline(Node node) {
        List<String> lines = context.capture(() -> {
            context.setInlineMode(true);
            visit(node);
        });
        return String.join("", lines);
    }

    /**
     * Renders an open tag on a single line.
     */
    public String renderOpenTag(HtmlOpenTagNode openTag, boolean isVoid) {
        StringBuilder sb = new StringBuilder("<").append(openTag.getTagName().getValue());
        for (String attribute : _attributeParts(openTag)) {
            sb.append(' ').append(attribute);
        }
        sb.append(_tagEnding(openTag, isVoid));
        return sb.toString();
    }

    public boolean isVoidElement(HtmlElementNode element) {
        return element.isVoid()
                || (element.getCloseTag() == null && options.isVoidElement(element.getTagNameValue()));
    }

    @Override
    public void visitDocumentNode(DocumentNode node) {
        _printBlockChildren(node.getChildren());
    }

    @Override
    public void visitHtmlElementNode(HtmlElementNode node) {
        if (context.isInlineMode()) {
            _writeElementInline(node);
            return;
        }

        String tagName = FormatHelpers.tagName(node);
        context.enterTag(tagName);
        if (options.isContentPreserving(tagName)) {
            _printPreservedElement(node);
        } else {
            _printElement(node);
        }
        context.exitTag();
    }

    @Override
    public void visitHtmlOpenTagNode(HtmlOpenTagNode node) {
        String rendered = renderOpenTag(node, node.isVoid());
        if (context.isInlineMode()) {
            write(rendered);
        } else {
            context.push(rendered);
        }
    }

    @Override
    public void visitHtmlCloseTagNode(HtmlCloseTagNode node) {
        String rendered = "</" + node.getTagName().getValue() + ">";
        if (context.isInlineMode()) {
            write(rendered);
        } else {
            context.push(rendered);
        }
    }

    @Override
    public void visitHtmlTextNode(HtmlTextNode node) {
        if (context.isInlineMode()) {
            write(FormatHelpers.collapseWhitespace(node.getContent()));
            return;
        }
        _printBlockChildren(List.of(node));
    }

    @Override
    public void visitLiteralNode(LiteralNode node) {
        write(node.getContent());
    }

    @Override
    public void visitWhitespaceNode(WhitespaceNode node) {
        if (context.isInlineMode()) {
            write(" ");
        }
    }

    @Override
    public void visitHtmlCommentNode(HtmlCommentNode node) {
        String inner = IdentityPrinter.printNodes(node.getChildren());
        String closing = node.getTagClosing().getValue();

        if (context.isInlineMode()) {
            write(_commentSingleLine(inner, closing));
            return;
        }
        if (_isConditionalComment(inner) || inner.strip().indexOf('\n') < 0) {
            context.push(_commentSingleLine(inner, closing));
            return;
        }
        context.push("<!--");
        context.indent();
        for (String line : FormatHelpers.dedentBlock(inner)) {
            context.push(line);
        }
        context.dedent();
        context.push(closing);
    }

    @Override
    public void visitHtmlDoctypeNode(HtmlDoctypeNode node) {
        String inner = FormatHelpers.collapseWhitespace(IdentityPrinter.printNodes(node.getChildren())).strip();
        String rendered = node.getTagOpening().getValue() + inner + node.getTagClosing().getValue();
        if (context.isInlineMode()) {
            write(rendered);
        } else {
            context.push(rendered);
        }
    }

    @Override
    public void visitCdataNode(CdataNode node) {
        _printVerbatim(IdentityPrinter.printNode(node));
    }

    @Override
    public void visitErbContentNode(ErbContentNode node) {
        if (context.isInlineMode()) {
            write(_erbTag(node));
            return;
        }
        if (node.getContentValue().strip().indexOf('\n') >= 0) {
            _printMultilineErb(node);
        } else {
            context.push(_erbTag(node));
        }
    }

    @Override
    public void visitErbIfNode(ErbIfNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printIndentedBody(node.getBody());
        visit(node.getSubsequent());
        if (node.getEndNode() != null) {
            context.push(_erbTag(node.getEndNode()));
        }
    }

    @Override
    public void visitErbElseNode(ErbElseNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printIndentedBody(node.getBody());
    }

    @Override
    public void visitErbCaseNode(ErbCaseNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printBlockChildren(node.getChildren());
        for (ErbWhenNode condition : node.getConditions()) {
            visit(condition);
        }
        visit(node.getElseClause());
        if (node.getEndNode() != null) {
            context.push(_erbTag(node.getEndNode()));
        }
    }

    @Override
    public void visitErbWhenNode(ErbWhenNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printIndentedBody(node.getBody());
    }

    @Override
    public void visitErbLoopNode(ErbLoopNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printIndentedBody(node.getBody());
        if (node.getEndNode() != null) {
            context.push(_erbTag(node.getEndNode()));
        }
    }

    @Override
    public void visitErbBlockNode(ErbBlockNode node) {
        if (_writeControlFlowInline(node)) {
            return;
        }
        context.push(_erbTag(node));
        _printIndentedBody(node.getBody());
        if (node.getEndNode() != null) {
            context.push(_erbTag(node.getEndNode()));
        }
    }

    @Override
    public void visitErbEndNode(ErbEndNode node) {
        if (context.isInlineMode()) {
            write(_erbTag(node));
        } else {
            context.push(_erbTag(node));
        }
    }

    private void _printElement(HtmlElementNode node) {
        ElementAnalysis analysis = analyzer.analyze(node);
        boolean isVoid = isVoidElement(node);
        HtmlOpenTagNode openTag = node.getOpenTag();

        if (analysis.isOpenTagInline()) {
            context.push(renderOpenTag(openTag, isVoid));
        } else {
            _printOpenTagMultiline(openTag, isVoid);
        }

        if (isVoid || (node.getCloseTag() == null && node.getBody().isEmpty())) {
            return;
        }

        if (analysis.isElementContentInline()) {
            context.write(_renderBodyInline(node.getBody()) + _closeTag(node));
        } else {
            _printIndentedBody(node.getBody());
            if (analysis.isCloseTagInline()) {
                context.write(_closeTag(node));
            } else {
                context.push(_closeTag(node));
            }
        }
    }

    private void _writeElementInline(HtmlElementNode node) {
        write(renderOpenTag(node.getOpenTag(), isVoidElement(node)));
        if (options.isContentPreserving(node.getTagNameValue())) {
            write(IdentityPrinter.printNodes(node.getBody()));
        } else {
            visitAll(node.getBody());
        }
        write(_closeTag(node));
    }

    private void _printPreservedElement(HtmlElementNode node) {
        String text = renderOpenTag(node.getOpenTag(), false)
                + IdentityPrinter.printNodes(node.getBody())
                + _closeTag(node);
        _printVerbatim(text);
    }

    // First line at the current indent, the rest exactly as given.
    private void _printVerbatim(String text) {
        String[] lines = text.replace("\r\n", "\n").split("\n", -1);
        if (context.isInlineMode()) {
            write(String.join("\n", lines));
            return;
        }
        context.push(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            context.pushRaw(lines[i]);
        }
    }

    private void _printOpenTagMultiline(HtmlOpenTagNode openTag, boolean isVoid) {
        context.push("<" + openTag.getTagName().getValue());
        context.indent();
        for (Node child : openTag.getChildren()) {
            if (child instanceof WhitespaceNode || FormatHelpers.isStraySlash(child)) {
                continue;
            }
            if (FormatHelpers.isControlFlow(child)) {
                for (String line : FormatHelpers.dedentBlock(IdentityPrinter.printNode(child))) {
                    context.push(line);
                }
            } else {
                context.push(_attributePart(child));
            }
        }
        context.dedent();
        context.push(_tagEnding(openTag, isVoid).strip());
    }

    private void _printIndentedBody(List<Node> body) {
        context.indent();
        _printBlockChildren(body);
        context.dedent();
    }

    private void _printMultilineErb(ErbNode node) {
        context.push(node.getTagOpening().getValue());
        context.indent();
        for (String line : FormatHelpers.dedentBlock(node.getContentValue())) {
            context.push(line);
        }
        context.dedent();
        context.push(node.getTagClosing().getValue());
    }

    private boolean _writeControlFlowInline(Node node) {
        if (!context.isInlineMode()) {
            return false;
        }
        write(FormatHelpers.collapseWhitespace(IdentityPrinter.printNode(node)).strip());
        return true;
    }

    private void _printBlockChildren(List<Node> children) {
        BlockLayout layout = new BlockLayout();
        for (Node child : children) {
            if (child instanceof HtmlTextNode) {
                layout.addText(((HtmlTextNode) child).getContent());
            } else if (child instanceof WhitespaceNode) {
                layout.addText(((WhitespaceNode) child).getValue().getValue());
            } else if (_isInlineItem(child)) {
                layout.addInline(renderInline(child));
            } else {
                layout.addBlock(child);
            }
        }
        layout.finish();
    }

    private boolean _isInlineItem(Node node) {
        if (node instanceof HtmlElementNode) {
            HtmlElementNode element = (HtmlElementNode) node;
            String tagName = element.getTagNameValue();
            if (!options.isInlineElement(tagName) || options.isContentPreserving(tagName)) {
                return false;
            }
            return analyzer.analyze(element).isFullyInline();
        }
        if (node instanceof ErbContentNode) {
            return ((ErbContentNode) node).getContentValue().strip().indexOf('\n') < 0;
        }
        if (node instanceof HtmlCommentNode) {
            String inner = IdentityPrinter.printNodes(((HtmlCommentNode) node).getChildren());
            return inner.strip().indexOf('\n') < 0;
        }
        return node instanceof LiteralNode || node instanceof HtmlCloseTagNode;
    }

    private String _renderBodyInline(List<Node> body) {
        List<String> lines = context.capture(() -> {
            context.setInlineMode(true);
            visitAll(body);
        });
        return String.join("", lines);
    }

    private List<String> _attributeParts(HtmlOpenTagNode openTag) {
        List<String> parts = new ArrayList<>();
        for (Node child : openTag.getChildren()) {
            if (child instanceof WhitespaceNode || FormatHelpers.isStraySlash(child)) {
                continue;
            }
            if (FormatHelpers.isControlFlow(child)) {
                parts.add(FormatHelpers.collapseWhitespace(IdentityPrinter.printNode(child)).strip());
            } else {
                parts.add(_attributePart(child));
            }
        }
        return parts;
    }

    private String _attributePart(Node child) {
        if (child instanceof HtmlAttributeNode) {
            return _renderAttribute((HtmlAttributeNode) child);
        }
        if (child instanceof ErbContentNode) {
            return _erbTag((ErbContentNode) child);
        }
        return IdentityPrinter.printNode(child).strip();
    }

    private String _renderAttribute(HtmlAttributeNode attribute) {
        String name = _renderAttributeChildren(attribute.getName().getChildren());
        HtmlAttributeValueNode value = attribute.getValue();
        if (value == null) {
            return name;
        }

        String content = _renderAttributeChildren(value.getChildren());
        if (FormatHelpers.TOKEN_LIST_ATTRIBUTES.contains(name.toLowerCase(Locale.ROOT))) {
            content = FormatHelpers.collapseWhitespace(content).strip();
        }

        String quote = "\"";
        if (content.indexOf('"') >= 0) {
            if (content.indexOf('\'') < 0) {
                quote = "'";
            } else if (value.getOpenQuote() != null) {
                quote = value.getOpenQuote().getValue();
            }
        }
        return name + "=" + quote + content + quote;
    }

    private String _renderAttributeChildren(List<Node> children) {
        StringBuilder sb = new StringBuilder();
        for (Node child : children) {
            if (child instanceof LiteralNode) {
                sb.append(((LiteralNode) child).getContent());
            } else if (child instanceof ErbContentNode) {
                sb.append(_erbTag((ErbContentNode) child));
            } else {
                sb.append(IdentityPrinter.printNode(child));
            }
        }
        return sb.toString();
    }

    private String _tagEnding(HtmlOpenTagNode openTag, boolean isVoid) {
        return openTag.isSelfClosing() && !isVoid ? " />" : ">";
    }

    private String _closeTag(HtmlElementNode node) {
        HtmlCloseTagNode closeTag = node.getCloseTag();
        return closeTag == null ? "" : "</" + closeTag.getTagName().getValue() + ">";
    }

    private String _erbTag(ErbNode node) {
        String opening = node.getTagOpening().getValue();
        String closing = node.getTagClosing().getValue();
        String code = node.getContentValue().strip();
        if (code.isEmpty()) {
            return opening + " " + closing;
        }
        return opening + " " + code + " " + closing;
    }

    private String _commentSingleLine(String inner, String closing) {
        if (_isConditionalComment(inner)) {
            return "<!--" + inner + closing;
        }
        String text = FormatHelpers.collapseWhitespace(inner).strip();
        return text.isEmpty() ? "<!--" + closing : "<!-- " + text + " " + closing;
    }

    private boolean _isConditionalComment(String inner) {
        return inner.startsWith("[") || inner.endsWith("]");
    }

    private String _normalizeOutput(String output) {
        String[] lines = output.replace("\r\n", "\n").split("\n", -1);
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            result.add(FormatHelpers.stripTrailingWhitespace(line));
        }
        while (!result.isEmpty() && result.get(0).isEmpty()) {
            result.remove(0);
        }
        while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return result.isEmpty() ? "" : String.join("\n", result) + "\n";
    }

    /**
     * Lays out one sequence of siblings line by line.
     */
    private final class BlockLayout {
        private final StringBuilder line = new StringBuilder();
        private int pendingNewlines = 0;
        private boolean pendingSpace = false;
        private boolean emitted = false;
        private boolean afterBlock = false;

        void addText(String text) {
            int i = 0;
            int length = text.length();
            while (i < length) {
                int start = i;
                if (Character.isWhitespace(text.charAt(i))) {
                    while (i < length && Character.isWhitespace(text.charAt(i))) {
                        i++;
                    }
                    int newlines = FormatHelpers.countNewlines(text.substring(start, i));
                    if (newlines > 0) {
                        pendingNewlines += newlines;
                    } else {
                        pendingSpace = true;
                    }
                } else {
                    while (i < length && !Character.isWhitespace(text.charAt(i))) {
                        i++;
                    }
                    addInline(text.substring(start, i));
                }
            }
        }

        void addInline(String content) {
            if (pendingNewlines > 0 || afterBlock) {
                _flush();
            }
            _separate();
            if (line.length() > 0 && pendingSpace) {
                line.append(' ');
            }
            line.append(content);
            pendingSpace = false;
            afterBlock = false;
        }

        void addBlock(Node node) {
            _flush();
            _separate();
            visit(node);
            emitted = true;
            afterBlock = true;
            pendingSpace = false;
        }

        void finish() {
            _flush();
        }

        // one blank line where the source had at least one, never at the start of a block
        private void _separate() {
            if (pendingNewlines >= 2 && emitted && line.length() == 0) {
                context.push("");
            }
            pendingNewlines = 0;
        }

        private void _flush() {
            if (line.length() > 0) {
                context.push(line.toString());
                line.setLength(0);
                emitted = true;
            }
        }
    }
}
