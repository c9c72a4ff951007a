package com.templateformatter.format;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.HtmlTextNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.WhitespaceNode;
import com.templateformatter.util.LoggerUtil;

/**
 * Decides, per element, which of its three parts stay on one line.
 *
 * <p>Results are cached by node identity for the lifetime of one formatting run. Line lengths
 * are measured by rendering speculatively through the printer's capture at the printer's
 * current indent.
 */
public class ElementAnalyzer {
    private static final Logger logger = LoggerUtil.getLogger(ElementAnalyzer.class);

    private final FormatPrinter printer;
    private final FormatOptions options;
    private final Map<HtmlElementNode, ElementAnalysis> cache = new IdentityHashMap<>();

    public ElementAnalyzer(FormatPrinter printer, FormatOptions options) {
        this.printer = printer;
        this.options = options;
    }

    public ElementAnalysis analyze(HtmlElementNode element) {
        ElementAnalysis cached = cache.get(element);
        if (cached != null) {
            return cached;
        }
        ElementAnalysis analysis = _analyze(element);
        cache.put(element, analysis);
        logger.finest(() -> "<" + element.getTagNameValue() + "> " + analysis);
        return analysis;
    }

    void reset() {
        cache.clear();
    }

    private ElementAnalysis _analyze(HtmlElementNode element) {
        String tagName = FormatHelpers.tagName(element);

        if (options.isContentPreserving(tagName)) {
            return ElementAnalysis.PRESERVED;
        }

        boolean openTagInline = _shouldRenderOpenTagInline(element);
        if (printer.isVoidElement(element) || (element.getCloseTag() == null && element.getBody().isEmpty())) {
            return new ElementAnalysis(openTagInline, true, true);
        }

        boolean contentInline = _shouldRenderContentInline(element, openTagInline);
        return new ElementAnalysis(openTagInline, contentInline, contentInline);
    }

    private boolean _shouldRenderOpenTagInline(HtmlElementNode element) {
        HtmlOpenTagNode openTag = element.getOpenTag();
        if (FormatHelpers.hasControlFlow(openTag.getChildren())) {
            return false;
        }
        if (FormatHelpers.countAttributes(openTag) <= 1) {
            return true;
        }
        String rendered = printer.renderOpenTag(openTag, printer.isVoidElement(element));
        return printer.getContext().indentColumns() + rendered.length() <= options.getMaxLineLength();
    }

    private boolean _shouldRenderContentInline(HtmlElementNode element, boolean openTagInline) {
        List<Node> body = element.getBody();
        if (body.isEmpty()) {
            return true;
        }
        if (!openTagInline || _hasForcedBlockSignal(body)) {
            return false;
        }
        for (Node child : body) {
            if (!_isInlineChild(child)) {
                return false;
            }
        }
        String rendered = printer.renderInline(element);
        return printer.getContext().indentColumns() + rendered.length() <= options.getMaxLineLength();
    }

    /**
     * A newline in body text (which includes blank-line separators), a nested block-level element
     * or embedded control flow always breaks the content onto its own lines.
     */
    private boolean _hasForcedBlockSignal(List<Node> body) {
        for (Node child : body) {
            if (child instanceof HtmlTextNode && ((HtmlTextNode) child).getContent().indexOf('\n') >= 0) {
                return true;
            }
            if (FormatHelpers.isControlFlow(child)) {
                return true;
            }
            if (child instanceof HtmlElementNode
                    && !options.isInlineElement(((HtmlElementNode) child).getTagNameValue())) {
                return true;
            }
        }
        return false;
    }

    private boolean _isInlineChild(Node node) {
        if (node instanceof HtmlTextNode || node instanceof WhitespaceNode) {
            return true;
        }
        if (node instanceof ErbContentNode) {
            ErbContentNode tag = (ErbContentNode) node;
            return tag.isOutput() && tag.getContentValue().indexOf('\n') < 0;
        }
        if (node instanceof HtmlElementNode) {
            HtmlElementNode element = (HtmlElementNode) node;
            return options.isInlineElement(element.getTagNameValue()) && _hasInlineStructure(element);
        }
        return false;
    }

    // Length-independent check; the parent's own measurement covers the child's width.
    private boolean _hasInlineStructure(HtmlElementNode element) {
        if (options.isContentPreserving(element.getTagNameValue())) {
            return false;
        }
        if (FormatHelpers.hasControlFlow(element.getOpenTag().getChildren())) {
            return false;
        }
        List<Node> body = element.getBody();
        if (body.isEmpty()) {
            return true;
        }
        if (_hasForcedBlockSignal(body)) {
            return false;
        }
        for (Node child : body) {
            if (!_isInlineChild(child)) {
                return false;
            }
        }
        return true;
    }
}
