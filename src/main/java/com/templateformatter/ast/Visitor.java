package com.templateformatter.ast;

import java.util.List;

/**
 * Depth-first traversal with one hook per node kind.
 *
 * <p>Every hook defaults to {@link #visitChildNodes(Node)}. Continuation is explicit: a subclass
 * overriding a hook only descends into the node's children when it calls the super hook or
 * {@code visitChildNodes} itself, so it can skip, reorder or stop descent.
 */
public class Visitor {

    public void visit(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }

    public void visitAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            visit(node);
        }
    }

    public void visitChildNodes(Node node) {
        for (Node child : node.childNodes()) {
            visit(child);
        }
    }

    public void visitDocumentNode(DocumentNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlElementNode(HtmlElementNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlOpenTagNode(HtmlOpenTagNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlCloseTagNode(HtmlCloseTagNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlAttributeNode(HtmlAttributeNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlAttributeNameNode(HtmlAttributeNameNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlAttributeValueNode(HtmlAttributeValueNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlTextNode(HtmlTextNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlCommentNode(HtmlCommentNode node) {
        visitChildNodes(node);
    }

    public void visitHtmlDoctypeNode(HtmlDoctypeNode node) {
        visitChildNodes(node);
    }

    public void visitCdataNode(CdataNode node) {
        visitChildNodes(node);
    }

    public void visitWhitespaceNode(WhitespaceNode node) {
        visitChildNodes(node);
    }

    public void visitLiteralNode(LiteralNode node) {
        visitChildNodes(node);
    }

    public void visitErbContentNode(ErbContentNode node) {
        visitChildNodes(node);
    }

    public void visitErbIfNode(ErbIfNode node) {
        visitChildNodes(node);
    }

    public void visitErbElseNode(ErbElseNode node) {
        visitChildNodes(node);
    }

    public void visitErbCaseNode(ErbCaseNode node) {
        visitChildNodes(node);
    }

    public void visitErbWhenNode(ErbWhenNode node) {
        visitChildNodes(node);
    }

    public void visitErbLoopNode(ErbLoopNode node) {
        visitChildNodes(node);
    }

    public void visitErbBlockNode(ErbBlockNode node) {
        visitChildNodes(node);
    }

    public void visitErbEndNode(ErbEndNode node) {
        visitChildNodes(node);
    }
}
