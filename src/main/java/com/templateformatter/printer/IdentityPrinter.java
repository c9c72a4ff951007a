package com.templateformatter.printer;

import java.util.List;

import com.templateformatter.ast.CdataNode;
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
import com.templateformatter.ast.Token;
import com.templateformatter.ast.WhitespaceNode;

/**
 * Re-emits every token exactly as parsed.
 *
 * <p>For a tree parsed with whitespace tracking, printing the unmodified root reproduces the
 * source character for character. In a partially edited tree every untouched subtree still
 * prints its original text.
 */
public class IdentityPrinter extends Printer {

    public IdentityPrinter() {
        super(new PrintContext());
    }

    /**
     * Prints a node, ignoring parse errors.
     */
    public static String printNode(Node node) {
        return new IdentityPrinter().print(node, true);
    }

    /**
     * Prints a sequence of sibling nodes, ignoring parse errors.
     */
    public static String printNodes(List<? extends Node> nodes) {
        IdentityPrinter printer = new IdentityPrinter();
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            sb.append(printer.print(node, true));
        }
        return sb.toString();
    }

    @Override
    public void visitHtmlElementNode(HtmlElementNode node) {
        visit(node.getOpenTag());
        visitAll(node.getBody());
        visit(node.getCloseTag());
    }

    @Override
    public void visitHtmlOpenTagNode(HtmlOpenTagNode node) {
        _token(node.getTagOpening());
        _token(node.getTagName());
        visitAll(node.getChildren());
        _token(node.getTagClosing());
    }

    @Override
    public void visitHtmlCloseTagNode(HtmlCloseTagNode node) {
        _token(node.getTagOpening());
        _token(node.getTagName());
        visitAll(node.getChildren());
        _token(node.getTagClosing());
    }

    @Override
    public void visitHtmlAttributeNode(HtmlAttributeNode node) {
        visit(node.getName());
        _token(node.getEquals());
        visit(node.getValue());
    }

    @Override
    public void visitHtmlAttributeValueNode(HtmlAttributeValueNode node) {
        _token(node.getOpenQuote());
        visitAll(node.getChildren());
        _token(node.getCloseQuote());
    }

    @Override
    public void visitHtmlTextNode(HtmlTextNode node) {
        write(node.getContent());
    }

    @Override
    public void visitLiteralNode(LiteralNode node) {
        write(node.getContent());
    }

    @Override
    public void visitWhitespaceNode(WhitespaceNode node) {
        _token(node.getValue());
    }

    @Override
    public void visitHtmlCommentNode(HtmlCommentNode node) {
        _token(node.getTagOpening());
        visitAll(node.getChildren());
        _token(node.getTagClosing());
    }

    @Override
    public void visitHtmlDoctypeNode(HtmlDoctypeNode node) {
        _token(node.getTagOpening());
        visitAll(node.getChildren());
        _token(node.getTagClosing());
    }

    @Override
    public void visitCdataNode(CdataNode node) {
        _token(node.getTagOpening());
        visitAll(node.getChildren());
        _token(node.getTagClosing());
    }

    @Override
    public void visitErbContentNode(ErbContentNode node) {
        _erbTag(node);
    }

    @Override
    public void visitErbIfNode(ErbIfNode node) {
        _erbTag(node);
        visitAll(node.getBody());
        visit(node.getSubsequent());
        visit(node.getEndNode());
    }

    @Override
    public void visitErbElseNode(ErbElseNode node) {
        _erbTag(node);
        visitAll(node.getBody());
    }

    @Override
    public void visitErbCaseNode(ErbCaseNode node) {
        _erbTag(node);
        visitAll(node.getChildren());
        visitAll(node.getConditions());
        visit(node.getElseClause());
        visit(node.getEndNode());
    }

    @Override
    public void visitErbWhenNode(ErbWhenNode node) {
        _erbTag(node);
        visitAll(node.getBody());
    }

    @Override
    public void visitErbLoopNode(ErbLoopNode node) {
        _erbTag(node);
        visitAll(node.getBody());
        visit(node.getEndNode());
    }

    @Override
    public void visitErbBlockNode(ErbBlockNode node) {
        _erbTag(node);
        visitAll(node.getBody());
        visit(node.getEndNode());
    }

    @Override
    public void visitErbEndNode(ErbEndNode node) {
        _erbTag(node);
    }

    private void _erbTag(ErbNode node) {
        _token(node.getTagOpening());
        _token(node.getContent());
        _token(node.getTagClosing());
    }

    private void _token(Token token) {
        if (token != null) {
            write(token.getValue());
        }
    }
}
