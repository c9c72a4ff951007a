package com.templateformatter.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.templateformatter.ast.ErbBlockNode;
import com.templateformatter.ast.ErbCaseNode;
import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.ErbElseNode;
import com.templateformatter.ast.ErbEndNode;
import com.templateformatter.ast.ErbIfNode;
import com.templateformatter.ast.ErbLoopNode;
import com.templateformatter.ast.ErbWhenNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.ParseError;

/**
 * Nests embedded control flow inside one ordered sequence of sibling nodes.
 *
 * <p>The document builder produces every embedded tag as a flat {@link ErbContentNode}. This pass
 * turns {@code if/elsif/else/end}, {@code case/when/else/end}, loops and {@code do} blocks into
 * their structured nodes. A construct must open and close within the same sequence; anything
 * left unmatched is reported as a parse error.
 */
final class ControlFlowGrouper {

    enum Kind { IF, ELSIF, ELSE, CASE, WHEN, LOOP, BLOCK, END, NONE }

    private static final Pattern IF = Pattern.compile("^(if|unless)\\b");
    private static final Pattern ELSIF = Pattern.compile("^elsif\\b");
    private static final Pattern ELSE = Pattern.compile("^else\\b");
    private static final Pattern CASE = Pattern.compile("^case\\b");
    private static final Pattern WHEN = Pattern.compile("^(when|in)\\b");
    private static final Pattern LOOP = Pattern.compile("^(for|while|until)\\b");
    private static final Pattern BLOCK = Pattern.compile("(\\bdo\\s*(\\|[^|]*\\|)?|^begin)\\s*$");
    private static final Pattern END = Pattern.compile("^end\\b");
    private static final Pattern INLINE_END = Pattern.compile("\\bend\\s*$");

    private static final Set<Kind> BRANCH_STOPS = EnumSet.of(Kind.ELSIF, Kind.ELSE, Kind.END);
    private static final Set<Kind> CASE_STOPS = EnumSet.of(Kind.WHEN, Kind.ELSE, Kind.END);
    private static final Set<Kind> END_STOP = EnumSet.of(Kind.END);

    private final SourceIndex index;
    private final List<ParseError> errors;

    ControlFlowGrouper(SourceIndex index, List<ParseError> errors) {
        this.index = index;
        this.errors = errors;
    }

    List<Node> group(List<Node> nodes) {
        boolean hasControlFlow = false;
        for (Node node : nodes) {
            if (classify(node) != Kind.NONE) {
                hasControlFlow = true;
                break;
            }
        }
        if (!hasControlFlow) {
            return nodes;
        }
        return _sequence(new Cursor(nodes), EnumSet.noneOf(Kind.class));
    }

    static Kind classify(Node node) {
        if (!(node instanceof ErbContentNode)) {
            return Kind.NONE;
        }
        ErbContentNode tag = (ErbContentNode) node;
        if (tag.isComment()) {
            return Kind.NONE;
        }
        String code = tag.getContentValue().trim();

        if (BLOCK.matcher(code).find()) {
            return Kind.BLOCK;
        }
        if (tag.isOutput()) {
            return Kind.NONE;
        }
        if (END.matcher(code).find()) {
            return Kind.END;
        }
        if (ELSIF.matcher(code).find()) {
            return Kind.ELSIF;
        }
        if (ELSE.matcher(code).find()) {
            return Kind.ELSE;
        }
        if (WHEN.matcher(code).find()) {
            return Kind.WHEN;
        }
        if (INLINE_END.matcher(code).find()) {
            // a complete one-line construct such as "if x then y end"
            return Kind.NONE;
        }
        if (IF.matcher(code).find()) {
            return Kind.IF;
        }
        if (CASE.matcher(code).find()) {
            return Kind.CASE;
        }
        if (LOOP.matcher(code).find()) {
            return Kind.LOOP;
        }
        return Kind.NONE;
    }

    private List<Node> _sequence(Cursor cursor, Set<Kind> stops) {
        List<Node> result = new ArrayList<>();
        while (cursor.hasNext()) {
            Node node = cursor.peek();
            Kind kind = classify(node);
            if (stops.contains(kind)) {
                return result;
            }
            cursor.next();
            switch (kind) {
                case IF -> result.add(_parseIf((ErbContentNode) node, cursor));
                case CASE -> result.add(_parseCase((ErbContentNode) node, cursor));
                case LOOP, BLOCK -> result.add(_parseBlock((ErbContentNode) node, kind, cursor));
                case ELSIF, ELSE, WHEN, END -> result.add(_unexpected((ErbContentNode) node));
                default -> result.add(node);
            }
        }
        return result;
    }

    private ErbIfNode _parseIf(ErbContentNode open, Cursor cursor) {
        List<Node> body = _sequence(cursor, BRANCH_STOPS);
        Node subsequent = _parseSubsequent(cursor);
        List<ParseError> nodeErrors = new ArrayList<>();
        ErbEndNode end = _parseEnd(open, cursor, nodeErrors);
        int from = open.getRange().getFrom();
        int to = cursor.lastEnd();
        return new ErbIfNode(open.getTagOpening(), open.getContent(), open.getTagClosing(), body, subsequent, end,
                index.locationOf(from, to), index.rangeOf(from, to), nodeErrors);
    }

    private Node _parseSubsequent(Cursor cursor) {
        if (!cursor.hasNext()) {
            return null;
        }
        Node next = cursor.peek();
        Kind kind = classify(next);
        if (kind == Kind.ELSIF) {
            cursor.next();
            ErbContentNode tag = (ErbContentNode) next;
            List<Node> body = _sequence(cursor, BRANCH_STOPS);
            Node subsequent = _parseSubsequent(cursor);
            int from = tag.getRange().getFrom();
            int to = cursor.lastEnd();
            return new ErbIfNode(tag.getTagOpening(), tag.getContent(), tag.getTagClosing(), body, subsequent, null,
                    index.locationOf(from, to), index.rangeOf(from, to), List.of());
        }
        if (kind == Kind.ELSE) {
            cursor.next();
            return _parseElse((ErbContentNode) next, cursor);
        }
        return null;
    }

    private ErbElseNode _parseElse(ErbContentNode tag, Cursor cursor) {
        List<Node> body = _sequence(cursor, END_STOP);
        int from = tag.getRange().getFrom();
        int to = cursor.lastEnd();
        return new ErbElseNode(tag.getTagOpening(), tag.getContent(), tag.getTagClosing(), body,
                index.locationOf(from, to), index.rangeOf(from, to), List.of());
    }

    private ErbCaseNode _parseCase(ErbContentNode open, Cursor cursor) {
        List<Node> children = _sequence(cursor, CASE_STOPS);
        List<ErbWhenNode> conditions = new ArrayList<>();
        while (cursor.hasNext() && classify(cursor.peek()) == Kind.WHEN) {
            ErbContentNode tag = (ErbContentNode) cursor.next();
            List<Node> body = _sequence(cursor, CASE_STOPS);
            int from = tag.getRange().getFrom();
            int to = cursor.lastEnd();
            conditions.add(new ErbWhenNode(tag.getTagOpening(), tag.getContent(), tag.getTagClosing(), body,
                    index.locationOf(from, to), index.rangeOf(from, to), List.of()));
        }
        ErbElseNode elseClause = null;
        if (cursor.hasNext() && classify(cursor.peek()) == Kind.ELSE) {
            elseClause = _parseElse((ErbContentNode) cursor.next(), cursor);
        }
        List<ParseError> nodeErrors = new ArrayList<>();
        ErbEndNode end = _parseEnd(open, cursor, nodeErrors);
        int from = open.getRange().getFrom();
        int to = cursor.lastEnd();
        return new ErbCaseNode(open.getTagOpening(), open.getContent(), open.getTagClosing(), children, conditions,
                elseClause, end, index.locationOf(from, to), index.rangeOf(from, to), nodeErrors);
    }

    private Node _parseBlock(ErbContentNode open, Kind kind, Cursor cursor) {
        List<Node> body = _sequence(cursor, END_STOP);
        List<ParseError> nodeErrors = new ArrayList<>();
        ErbEndNode end = _parseEnd(open, cursor, nodeErrors);
        int from = open.getRange().getFrom();
        int to = cursor.lastEnd();
        if (kind == Kind.LOOP) {
            return new ErbLoopNode(open.getTagOpening(), open.getContent(), open.getTagClosing(), body, end,
                    index.locationOf(from, to), index.rangeOf(from, to), nodeErrors);
        }
        return new ErbBlockNode(open.getTagOpening(), open.getContent(), open.getTagClosing(), body, end,
                index.locationOf(from, to), index.rangeOf(from, to), nodeErrors);
    }

    private ErbEndNode _parseEnd(ErbContentNode open, Cursor cursor, List<ParseError> nodeErrors) {
        if (cursor.hasNext() && classify(cursor.peek()) == Kind.END) {
            ErbContentNode tag = (ErbContentNode) cursor.next();
            return new ErbEndNode(tag.getTagOpening(), tag.getContent(), tag.getTagClosing(),
                    tag.getLocation(), tag.getRange(), tag.getErrors());
        }
        ParseError error = new ParseError("Missing end for `" + open.getContentValue().trim() + "`",
                open.getLocation());
        errors.add(error);
        nodeErrors.add(error);
        return null;
    }

    private ErbContentNode _unexpected(ErbContentNode tag) {
        ParseError error = new ParseError("Unexpected `" + tag.getContentValue().trim() + "`", tag.getLocation());
        errors.add(error);
        List<ParseError> nodeErrors = new ArrayList<>(tag.getErrors());
        nodeErrors.add(error);
        return new ErbContentNode(tag.getTagOpening(), tag.getContent(), tag.getTagClosing(),
                tag.getLocation(), tag.getRange(), nodeErrors);
    }

    private static final class Cursor {
        private final List<Node> nodes;
        private int position;
        private int lastEnd;

        Cursor(List<Node> nodes) {
            this.nodes = nodes;
            this.lastEnd = nodes.isEmpty() ? 0 : nodes.get(0).getRange().getFrom();
        }

        boolean hasNext() {
            return position < nodes.size();
        }

        Node peek() {
            return nodes.get(position);
        }

        Node next() {
            Node node = nodes.get(position++);
            lastEnd = node.getRange().getTo();
            return node;
        }

        int lastEnd() {
            return lastEnd;
        }
    }
}
