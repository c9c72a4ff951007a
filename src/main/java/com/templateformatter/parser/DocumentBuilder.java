package com.templateformatter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.templateformatter.ast.CdataNode;
import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.HtmlAttributeNameNode;
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
import com.templateformatter.ast.ParseError;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.ast.Token;
import com.templateformatter.ast.TokenType;
import com.templateformatter.ast.WhitespaceNode;

/**
 * Recursive-descent builder for one source string. Not reusable; {@link TemplateParser} creates
 * one per parse.
 */
final class DocumentBuilder {
    static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style", "textarea");

    private final String source;
    private final int length;
    private final boolean trackWhitespace;
    private final SourceIndex index;
    private final List<ParseError> errors = new ArrayList<>();
    private final ControlFlowGrouper grouper;
    private final Deque<String> openElements = new ArrayDeque<>();
    private int pos;

    DocumentBuilder(String source, boolean trackWhitespace) {
        this.source = source;
        this.length = source.length();
        this.trackWhitespace = trackWhitespace;
        this.index = new SourceIndex(source);
        this.grouper = new ControlFlowGrouper(index, errors);
    }

    ParseResult build() {
        List<Node> children = _parseNodes(null);
        DocumentNode document = new DocumentNode(children, index.locationOf(0, length), index.rangeOf(0, length),
                List.of());
        return new ParseResult(document, errors, source);
    }

    private List<Node> _parseNodes(String closingName) {
        List<Node> nodes = new ArrayList<>();
        while (pos < length) {
            if (_startsWith("</") && _isNameStart(pos + 2)) {
                String name = _peekName(pos + 2);
                if (closingName != null && name.equalsIgnoreCase(closingName)) {
                    break;
                }
                if (_isOpen(name)) {
                    // closes an ancestor, the current element stays unclosed
                    break;
                }
                nodes.add(_parseCloseTag(true));
            } else if (_atErb()) {
                nodes.add(_parseErb());
            } else if (_startsWith("<!--")) {
                nodes.add(_parseComment());
            } else if (source.regionMatches(true, pos, "<![CDATA[", 0, 9)) {
                nodes.add(_parseCdata());
            } else if (_startsWith("<!")) {
                nodes.add(_parseDoctype());
            } else if (_startsWith("<") && _isNameStart(pos + 1)) {
                nodes.add(_parseElement());
            } else {
                nodes.add(_parseText());
            }
        }
        return grouper.group(nodes);
    }

    private HtmlElementNode _parseElement() {
        int start = pos;
        Token opening = index.token(pos, pos + 1, TokenType.TAG_START);
        pos++;
        Token name = _readName();
        List<Node> children = _parseOpenTagContents();

        Token closing;
        List<ParseError> openTagErrors = new ArrayList<>();
        int selfClose = _selfCloseLength();
        if (selfClose > 0) {
            closing = index.token(pos, pos + selfClose, TokenType.TAG_SELF_CLOSE);
            pos += selfClose;
        } else if (_startsWith(">")) {
            closing = index.token(pos, pos + 1, TokenType.TAG_END);
            pos++;
        } else {
            closing = index.missing(pos);
            openTagErrors.add(_error("Unclosed open tag <" + name.getValue() + ">", start, pos));
        }

        String lowerName = name.getValue().toLowerCase(Locale.ROOT);
        boolean isVoid = VOID_ELEMENTS.contains(lowerName);
        HtmlOpenTagNode openTag = new HtmlOpenTagNode(opening, name, closing, grouper.group(children), isVoid,
                index.locationOf(start, pos), index.rangeOf(start, pos), openTagErrors);

        if (isVoid || openTag.isSelfClosing() || closing.getType() == TokenType.MISSING) {
            return new HtmlElementNode(openTag, name, List.of(), null, isVoid,
                    index.locationOf(start, pos), index.rangeOf(start, pos), List.of());
        }

        List<Node> body;
        if (RAW_TEXT_ELEMENTS.contains(lowerName)) {
            body = _parseRawText(lowerName);
        } else {
            openElements.push(lowerName);
            body = _parseNodes(lowerName);
            openElements.pop();
        }

        HtmlCloseTagNode closeTag = null;
        List<ParseError> elementErrors = new ArrayList<>();
        if (_atCloseTag(lowerName)) {
            closeTag = _parseCloseTag(false);
        } else {
            elementErrors.add(_error("Missing close tag for <" + name.getValue() + ">",
                    start, openTag.getRange().getTo()));
        }
        return new HtmlElementNode(openTag, name, body, closeTag, false,
                index.locationOf(start, pos), index.rangeOf(start, pos), elementErrors);
    }

    private List<Node> _parseOpenTagContents() {
        List<Node> children = new ArrayList<>();
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '>' || _selfCloseLength() > 0) {
                break;
            }
            if (Character.isWhitespace(c)) {
                WhitespaceNode whitespace = _parseWhitespace();
                if (trackWhitespace) {
                    children.add(whitespace);
                }
            } else if (_atErb()) {
                children.add(_parseErb());
            } else if (c == '<') {
                break;
            } else if (c == '=') {
                int start = pos++;
                children.add(new LiteralNode("=", index.locationOf(start, pos), index.rangeOf(start, pos),
                        List.of(_error("Unexpected '=' in open tag", start, pos))));
            } else {
                children.add(_parseAttribute());
            }
        }
        return children;
    }

    private HtmlAttributeNode _parseAttribute() {
        int start = pos;
        List<Node> nameChildren = new ArrayList<>();
        while (pos < length && _isAttributeNameChar()) {
            if (_atErb()) {
                nameChildren.add(_parseErb());
            } else {
                int literalStart = pos;
                while (pos < length && _isAttributeNameChar() && !_atErb()) {
                    pos++;
                }
                nameChildren.add(_literal(literalStart, pos));
            }
        }
        HtmlAttributeNameNode name = new HtmlAttributeNameNode(nameChildren, index.locationOf(start, pos),
                index.rangeOf(start, pos), List.of());

        int lookahead = pos;
        while (lookahead < length && Character.isWhitespace(source.charAt(lookahead))) {
            lookahead++;
        }
        if (lookahead >= length || source.charAt(lookahead) != '=') {
            return new HtmlAttributeNode(name, null, null, index.locationOf(start, pos), index.rangeOf(start, pos),
                    List.of());
        }
        int equalsStart = pos;
        pos = lookahead + 1;
        while (pos < length && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        Token equals = index.token(equalsStart, pos, TokenType.EQUALS);
        HtmlAttributeValueNode value = _parseAttributeValue();
        return new HtmlAttributeNode(name, equals, value, index.locationOf(start, pos), index.rangeOf(start, pos),
                List.of());
    }

    private HtmlAttributeValueNode _parseAttributeValue() {
        int start = pos;
        List<Node> children = new ArrayList<>();
        List<ParseError> valueErrors = new ArrayList<>();
        char quote = pos < length ? source.charAt(pos) : 0;

        if (quote == '"' || quote == '\'') {
            Token openQuote = index.token(pos, pos + 1, TokenType.QUOTE);
            pos++;
            while (pos < length && source.charAt(pos) != quote) {
                if (_atErb()) {
                    children.add(_parseErb());
                } else {
                    int literalStart = pos;
                    while (pos < length && source.charAt(pos) != quote && !_atErb()) {
                        pos++;
                    }
                    children.add(_literal(literalStart, pos));
                }
            }
            Token closeQuote;
            if (pos < length) {
                closeQuote = index.token(pos, pos + 1, TokenType.QUOTE);
                pos++;
            } else {
                closeQuote = index.missing(pos);
                valueErrors.add(_error("Unclosed attribute value", start, pos));
            }
            return new HtmlAttributeValueNode(openQuote, grouper.group(children), closeQuote, true,
                    index.locationOf(start, pos), index.rangeOf(start, pos), valueErrors);
        }

        while (pos < length && !Character.isWhitespace(source.charAt(pos)) && source.charAt(pos) != '>') {
            if (_atErb()) {
                children.add(_parseErb());
            } else {
                int literalStart = pos;
                while (pos < length && !Character.isWhitespace(source.charAt(pos))
                        && source.charAt(pos) != '>' && !_atErb()) {
                    pos++;
                }
                children.add(_literal(literalStart, pos));
            }
        }
        return new HtmlAttributeValueNode(null, grouper.group(children), null, false,
                index.locationOf(start, pos), index.rangeOf(start, pos), valueErrors);
    }

    private HtmlCloseTagNode _parseCloseTag(boolean stray) {
        int start = pos;
        Token opening = index.token(pos, pos + 2, TokenType.TAG_START_CLOSE);
        pos += 2;
        Token name = _readName();
        List<Node> children = new ArrayList<>();
        List<ParseError> closeErrors = new ArrayList<>();

        while (pos < length && source.charAt(pos) != '>' && source.charAt(pos) != '<') {
            if (Character.isWhitespace(source.charAt(pos))) {
                WhitespaceNode whitespace = _parseWhitespace();
                if (trackWhitespace) {
                    children.add(whitespace);
                }
            } else {
                int literalStart = pos;
                while (pos < length && !Character.isWhitespace(source.charAt(pos))
                        && source.charAt(pos) != '>' && source.charAt(pos) != '<') {
                    pos++;
                }
                children.add(_literal(literalStart, pos));
                closeErrors.add(_error("Unexpected content in close tag </" + name.getValue() + ">",
                        literalStart, pos));
            }
        }

        Token closing;
        if (pos < length && source.charAt(pos) == '>') {
            closing = index.token(pos, pos + 1, TokenType.TAG_END);
            pos++;
        } else {
            closing = index.missing(pos);
            closeErrors.add(_error("Unclosed close tag </" + name.getValue() + ">", start, pos));
        }
        if (stray) {
            closeErrors.add(_error("Unexpected close tag </" + name.getValue() + ">", start, pos));
        }
        return new HtmlCloseTagNode(opening, name, closing, children, index.locationOf(start, pos),
                index.rangeOf(start, pos), closeErrors);
    }

    private List<Node> _parseRawText(String name) {
        List<Node> nodes = new ArrayList<>();
        int textStart = pos;
        while (pos < length && !_atCloseTag(name)) {
            if (_atErb()) {
                if (pos > textStart) {
                    nodes.add(_text(textStart, pos));
                }
                nodes.add(_parseErb());
                textStart = pos;
            } else {
                pos++;
            }
        }
        if (pos > textStart) {
            nodes.add(_text(textStart, pos));
        }
        return grouper.group(nodes);
    }

    private ErbContentNode _parseErb() {
        int start = pos;
        String opening;
        if (_startsWith("<%==")) {
            opening = "<%==";
        } else if (_startsWith("<%=")) {
            opening = "<%=";
        } else if (_startsWith("<%-")) {
            opening = "<%-";
        } else if (_startsWith("<%#")) {
            opening = "<%#";
        } else {
            opening = "<%";
        }
        Token tagOpening = index.token(pos, pos + opening.length(), TokenType.ERB_START);
        pos += opening.length();

        List<ParseError> erbErrors = new ArrayList<>();
        Token content;
        Token tagClosing;
        int close = source.indexOf("%>", pos);
        if (close < 0) {
            content = index.token(pos, length, TokenType.ERB_CONTENT);
            pos = length;
            tagClosing = index.missing(pos);
            erbErrors.add(_error("Unclosed embedded tag " + opening, start, pos));
        } else {
            int contentEnd = close > pos && source.charAt(close - 1) == '-' ? close - 1 : close;
            content = index.token(pos, contentEnd, TokenType.ERB_CONTENT);
            tagClosing = index.token(contentEnd, close + 2, TokenType.ERB_END);
            pos = close + 2;
        }
        return new ErbContentNode(tagOpening, content, tagClosing, index.locationOf(start, pos),
                index.rangeOf(start, pos), erbErrors);
    }

    private HtmlCommentNode _parseComment() {
        int start = pos;
        Token opening = index.token(pos, pos + 4, TokenType.COMMENT_START);
        pos += 4;
        List<Node> children = new ArrayList<>();
        while (pos < length && !_startsWith("-->")) {
            if (_atErb()) {
                children.add(_parseErb());
            } else {
                int literalStart = pos;
                while (pos < length && !_startsWith("-->") && !_atErb()) {
                    pos++;
                }
                children.add(_literal(literalStart, pos));
            }
        }
        Token closing;
        List<ParseError> commentErrors = new ArrayList<>();
        if (pos < length) {
            closing = index.token(pos, pos + 3, TokenType.COMMENT_END);
            pos += 3;
        } else {
            closing = index.missing(pos);
            commentErrors.add(_error("Unclosed comment", start, pos));
        }
        return new HtmlCommentNode(opening, children, closing, index.locationOf(start, pos),
                index.rangeOf(start, pos), commentErrors);
    }

    private HtmlDoctypeNode _parseDoctype() {
        int start = pos;
        Token opening = index.token(pos, pos + 2, TokenType.DOCTYPE_START);
        pos += 2;
        int literalStart = pos;
        while (pos < length && source.charAt(pos) != '>') {
            pos++;
        }
        List<Node> children = new ArrayList<>();
        if (pos > literalStart) {
            children.add(_literal(literalStart, pos));
        }
        Token closing;
        List<ParseError> doctypeErrors = new ArrayList<>();
        if (pos < length) {
            closing = index.token(pos, pos + 1, TokenType.TAG_END);
            pos++;
        } else {
            closing = index.missing(pos);
            doctypeErrors.add(_error("Unclosed doctype", start, pos));
        }
        return new HtmlDoctypeNode(opening, children, closing, index.locationOf(start, pos),
                index.rangeOf(start, pos), doctypeErrors);
    }

    private CdataNode _parseCdata() {
        int start = pos;
        Token opening = index.token(pos, pos + 9, TokenType.CDATA_START);
        pos += 9;
        int end = source.indexOf("]]>", pos);
        List<Node> children = new ArrayList<>();
        List<ParseError> cdataErrors = new ArrayList<>();
        Token closing;
        if (end < 0) {
            if (length > pos) {
                children.add(_literal(pos, length));
            }
            pos = length;
            closing = index.missing(pos);
            cdataErrors.add(_error("Unclosed CDATA section", start, pos));
        } else {
            if (end > pos) {
                children.add(_literal(pos, end));
            }
            closing = index.token(end, end + 3, TokenType.CDATA_END);
            pos = end + 3;
        }
        return new CdataNode(opening, children, closing, index.locationOf(start, pos), index.rangeOf(start, pos),
                cdataErrors);
    }

    private HtmlTextNode _parseText() {
        int start = pos;
        pos++;
        while (pos < length && !_atMarkup()) {
            pos++;
        }
        return _text(start, pos);
    }

    private WhitespaceNode _parseWhitespace() {
        int start = pos;
        while (pos < length && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        Token value = index.token(start, pos, TokenType.WHITESPACE);
        return new WhitespaceNode(value, value.getLocation(), value.getRange(), List.of());
    }

    private Token _readName() {
        int start = pos;
        while (pos < length && _isNameChar(source.charAt(pos))) {
            pos++;
        }
        return index.token(start, pos, TokenType.IDENTIFIER);
    }

    private String _peekName(int from) {
        int end = from;
        while (end < length && _isNameChar(source.charAt(end))) {
            end++;
        }
        return source.substring(from, end);
    }

    private HtmlTextNode _text(int from, int to) {
        return new HtmlTextNode(source.substring(from, to), index.locationOf(from, to), index.rangeOf(from, to),
                List.of());
    }

    private LiteralNode _literal(int from, int to) {
        return new LiteralNode(source.substring(from, to), index.locationOf(from, to), index.rangeOf(from, to),
                List.of());
    }

    private ParseError _error(String message, int from, int to) {
        ParseError error = new ParseError(message, index.locationOf(from, to));
        errors.add(error);
        return error;
    }

    private boolean _atMarkup() {
        if (source.charAt(pos) != '<' || pos + 1 >= length) {
            return false;
        }
        char next = source.charAt(pos + 1);
        return _isNameStart(pos + 1)
                || next == '!'
                || (next == '/' && _isNameStart(pos + 2))
                || _atErb();
    }

    private boolean _atErb() {
        return _startsWith("<%") && !_startsWith("<%%");
    }

    private boolean _atCloseTag(String name) {
        return _startsWith("</") && _isNameStart(pos + 2) && _peekName(pos + 2).equalsIgnoreCase(name);
    }

    private boolean _isOpen(String name) {
        for (String open : openElements) {
            if (open.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean _isAttributeNameChar() {
        char c = source.charAt(pos);
        if (Character.isWhitespace(c) || c == '>' || c == '=' || _selfCloseLength() > 0) {
            return false;
        }
        return c != '<' || _atErb();
    }

    // "/>" with optional whitespace before the ">", as in <br/ >
    private int _selfCloseLength() {
        if (pos >= length || source.charAt(pos) != '/') {
            return 0;
        }
        int at = pos + 1;
        while (at < length && Character.isWhitespace(source.charAt(at))) {
            at++;
        }
        return at < length && source.charAt(at) == '>' ? at + 1 - pos : 0;
    }

    private boolean _startsWith(String prefix) {
        return source.startsWith(prefix, pos);
    }

    private boolean _isNameStart(int at) {
        return at < length && Character.isLetter(source.charAt(at));
    }

    private static boolean _isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
    }
}
