package com.templateformatter.ast;

import java.util.List;

/**
 * Common shape of every embedded-code node: an opening delimiter, the code content and a
 * closing delimiter.
 */
public abstract class ErbNode extends Node {
    private final Token tagOpening;
    private final Token content;
    private final Token tagClosing;

    protected ErbNode(Token tagOpening, Token content, Token tagClosing,
                      Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.tagOpening = tagOpening;
        this.content = content;
        this.tagClosing = tagClosing;
    }

    public Token getTagOpening() { return tagOpening; }
    public Token getContent() { return content; }
    public Token getTagClosing() { return tagClosing; }

    public String getContentValue() {
        return content == null ? "" : content.getValue();
    }

    public boolean isComment() {
        return "<%#".equals(tagOpening.getValue());
    }

    public boolean isOutput() {
        return tagOpening.getValue().startsWith("<%=");
    }
}
