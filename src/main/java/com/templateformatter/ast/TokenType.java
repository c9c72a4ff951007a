package com.templateformatter.ast;

public enum TokenType {
    TAG_START,          // <
    TAG_START_CLOSE,    // </
    TAG_END,            // >
    TAG_SELF_CLOSE,     // />
    IDENTIFIER,
    EQUALS,
    QUOTE,
    WHITESPACE,
    ERB_START,
    ERB_CONTENT,
    ERB_END,
    COMMENT_START,
    COMMENT_END,
    DOCTYPE_START,
    CDATA_START,
    CDATA_END,
    MISSING             // zero-width placeholder for an absent terminator
}
