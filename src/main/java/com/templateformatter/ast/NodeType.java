package com.templateformatter.ast;

public enum NodeType {
    DOCUMENT,
    HTML_ELEMENT,
    HTML_OPEN_TAG,
    HTML_CLOSE_TAG,
    HTML_ATTRIBUTE,
    HTML_ATTRIBUTE_NAME,
    HTML_ATTRIBUTE_VALUE,
    HTML_TEXT,
    HTML_COMMENT,
    HTML_DOCTYPE,
    CDATA,
    WHITESPACE,
    LITERAL,
    ERB_CONTENT,
    ERB_IF,
    ERB_ELSE,
    ERB_CASE,
    ERB_WHEN,
    ERB_LOOP,
    ERB_BLOCK,
    ERB_END
}
