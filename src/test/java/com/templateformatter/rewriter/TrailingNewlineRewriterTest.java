package com.templateformatter.rewriter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TrailingNewlineRewriterTest {
    private final TrailingNewlineRewriter rewriter = new TrailingNewlineRewriter();

    @Test
    void testEndsWithExactlyOneNewline() {
        assertThat(rewriter.rewrite("<p></p>", null)).isEqualTo("<p></p>\n");
        assertThat(rewriter.rewrite("<p></p>\r\n\n\n", null)).isEqualTo("<p></p>\n");
    }

    @Test
    void testEmptyOutputStaysEmpty() {
        assertThat(rewriter.rewrite("", null)).isEmpty();
    }
}
