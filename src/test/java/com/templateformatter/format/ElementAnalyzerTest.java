package com.templateformatter.format;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.parser.TemplateParser;

class ElementAnalyzerTest {
    private FormatPrinter printer;

    @BeforeEach
    void setUp() {
        printer = new FormatPrinter(FormatOptions.defaults().withMaxLineLength(40));
    }

    private HtmlElementNode element(String source) {
        return (HtmlElementNode) TemplateParser.parse(source, true).getValue().getChildren().get(0);
    }

    @Test
    void testShortElementIsFullyInline() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<p>Hello <em>there</em></p>"));

        assertThat(analysis.isFullyInline()).isTrue();
    }

    @Test
    void testEmptyElementContentIsInline() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<div></div>"));

        assertThat(analysis.isElementContentInline()).isTrue();
        assertThat(analysis.isCloseTagInline()).isTrue();
    }

    @Test
    void testContentPreservingElementIsNeverInline() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<pre>x</pre>"));

        assertThat(analysis).isEqualTo(new ElementAnalysis(false, false, false));
    }

    @Test
    void testNewlineInContentForcesBlock() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<p>\nHello\n</p>"));

        assertThat(analysis.isOpenTagInline()).isTrue();
        assertThat(analysis.isBlockFormat()).isTrue();
    }

    @Test
    void testBlockChildForcesBlock() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<div><p>x</p></div>"));

        assertThat(analysis.isElementContentInline()).isFalse();
    }

    @Test
    void testControlFlowInContentForcesBlock() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<p><% if a %>x<% end %></p>"));

        assertThat(analysis.isElementContentInline()).isFalse();
    }

    @Test
    void testOverlongContentIsBlock() {
        ElementAnalysis analysis = printer.getAnalyzer()
                .analyze(element("<p>This sentence is clearly longer than forty characters.</p>"));

        assertThat(analysis.isOpenTagInline()).isTrue();
        assertThat(analysis.isElementContentInline()).isFalse();
    }

    @Test
    void testOpenTagWrapsOnlyWithSeveralAttributesAndOverflow() {
        ElementAnalyzer analyzer = printer.getAnalyzer();

        assertThat(analyzer.analyze(element("<p id=\"a\" class=\"b\"></p>")).isOpenTagInline()).isTrue();
        assertThat(analyzer.analyze(element(
                "<p id=\"first-identifier\" class=\"second-class-name\"></p>")).isOpenTagInline()).isFalse();
        assertThat(analyzer.analyze(element(
                "<p class=\"one-single-attribute-that-is-very-long\"></p>")).isOpenTagInline()).isTrue();
    }

    @Test
    void testVoidElementIsInlineRegardlessOfBody() {
        ElementAnalysis analysis = printer.getAnalyzer().analyze(element("<img src=\"a.png\">"));

        assertThat(analysis.isFullyInline()).isTrue();
    }

    @Test
    void testResultsAreCachedByIdentity() {
        HtmlElementNode node = element("<p>x</p>");
        ElementAnalyzer analyzer = printer.getAnalyzer();

        assertThat(analyzer.analyze(node)).isSameAs(analyzer.analyze(node));
    }
}
