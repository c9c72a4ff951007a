package com.templateformatter.rewriter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.format.FormatContext;
import com.templateformatter.format.FormatOptions;
import com.templateformatter.format.Formatter;
import com.templateformatter.parser.TemplateParser;
import com.templateformatter.printer.IdentityPrinter;

class TailwindClassSorterTest {

    @Test
    void testSortKeyIgnoresVariants() {
        assertThat(TailwindClassSorter.sortKey("flex")).isZero();
        assertThat(TailwindClassSorter.sortKey("md:hover:bg-blue-500")).isEqualTo(6);
        assertThat(TailwindClassSorter.sortKey("my-widget")).isEqualTo(TailwindClassSorter.UNKNOWN_RANK);
    }

    @Test
    void testSortsByGroupThenName() {
        assertThat(TailwindClassSorter.sortClasses("  p-4 custom flex text-sm  hover:bg-blue-500 bg-red-500 mt-2 "))
                .isEqualTo("flex mt-2 p-4 text-sm bg-red-500 hover:bg-blue-500 custom");
        assertThat(TailwindClassSorter.sortClasses("   ")).isEmpty();
    }

    @Test
    void testRewritesStaticClassValuesOnly() {
        DocumentNode root = TemplateParser.parse(
                "<div class=\"p-4 flex\"><span class=\"<%= css %> p-2 block\"></span></div>", true).getValue();
        FormatContext context = new FormatContext(null, "", FormatOptions.defaults());

        DocumentNode rewritten = new TailwindClassSorter().rewrite(root, context);

        assertThat(IdentityPrinter.printNode(rewritten))
                .isEqualTo("<div class=\"flex p-4\"><span class=\"<%= css %> p-2 block\"></span></div>");
    }

    @Test
    void testRunsAsPreFormatRewriter() {
        Formatter formatter = new Formatter(FormatOptions.defaults(), List.of(new TailwindClassSorter()), List.of());

        assertThat(formatter.format("<p class='text-sm  mt-2 block'>x</p>"))
                .isEqualTo("<p class=\"block mt-2 text-sm\">x</p>\n");
    }
}
