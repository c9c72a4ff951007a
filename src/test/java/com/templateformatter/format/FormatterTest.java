package com.templateformatter.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.api.FormatterResult;
import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.DocumentNode;
import com.templateformatter.rewriter.AstRewriter;
import com.templateformatter.rewriter.StringRewriter;

class FormatterTest {
    private static final Path FILE = Paths.get("app/views/users/show.html.erb");

    @Test
    void testFormatsValidTemplate() {
        FormatterResult result = new Formatter().format(FILE, "<div><p>A</p></div>", false);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isIgnored()).isFalse();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("<div>\n  <p>A</p>\n</div>\n");
    }

    @Test
    void testTemplateWithParseErrorsIsReturnedUnchanged() {
        String source = "<div>\n<span>x</div>";

        FormatterResult result = new Formatter().format(FILE, source, false);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.hasErrorsAtLeast(Severity.FATAL)).isTrue();
        FormatterError error = result.getErrors().get(0);
        assertThat(error.getMessage()).isEqualTo("Missing close tag for <span>");
        assertThat(error.getLine()).isEqualTo(2);
    }

    @Test
    void testIgnoreDirectiveSkipsFormatting() {
        String source = "<%# herb:formatter ignore %>\n<div><p>A</p></div>";

        FormatterResult result = new Formatter().format(FILE, source, false);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isIgnored()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo(source);
    }

    @Test
    void testForceOverridesIgnoreDirective() {
        String source = "<%# herb:formatter ignore %>\n<div><p>A</p></div>";

        FormatterResult result = new Formatter().format(FILE, source, true);

        assertThat(result.isIgnored()).isFalse();
        assertThat(result.getFormattedCode())
                .isEqualTo("<%# herb:formatter ignore %>\n<div>\n  <p>A</p>\n</div>\n");
    }

    @Test
    void testDirectiveMustBeAnErbComment() {
        String source = "<!-- herb:formatter ignore --><div><p>A</p></div>";

        assertThat(new Formatter().format(FILE, source, false).isIgnored()).isFalse();
    }

    @Test
    void testRewritersRunAroundPrinting() {
        AstRewriter dropAll = new AstRewriter() {
            @Override
            public String getName() {
                return "drop-all";
            }

            @Override
            public String getDescription() {
                return "Removes every top-level node";
            }

            @Override
            public DocumentNode rewrite(DocumentNode root, FormatContext context) {
                root.getChildren().subList(1, root.getChildren().size()).clear();
                return root;
            }
        };
        StringRewriter banner = new StringRewriter() {
            @Override
            public String getName() {
                return "banner";
            }

            @Override
            public String getDescription() {
                return "Prepends the file name";
            }

            @Override
            public String rewrite(String formatted, FormatContext context) {
                return "<%# " + context.getFilePath().getFileName() + " indent="
                        + context.getOptions().getIndentWidth() + " %>\n" + formatted;
            }
        };

        Formatter formatter = new Formatter(FormatOptions.defaults(), List.of(dropAll), List.of(banner));
        FormatterResult result = formatter.format(FILE, "<p>keep</p><p>drop</p>", false);

        assertThat(result.getFormattedCode()).isEqualTo("<%# show.html.erb indent=2 %>\n<p>keep</p>\n");
    }

    @Test
    void testFormatStringShortcut() {
        assertThat(new Formatter().format("<%=x%>")).isEqualTo("<%= x %>\n");
        assertThat(new Formatter().format("<p>")).isEqualTo("<p>");
    }
}
