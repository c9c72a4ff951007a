package com.templateformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsErrorWithRuleName() {
        FormatterError error = new FormatterError(Severity.ERROR, "Tag name should be lowercase", 3, 4,
                "html-tag-name-lowercase");

        assertThat(plain.formatError(error)).isEqualTo("ERROR 3:4 Tag name should be lowercase [html-tag-name-lowercase]");
    }

    @Test
    void formatsErrorWithoutRuleName() {
        FormatterError error = new FormatterError(Severity.FATAL, "Missing close tag for <span>", 1, 0);

        assertThat(plain.formatError(error)).isEqualTo("FATAL 1:0 Missing close tag for <span>");
    }

    @Test
    void colorizesOnlyWhenEnabled() {
        ErrorFormatter colored = new ErrorFormatter(true);

        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
        assertThat(colored.colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
        assertThat(colored.formatError(new FormatterError(Severity.WARNING, "m", 1, 1)))
                .startsWith(ErrorFormatter.ANSI_YELLOW + "WARNING");
    }

    @Test
    void groupsBySeverity() {
        List<FormatterError> errors = List.of(
                new FormatterError(Severity.ERROR, "a", 1, 0),
                new FormatterError(Severity.INFO, "b", 2, 0),
                new FormatterError(Severity.ERROR, "c", 3, 0));

        Map<Severity, List<FormatterError>> grouped = plain.groupBySeverity(errors);

        assertThat(grouped.get(Severity.ERROR)).hasSize(2);
        assertThat(grouped.get(Severity.INFO)).hasSize(1);
        assertThat(grouped).doesNotContainKey(Severity.FATAL);
    }

    @Test
    void summarizesCountsPerFile() {
        Path first = Paths.get("a.html.erb");
        Path second = Paths.get("b.html.erb");
        Path clean = Paths.get("c.html.erb");
        Map<Path, List<FormatterError>> fileErrors = new LinkedHashMap<>();
        fileErrors.put(first, List.of(
                new FormatterError(Severity.ERROR, "a", 1, 0),
                new FormatterError(Severity.ERROR, "b", 2, 0),
                new FormatterError(Severity.WARNING, "c", 3, 0)));
        fileErrors.put(second, List.of(new FormatterError(Severity.FATAL, "d", 1, 0)));
        fileErrors.put(clean, List.of());

        String summary = plain.formatErrorSummary(fileErrors);

        assertThat(summary).startsWith("Summary:\n");
        assertThat(summary).contains(first + ": 2 errors, 1 warnings\n");
        assertThat(summary).contains(second + ": 1 fatal\n");
        assertThat(summary).doesNotContain(clean.toString());
        assertThat(summary).endsWith("\nTotal: 1 fatal, 2 errors, 1 warnings");
    }

    @Test
    void summaryWithoutProblems() {
        assertThat(plain.formatErrorSummary(Map.of())).isEqualTo("Summary:\n\nTotal: no problems");
    }
}
