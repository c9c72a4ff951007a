package com.templateformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats, lints and fixes ERB templates.
 */
public interface TemplateFormatter {
    FormatterResult format(Path filePath, String source);

    FormatterResult lint(Path filePath, String source);

    FormatterResult fix(Path filePath, String source, boolean unsafe);

    Map<Path, FormatterResult> formatDirectory(Path directory);
}
