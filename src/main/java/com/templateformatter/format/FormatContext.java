package com.templateformatter.format;

import java.nio.file.Path;

/**
 * What a rewriter knows about the template being formatted.
 */
public class FormatContext {
    private final Path filePath;
    private final String source;
    private final FormatOptions options;

    public FormatContext(Path filePath, String source, FormatOptions options) {
        this.filePath = filePath;
        this.source = source;
        this.options = options;
    }

    /**
     * The template's path, or {@code null} for in-memory sources.
     */
    public Path getFilePath() { return filePath; }
    public String getSource() { return source; }
    public FormatOptions getOptions() { return options; }
}
