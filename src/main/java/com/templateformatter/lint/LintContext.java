package com.templateformatter.lint;

import java.nio.file.Path;

import com.templateformatter.parser.SourceIndex;

/**
 * The template being linted.
 */
public class LintContext {
    private final Path filePath;
    private final String source;
    private SourceIndex sourceIndex;

    public LintContext(Path filePath, String source) {
        this.filePath = filePath;
        this.source = source;
    }

    public Path getFilePath() { return filePath; }
    public String getSource() { return source; }

    /**
     * Line/column lookup for offsets into the source, built on first use.
     */
    public SourceIndex getSourceIndex() {
        if (sourceIndex == null) {
            sourceIndex = new SourceIndex(source);
        }
        return sourceIndex;
    }
}
