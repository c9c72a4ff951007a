package com.templateformatter.format;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.templateformatter.config.FormatterConfig;

/**
 * Layout parameters of the formatter.
 */
public final class FormatOptions {
    public static final int DEFAULT_INDENT_WIDTH = 2;
    public static final int DEFAULT_MAX_LINE_LENGTH = 80;

    private final int indentWidth;
    private final int maxLineLength;
    private final Set<String> inlineElements;
    private final Set<String> voidElements;
    private final Set<String> contentPreservingElements;

    public FormatOptions(int indentWidth, int maxLineLength, Collection<String> inlineElements,
                         Collection<String> voidElements, Collection<String> contentPreservingElements) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.indentWidth = indentWidth;
        this.maxLineLength = maxLineLength;
        this.inlineElements = _lowerCase(inlineElements);
        this.voidElements = _lowerCase(voidElements);
        this.contentPreservingElements = _lowerCase(contentPreservingElements);
    }

    public static FormatOptions defaults() {
        return new FormatOptions(DEFAULT_INDENT_WIDTH, DEFAULT_MAX_LINE_LENGTH,
                FormatHelpers.INLINE_ELEMENTS, FormatHelpers.VOID_ELEMENTS,
                FormatHelpers.CONTENT_PRESERVING_ELEMENTS);
    }

    /**
     * Reads the {@code formatter} section of a configuration.
     */
    public static FormatOptions fromConfig(FormatterConfig config) {
        return new FormatOptions(
                config.getFormatterConfig("indentWidth", DEFAULT_INDENT_WIDTH),
                config.getFormatterConfig("maxLineLength", DEFAULT_MAX_LINE_LENGTH),
                config.getFormatterList("inlineElements", FormatHelpers.INLINE_ELEMENTS),
                config.getFormatterList("voidElements", FormatHelpers.VOID_ELEMENTS),
                config.getFormatterList("contentPreservingElements", FormatHelpers.CONTENT_PRESERVING_ELEMENTS));
    }

    public FormatOptions withMaxLineLength(int newMaxLineLength) {
        return new FormatOptions(indentWidth, newMaxLineLength, inlineElements, voidElements,
                contentPreservingElements);
    }

    public FormatOptions withIndentWidth(int newIndentWidth) {
        return new FormatOptions(newIndentWidth, maxLineLength, inlineElements, voidElements,
                contentPreservingElements);
    }

    public int getIndentWidth() { return indentWidth; }
    public int getMaxLineLength() { return maxLineLength; }

    public boolean isInlineElement(String tagName) {
        return inlineElements.contains(tagName.toLowerCase(Locale.ROOT));
    }

    public boolean isVoidElement(String tagName) {
        return voidElements.contains(tagName.toLowerCase(Locale.ROOT));
    }

    public boolean isContentPreserving(String tagName) {
        return contentPreservingElements.contains(tagName.toLowerCase(Locale.ROOT));
    }

    private static Set<String> _lowerCase(Collection<String> names) {
        Set<String> result = new HashSet<>();
        for (String name : names) {
            result.add(name.toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(result);
    }
}
