package com.templateformatter.parser;

/**
 * Options for a single parse.
 */
public final class ParserOptions {
    private final boolean trackWhitespace;

    public ParserOptions(boolean trackWhitespace) {
        this.trackWhitespace = trackWhitespace;
    }

    public static ParserOptions defaults() {
        return new ParserOptions(false);
    }

    /**
     * Options that keep whitespace inside tags, required for lossless reprinting and autofix.
     */
    public static ParserOptions trackingWhitespace() {
        return new ParserOptions(true);
    }

    public boolean isTrackWhitespace() {
        return trackWhitespace;
    }
}
