package com.templateformatter.parser;

import java.util.logging.Logger;

import com.templateformatter.ast.ParseResult;
import com.templateformatter.util.LoggerUtil;

/**
 * Parses ERB/HTML template source into a {@link ParseResult}.
 *
 * <p>Malformed input never throws: problems are recorded as parse errors on the offending nodes
 * and on the result. Whitespace inside tags is only kept when
 * {@link ParserOptions#isTrackWhitespace()} is set; reprinting and autofix need it.
 */
public class TemplateParser {
    private static final Logger logger = LoggerUtil.getLogger(TemplateParser.class);

    private final ParserOptions options;

    public TemplateParser() {
        this(ParserOptions.defaults());
    }

    public TemplateParser(ParserOptions options) {
        this.options = options;
    }

    public static ParseResult parse(String source, boolean trackWhitespace) {
        return new TemplateParser(new ParserOptions(trackWhitespace)).parse(source);
    }

    public ParseResult parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }

        ParseResult result = new DocumentBuilder(source, options.isTrackWhitespace()).build();

        if (result.hasErrors()) {
            logger.fine("Parsed " + source.length() + " characters with " + result.getErrors().size() + " errors");
        } else {
            logger.finest("Parsed " + source.length() + " characters");
        }
        return result;
    }
}
