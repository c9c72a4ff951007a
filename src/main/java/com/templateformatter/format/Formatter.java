package com.templateformatter.format;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import com.templateformatter.api.FormatterResult;
import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.ParseError;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.parser.TemplateParser;
import com.templateformatter.rewriter.AstRewriter;
import com.templateformatter.rewriter.StringRewriter;
import com.templateformatter.util.LoggerUtil;

/**
 * Formats whole templates: parse, honor {@code herb:formatter ignore}, run the pre-format rewriters,
 * print through {@link FormatPrinter}, run the post-format rewriters.
 *
 * <p>A template that does not parse is returned unchanged with its parse errors.
 */
public class Formatter {
    private static final Logger logger = LoggerUtil.getLogger(Formatter.class);

    private final FormatOptions options;
    private final List<AstRewriter> preRewriters;
    private final List<StringRewriter> postRewriters;

    public Formatter() {
        this(FormatOptions.defaults());
    }

    public Formatter(FormatOptions options) {
        this(options, List.of(), List.of());
    }

    public Formatter(FormatOptions options, List<AstRewriter> preRewriters, List<StringRewriter> postRewriters) {
        this.options = options;
        this.preRewriters = List.copyOf(preRewriters);
        this.postRewriters = List.copyOf(postRewriters);
    }

    /**
     * Formats {@code source}, returning it unchanged when it cannot be parsed or opts out.
     */
    public String format(String source) {
        return format(null, source, false).getFormattedCode();
    }

    public FormatterResult format(Path filePath, String source, boolean force) {
        ParseResult parseResult = TemplateParser.parse(source, true);

        if (parseResult.hasErrors()) {
            logger.fine(() -> _describe(filePath) + ": not formatted, " + parseResult.getErrors().size()
                    + " parse errors");
            FormatterResult.Builder builder = FormatterResult.builder()
                    .successful(false)
                    .originalCode(source)
                    .formattedCode(source);
            for (ParseError error : parseResult.getErrors()) {
                builder.addError(new FormatterError(Severity.FATAL, error.getMessage(),
                        error.getLocation().getStart().getLine(), error.getLocation().getStart().getColumn()));
            }
            return builder.build();
        }

        DocumentNode root = parseResult.getValue();
        if (!force && FormatIgnore.hasFormatterIgnoreDirective(root)) {
            logger.fine(() -> _describe(filePath) + ": skipped, " + FormatIgnore.FORMATTER_IGNORE + " directive");
            return FormatterResult.builder()
                    .successful(true)
                    .ignored(true)
                    .originalCode(source)
                    .formattedCode(source)
                    .build();
        }

        FormatContext context = new FormatContext(filePath, source, options);
        for (AstRewriter rewriter : preRewriters) {
            logger.finer(() -> "Running pre-format rewriter " + rewriter.getName());
            root = rewriter.rewrite(root, context);
        }

        String formatted = new FormatPrinter(options).print(root);

        for (StringRewriter rewriter : postRewriters) {
            logger.finer(() -> "Running post-format rewriter " + rewriter.getName());
            formatted = rewriter.rewrite(formatted, context);
        }

        if (!formatted.equals(source)) {
            logger.fine(() -> _describe(filePath) + ": formatted");
        }
        return FormatterResult.builder()
                .successful(true)
                .originalCode(source)
                .formattedCode(formatted)
                .build();
    }

    private static String _describe(Path filePath) {
        return filePath == null ? "<input>" : filePath.toString();
    }
}
