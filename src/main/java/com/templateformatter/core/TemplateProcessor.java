package com.templateformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.templateformatter.api.AppliedFix;
import com.templateformatter.api.FormatterResult;
import com.templateformatter.api.TemplateFormatter;
import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.autofix.AutofixResult;
import com.templateformatter.autofix.Autofixer;
import com.templateformatter.config.FormatterConfig;
import com.templateformatter.format.FormatOptions;
import com.templateformatter.format.Formatter;
import com.templateformatter.lint.Diagnostic;
import com.templateformatter.lint.LintResult;
import com.templateformatter.lint.Linter;
import com.templateformatter.lint.RuleRegistry;
import com.templateformatter.rewriter.RewriterRegistry;
import com.templateformatter.util.LoggerUtil;

/**
 * Formats, lints and fixes templates according to a configuration.
 *
 * <p>Every call parses its document once and owns the resulting tree; nothing mutable is shared
 * between calls, so documents may be processed in parallel. Rules are instantiated per call.
 */
public class TemplateProcessor implements TemplateFormatter {
    private static final Logger logger = LoggerUtil.getLogger(TemplateProcessor.class);

    public static final String TEMPLATE_EXTENSION = ".erb";

    private final FormatterConfig config;
    private final Formatter formatter;
    private final RuleRegistry ruleRegistry;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public TemplateProcessor(FormatterConfig config) {
        this(config, new RewriterRegistry(), RuleRegistry.withBuiltIns());
    }

    public TemplateProcessor(FormatterConfig config, RewriterRegistry rewriterRegistry, RuleRegistry ruleRegistry) {
        this.config = config;
        this.ruleRegistry = ruleRegistry;
        this.formatter = new Formatter(FormatOptions.fromConfig(config),
                rewriterRegistry.resolveAstRewriters(config.getRewriters("pre")),
                rewriterRegistry.resolveStringRewriters(config.getRewriters("post")));
        logger.fine("Template processor initialized");
    }

    @Override
    public FormatterResult format(Path filePath, String source) {
        return format(filePath, source, false);
    }

    public FormatterResult format(Path filePath, String source, boolean force) {
        processedFileCount.incrementAndGet();
        try {
            return _count(filePath, formatter.format(filePath, source, force));
        } catch (RuntimeException e) {
            return _failure(filePath, source, e);
        }
    }

    @Override
    public FormatterResult lint(Path filePath, String source) {
        processedFileCount.incrementAndGet();
        try {
            LintResult lintResult = _linter().lint(filePath, source);
            FormatterResult.Builder builder = FormatterResult.builder()
                    .successful(!lintResult.hasParseErrors())
                    .ignored(lintResult.isIgnored())
                    .originalCode(source)
                    .formattedCode(source);
            for (Diagnostic diagnostic : lintResult.getDiagnostics()) {
                builder.addError(diagnostic.toFormatterError());
            }
            return _count(filePath, builder.build());
        } catch (RuntimeException e) {
            return _failure(filePath, source, e);
        }
    }

    @Override
    public FormatterResult fix(Path filePath, String source, boolean unsafe) {
        processedFileCount.incrementAndGet();
        try {
            LintResult lintResult = _linter().lint(filePath, source);
            if (lintResult.hasParseErrors() || lintResult.isIgnored()) {
                FormatterResult.Builder builder = FormatterResult.builder()
                        .successful(!lintResult.hasParseErrors())
                        .ignored(lintResult.isIgnored())
                        .originalCode(source)
                        .formattedCode(source);
                for (Diagnostic diagnostic : lintResult.getDiagnostics()) {
                    builder.addError(diagnostic.toFormatterError());
                }
                return _count(filePath, builder.build());
            }

            boolean includeUnsafe = unsafe || config.isUnsafeFixesEnabled();
            AutofixResult autofix = new Autofixer().apply(lintResult.getParseResult(),
                    lintResult.getDiagnostics(), includeUnsafe);

            FormatterResult.Builder builder = FormatterResult.builder()
                    .successful(true)
                    .originalCode(source)
                    .formattedCode(autofix.getSource());
            for (Diagnostic diagnostic : autofix.getFixed()) {
                int startLine = diagnostic.getLocation().getStart().getLine();
                int endLine = diagnostic.getLocation().getEnd().getLine();
                builder.addAppliedFix(new AppliedFix(diagnostic.getRuleName(), startLine, endLine,
                        diagnostic.getMessage()));
            }
            for (Diagnostic diagnostic : autofix.getUnfixed()) {
                builder.addError(diagnostic.toFormatterError());
            }

            logger.fine(() -> (filePath == null ? "<input>" : filePath.toString()) + ": "
                    + autofix.getFixed().size() + " fixed, " + autofix.getUnfixed().size() + " remaining");
            return _count(filePath, builder.build());
        } catch (RuntimeException e) {
            return _failure(filePath, source, e);
        }
    }

    /**
     * Formats every template under a directory using a thread pool.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        return formatDirectory(directory, threadCount, false);
    }

    /**
     * Formats every template under a directory on {@code threadCount} threads. With {@code force},
     * templates carrying the formatter ignore directive are formatted too.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount, boolean force) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = findTemplates(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " templates to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, format(file, content, force));
                    } catch (IOException e) {
                        results.put(file, FormatterResult.builder()
                                .successful(false)
                                .addError(new FormatterError(
                                        Severity.FATAL,
                                        "Failed to read file: " + e.getMessage(),
                                        1, 0))
                                .build());
                    }
                });
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for template processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " templates");
        return results;
    }

    /**
     * Lists the {@value #TEMPLATE_EXTENSION} files under a directory in path order.
     */
    public static List<Path> findTemplates(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(TEMPLATE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    private Linter _linter() {
        return new Linter(ruleRegistry.createEnabled(config));
    }

    private FormatterResult _count(Path filePath, FormatterResult result) {
        if (result.isSuccessful()) {
            successCount.incrementAndGet();
        } else {
            errorCount.incrementAndGet();
            logger.fine(() -> "Problems in " + filePath + ": " + result.getErrors().stream()
                    .map(e -> e.getSeverity() + ": " + e.getMessage())
                    .collect(Collectors.joining(", ")));
        }
        return result;
    }

    private FormatterResult _failure(Path filePath, String source, RuntimeException e) {
        errorCount.incrementAndGet();
        logger.log(Level.SEVERE, "Unexpected error processing template: " + filePath, e);
        return FormatterResult.builder()
                .successful(false)
                .originalCode(source)
                .formattedCode(source)
                .addError(new FormatterError(Severity.FATAL, "Unexpected error: " + e.getMessage(), 1, 0))
                .build();
    }
}
