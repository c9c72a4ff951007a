package com.templateformatter.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.templateformatter.api.FormatterResult;
import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.config.ConfigurationLoader;
import com.templateformatter.config.FormatterConfig;
import com.templateformatter.core.TemplateProcessor;
import com.templateformatter.util.ErrorFormatter;
import com.templateformatter.util.LoggerUtil;

/**
 * Command line interface: format, check, lint and fix ERB templates.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    /**
     * What a command does with one template. Returns whether the template is in the desired
     * state afterwards.
     */
    private interface TemplateAction {
        boolean apply(TemplateProcessor processor, Path file, String source) throws IOException;
    }

    /**
     * What {@code format} and {@code check} do with a template's formatting result.
     */
    private interface ResultAction {
        boolean apply(Path file, FormatterResult result) throws IOException;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the CLI and returns the process exit code.
     */
    public static int run(String[] args) {
        try {
            LoggerUtil.initialize();
            if (args.length < 1) {
                _printUsage();
                return 1;
            }

            boolean useColors = !_hasOption(args, "--no-color");
            errorFormatter = new ErrorFormatter(useColors);

            if (_hasOption(args, "--verbose")) {
                LoggerUtil.setConsoleLevel(Level.FINE);
            } else {
                LoggerUtil.setConsoleLevel(Level.WARNING);
            }
            String logFile = _getOptionValue(args, "--log-file");
            if (logFile != null) {
                LoggerUtil.enableFileLogging(Paths.get(logFile));
            }

            String command = args[0];

            switch (command) {
                case "format":
                    return _formatFiles(args);
                case "check":
                    return _checkFiles(args);
                case "lint":
                    return _lintFiles(args);
                case "fix":
                    return _fixFiles(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        } finally {
            LoggerUtil.shutdown();
        }
    }

    private static void _printVersion() {
        System.out.println("Template Formatter version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Template Formatter CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  template-formatter init [--force]       - Initialize configuration file");
        System.out.println("  template-formatter format <path>        - Format templates in path");
        System.out.println("  template-formatter check <path>         - Check templates without formatting");
        System.out.println("  template-formatter lint <path>          - Report rule violations");
        System.out.println("  template-formatter fix <path>           - Apply automatic fixes");
        System.out.println("  template-formatter --help|-h            - Show this help");
        System.out.println("  template-formatter --version|-v         - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                         - Use specific config file (default: "
                + ConfigurationLoader.CONFIG_FILE_NAME + ")");
        System.out.println("  --force                                 - Format despite herb:formatter ignore; overwrite on init");
        System.out.println("  --unsafe                                - Also apply unsafe fixes (with fix command)");
        System.out.println("  --verbose                               - Show detailed output");
        System.out.println("  --log-file=<file>                       - Also write log records to a file");
        System.out.println("  --no-color                              - Disable colored output");
    }

    private static int _formatFiles(String[] args) throws IOException {
        boolean force = _hasOption(args, "--force");
        return _formatAndReport(args, "Formatted", force, (file, result) -> {
            if (!result.isSuccessful()) {
                _reportErrors(file, result.getErrors());
                return false;
            }
            if (result.isChanged()) {
                Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                _printSuccess("Formatted: " + file);
            }
            return true;
        });
    }

    private static int _checkFiles(String[] args) throws IOException {
        return _formatAndReport(args, "Correctly formatted", false, (file, result) -> {
            if (!result.isSuccessful()) {
                _reportErrors(file, result.getErrors());
                return false;
            }
            if (result.isChanged()) {
                _printWarning("Needs formatting: " + file);
                return false;
            }
            return true;
        });
    }

    private static int _lintFiles(String[] args) throws IOException {
        return _processFiles(args, "Without errors", (processor, file, source) -> {
            FormatterResult result = processor.lint(file, source);
            _reportErrors(file, result.getErrors());
            return !result.hasErrorsAtLeast(Severity.ERROR);
        });
    }

    private static int _fixFiles(String[] args) throws IOException {
        boolean unsafe = _hasOption(args, "--unsafe");
        return _processFiles(args, "Without remaining errors", (processor, file, source) -> {
            FormatterResult result = processor.fix(file, source, unsafe);
            if (result.isChanged()) {
                Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                _printSuccess("Fixed " + result.getAppliedFixes().size() + " problem(s) in " + file);
            }
            _reportErrors(file, result.getErrors());
            return result.isSuccessful() && !result.hasErrorsAtLeast(Severity.ERROR);
        });
    }

    /**
     * Formats one file, or a whole directory on the processor's thread pool, and hands each
     * result to {@code action}.
     */
    private static int _formatAndReport(String[] args, String okLabel, boolean force, ResultAction action)
            throws IOException {
        Path path = _pathArgument(args);
        if (path == null) {
            return 1;
        }
        if (!Files.isDirectory(path)) {
            return _processFiles(args, okLabel,
                    (processor, file, source) -> action.apply(file, processor.format(file, source, force)));
        }

        TemplateProcessor processor = new TemplateProcessor(_loadConfig(args));
        Instant start = Instant.now();
        Map<Path, FormatterResult> results = new TreeMap<>(
                processor.formatDirectory(path, Runtime.getRuntime().availableProcessors(), force));
        _printInfo("Found " + results.size() + " templates");

        int ok = 0;
        int failed = 0;
        for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
            try {
                if (action.apply(entry.getKey(), entry.getValue())) {
                    ok++;
                } else {
                    failed++;
                }
            } catch (IOException e) {
                _printError("Error processing file: " + entry.getKey() + ": " + e.getMessage());
                logger.log(Level.SEVERE, "Error processing file: " + entry.getKey(), e);
                failed++;
            }
        }
        return _printTotals(results.size(), Duration.between(start, Instant.now()), okLabel, ok, failed);
    }

    private static int _processFiles(String[] args, String okLabel, TemplateAction action) throws IOException {
        Path path = _pathArgument(args);
        if (path == null) {
            return 1;
        }

        TemplateProcessor processor = new TemplateProcessor(_loadConfig(args));
        List<Path> files = Files.isRegularFile(path) ? List.of(path) : TemplateProcessor.findTemplates(path);
        _printInfo("Found " + files.size() + " templates");

        Instant start = Instant.now();
        int ok = 0;
        int failed = 0;
        for (Path file : files) {
            try {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                if (action.apply(processor, file, source)) {
                    ok++;
                } else {
                    failed++;
                }
            } catch (IOException e) {
                _printError("Error processing file: " + file + ": " + e.getMessage());
                logger.log(Level.SEVERE, "Error processing file: " + file, e);
                failed++;
            }
        }
        return _printTotals(files.size(), Duration.between(start, Instant.now()), okLabel, ok, failed);
    }

    private static Path _pathArgument(String[] args) {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return null;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + path);
            return null;
        }
        return path;
    }

    private static int _printTotals(int count, Duration duration, String okLabel, int ok, int failed) {
        System.out.println();
        System.out.println("Processed " + count + " templates in " + _formatDuration(duration) + ":");
        System.out.println("  " + okLabel + ": " + ok);
        System.out.println("  With problems: " + failed);

        return failed > 0 ? 1 : 0;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        Path configPath = Paths.get(ConfigurationLoader.CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it");
            return 0;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(ConfigurationLoader.findConfig(Paths.get("")));
    }

    private static void _reportErrors(Path file, List<FormatterError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, file + ":"));
        for (FormatterError error : errors) {
            System.out.println("  " + errorFormatter.formatError(error));
        }
        Map<Path, List<FormatterError>> summary = new LinkedHashMap<>();
        summary.put(file, errors);
        logger.fine(() -> errorFormatter.formatErrorSummary(summary));
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long millis = duration.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        return String.format("%.2fs", millis / 1000.0);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printError(String message) {
        System.err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }
}
