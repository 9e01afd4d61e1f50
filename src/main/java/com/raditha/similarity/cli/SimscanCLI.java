package com.raditha.similarity.cli;

import com.raditha.similarity.analyzer.CodeSimilarityAnalyzer;
import com.raditha.similarity.config.SimilarityConfig;
import com.raditha.similarity.config.SimilaritySettings;
import com.raditha.similarity.io.LocalProjectFileAccess;
import com.raditha.similarity.model.SimilarityMatch;
import com.raditha.similarity.model.SimilarityReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the similarity engine.
 * <p>
 * Usage:
 * java -jar similarity-engine.jar analyze [options] <project-dir>
 * java -jar similarity-engine.jar compare [--json] <file1> <file2>
 * <p>
 * Configuration priority: CLI arguments > similarity.yml > defaults
 */
@Command(name = "simscan", mixinStandardHelpOptions = true, version = "simscan v1.0.0",
        description = "Code duplication and similarity scanner",
        subcommands = {SimscanCLI.AnalyzeCommand.class, SimscanCLI.CompareCommand.class})
public class SimscanCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Build the command line with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new SimscanCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.usage(failed.getErr());
            return 2;
        });
        return cmd;
    }

    /**
     * Load configuration from the given file, or from similarity.yml in the
     * working directory.
     */
    static SimilarityConfig loadConfig(String configFile, String preset, int threshold, Boolean semantic)
            throws IOException {
        if (configFile != null && !Files.isRegularFile(Paths.get(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Path path = configFile != null ? Paths.get(configFile) : Paths.get(SimilaritySettings.DEFAULT_FILE_NAME);
        return SimilaritySettings.load(path, preset, threshold, semantic);
    }

    @Command(name = "analyze", mixinStandardHelpOptions = true,
            description = "Analyze a project for duplicate and similar code")
    static class AnalyzeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<project-dir>", description = "Project root directory")
        String projectPath;

        @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
        String configFile;

        @Option(names = "--json", description = "Output results in JSON format")
        boolean jsonOutput = false;

        @Option(names = "--strict", description = "Strict preset (85%% structural threshold)")
        boolean strict = false;

        @Option(names = "--lenient", description = "Lenient preset (60%% structural threshold)")
        boolean lenient = false;

        @Option(names = "--threshold", description = "Structural threshold 1-100 (default: 70)", paramLabel = "<n>")
        int threshold = 0; // 0 = use YAML/default

        @Option(names = "--no-semantic", description = "Skip the semantic pass")
        boolean noSemantic = false;

        @Override
        public Integer call() throws IOException {
            validate();

            SimilarityConfig config = loadConfig(configFile, preset(), threshold, noSemantic ? Boolean.FALSE : null);
            CodeSimilarityAnalyzer analyzer = new CodeSimilarityAnalyzer(new LocalProjectFileAccess(config), config);

            PrintWriter err = spec.commandLine().getErr();
            Runnable unsubscribe = analyzer.onProgress(percent -> printProgress(err, percent));
            SimilarityReport report;
            try {
                report = analyzer.analyzeProject(projectPath);
            } finally {
                unsubscribe.run();
            }

            ReportPrinter printer = new ReportPrinter(spec.commandLine().getOut());
            if (jsonOutput) {
                printer.printJson(report);
            } else {
                printer.printReport(report, config);
            }
            return 0;
        }

        private void validate() {
            if (strict && lenient) {
                throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
            }
            if (threshold < 0 || threshold > 100) {
                throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
            }
            if (!Files.isDirectory(Paths.get(projectPath))) {
                throw new IllegalArgumentException("Project directory not found: " + projectPath);
            }
        }

        private String preset() {
            if (strict) {
                return "strict";
            } else if (lenient) {
                return "lenient";
            }
            return null;
        }

        private static void printProgress(PrintWriter err, int percent) {
            int filled = percent / 5;
            err.printf("\r[%s%s] %3d%%", "#".repeat(filled), " ".repeat(20 - filled), percent);
            if (percent >= 100) {
                err.println();
            }
            err.flush();
        }
    }

    @Command(name = "compare", mixinStandardHelpOptions = true,
            description = "Compare the code blocks of two files")
    static class CompareCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<file1>")
        String file1;

        @Parameters(index = "1", paramLabel = "<file2>")
        String file2;

        @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
        String configFile;

        @Option(names = "--json", description = "Output results in JSON format")
        boolean jsonOutput = false;

        @Override
        public Integer call() throws IOException {
            for (String file : List.of(file1, file2)) {
                if (!Files.isRegularFile(Paths.get(file))) {
                    throw new IllegalArgumentException("File not found: " + file);
                }
            }

            SimilarityConfig config = loadConfig(configFile, null, 0, Boolean.FALSE);
            CodeSimilarityAnalyzer analyzer = new CodeSimilarityAnalyzer(new LocalProjectFileAccess(config), null, config);
            List<SimilarityMatch> matches = analyzer.compareFiles(file1, file2);

            ReportPrinter printer = new ReportPrinter(spec.commandLine().getOut());
            if (jsonOutput) {
                printer.printJson(matches);
            } else {
                printer.printComparison(file1, file2, matches);
            }
            return 0;
        }
    }
}
