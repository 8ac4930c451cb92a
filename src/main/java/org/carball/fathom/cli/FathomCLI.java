package org.carball.fathom.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.analyzer.DegenerateInputException;
import org.carball.fathom.analyzer.ReadabilityAnalyzer;
import org.carball.fathom.config.ConfigurationLoader;
import org.carball.fathom.config.FathomConfig;
import org.carball.fathom.config.OutputFormat;
import org.carball.fathom.model.analysis.AnalysisResult;
import org.carball.fathom.output.ReadabilityReport;
import org.carball.fathom.output.VerboseReporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

@Slf4j
public class FathomCLI {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one analysis and returns the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage(out);
            return args.length < 1 ? 1 : 0;
        }

        try {
            FathomConfig config = parseArgs(args, new ConfigurationLoader());
            log.debug("Running with {}", config);

            ReadabilityAnalyzer analyzer = new ReadabilityAnalyzer(new VerboseReporter(err, config.getVerbosity()));
            AnalysisResult result = analyzer.analyze(config.getInputFile());

            outputResults(result, config, out);
            return 0;

        } catch (DegenerateInputException e) {
            err.println(e.getMessage());
            log.debug("Degenerate input details", e);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (IllegalStateException e) {
            err.println("Invalid op-tree document: " + e.getMessage());
            log.debug("Document error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("Fathom " + VERSION + " - op-tree readability estimator");
        out.println();
        out.println("Usage: java -jar fathom.jar <op-tree-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  op-tree-file        Op-tree document exported by the front end (.json, .yml, .yaml)");
        out.println();
        out.println("Options:");
        out.println("  --output, -o        Write the report to a file instead of standard output");
        out.println("  --format, -f        Output format: text|json|both (default: text)");
        out.println("  --config            YAML config file (default: fathom-config.yml if present)");
        out.println("  --verbosity <n>     0 = silent, 1 = list skipped re-exported subs, 2 = trace every op");
        out.println("  -v                  Raise verbosity by one (repeatable)");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.print(ConfigurationLoader.getConfigurationHelp());
    }

    static FathomConfig parseArgs(String[] args, ConfigurationLoader loader) {
        FathomConfig config = loader.loadConfiguration(extractConfigPath(args));
        config.setInputFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    config.setOutputFormat(OutputFormat.fromName(args[++i]));
                    break;

                case "--verbosity":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Verbosity level not specified");
                    }
                    try {
                        config.setVerbosity(Integer.parseInt(args[++i]));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Verbosity must be a number: " + args[i]);
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbosity(config.getVerbosity() + 1);
                    break;

                case "--config":
                    // Already handled by extractConfigPath()
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        validateConfig(config);
        return config;
    }

    private static Path extractConfigPath(String[] args) {
        for (int i = 1; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return Paths.get(args[i + 1]);
            }
        }
        return null;
    }

    private static void validateConfig(FathomConfig config) {
        ConfigurationLoader.validate(config);

        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Op-tree document not found: " + config.getInputFile());
        }

        if (config.getOutputFile() != null) {
            Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }

    private static void outputResults(AnalysisResult result, FathomConfig config, PrintStream out) throws IOException {
        ReadabilityReport report = new ReadabilityReport(result);
        OutputFormat format = config.getOutputFormat();

        if (config.getOutputFile() == null) {
            if (format == OutputFormat.TEXT || format == OutputFormat.BOTH) {
                out.print(report.toText());
            }
            if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
                out.println(report.toJson());
            }
            return;
        }

        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (format) {
            case TEXT -> Files.writeString(Paths.get(config.getOutputFile()), report.toText());
            case JSON -> Files.writeString(Paths.get(config.getOutputFile()), report.toJson());
            case BOTH -> {
                Files.writeString(Paths.get(baseFileName + ".txt"), report.toText());
                Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
            }
        }
        log.info("Report written to {}", config.getOutputFile());
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }
}
