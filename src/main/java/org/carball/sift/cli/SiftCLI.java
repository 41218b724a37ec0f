package org.carball.sift.cli;

import ch.qos.logback.classic.Level;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.SiftEngine;
import org.carball.sift.config.ConfigurationLoader;
import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.config.OutputFormat;
import org.carball.sift.config.SiftConfig;
import org.carball.sift.config.StorageProfile;
import org.carball.sift.exception.SiftException;
import org.carball.sift.index.JsonLinesIndexPersistence;
import org.carball.sift.ingest.IngestionGateway;
import org.carball.sift.ingest.IngestionResult;
import org.carball.sift.ingest.UploadedFile;
import org.carball.sift.media.MediaClassifier;
import org.carball.sift.media.PlainTextExtractor;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionKind;
import org.carball.sift.output.IndexReport;
import org.carball.sift.output.IngestionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class SiftCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Sift - JSON & Media Ingestion and Storage Router v%s  ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            SiftCliOptions options = parseArgs(args);
            if (options.isVerbose()) {
                enableVerboseLogging();
            }

            ConfigurationLoader loader = new ConfigurationLoader();
            SiftConfig config = loader.loadConfigFile(options.getConfigFile());
            DecisionThresholds thresholds = loader.loadConfiguration(config, options.getProfile(), args);

            SiftEngine engine = SiftEngine.builder()
                    .config(config)
                    .thresholds(thresholds)
                    .classifier(MediaClassifier.unavailable())
                    .indexPersistence(new JsonLinesIndexPersistence(options.getIndexFile()))
                    .build();

            switch (options.getCommand()) {
                case "ingest":
                    runIngest(engine, options);
                    break;
                case "search":
                    runSearch(engine, options);
                    break;
                case "stats":
                    runStats(engine, options);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + options.getCommand());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (SiftException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("Pipeline error details: {}", e.getStructuredMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static void runIngest(SiftEngine engine, SiftCliOptions options) throws IOException {
        System.out.println("\n📥 Ingesting " + options.getFiles().size() + " file(s)...");
        System.out.println("   Storage directory: " + options.getStoreDir());
        System.out.println("   Index file: " + options.getIndexFile());
        System.out.println("   " + engine.getThresholds().getConfigurationSummary());
        System.out.println();

        List<UploadedFile> uploads = new ArrayList<>();
        for (Path file : options.getFiles()) {
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("File not found: " + file);
            }
            uploads.add(UploadedFile.fromPath(file));
        }

        IngestionGateway gateway = new IngestionGateway(engine, new PlainTextExtractor(), options.getStoreDir());
        List<IngestionResult> results = gateway.ingestAll(uploads);

        for (IngestionResult result : results) {
            if (result.isSuccess()) {
                System.out.printf("  ✓ %-30s → %-8s %s%n", result.getFilename(),
                        result.getKind().label(), result.getCategoryOrSchema());
            } else {
                System.out.printf("  ✗ %-30s   %s%n", result.getFilename(), result.getError());
            }
        }

        IngestionReport report = new IngestionReport(results, engine.stats());
        writeOutput(options, report.toJson(), report.toMarkdown());

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed > 0) {
            System.out.println("\n⚠️  " + failed + " of " + results.size() + " upload(s) failed");
        } else {
            System.out.println("\n✅ Ingestion complete!");
        }
    }

    private static void runSearch(SiftEngine engine, SiftCliOptions options) throws IOException {
        IndexFilter.IndexFilterBuilder filter = IndexFilter.builder()
                .kind(options.getKind())
                .categoryOrSchema(options.getCategory())
                .text(options.getText());
        if (options.getLimit() != null) {
            filter.limit(options.getLimit());
        }

        List<IndexEntry> entries = engine.search(filter.build());
        IndexReport report = new IndexReport();
        writeOutput(options, report.toJson(entries), report.searchMarkdown(entries));
        System.out.println("\n🔎 " + entries.size() + " matching entr" + (entries.size() == 1 ? "y" : "ies"));
    }

    private static void runStats(SiftEngine engine, SiftCliOptions options) throws IOException {
        IndexStats stats = engine.stats();
        IndexReport report = new IndexReport();
        writeOutput(options, report.toJson(stats), IndexReport.statsMarkdown(stats));
    }

    private static void writeOutput(SiftCliOptions options, String json, String markdown) throws IOException {
        OutputFormat format = options.getOutputFormat();
        if (options.getOutputFile() == null) {
            System.out.println(format == OutputFormat.MARKDOWN ? markdown : json);
            return;
        }

        String baseFileName = removeFileExtension(options.getOutputFile());
        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), json);
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), markdown);
        }
        System.out.println("\n📝 Output written to " + baseFileName
                + (format == OutputFormat.BOTH ? ".{json,md}" : format == OutputFormat.MARKDOWN ? ".md" : ".json"));
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar sift.jar <command> [arguments] [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  ingest <file>...    Analyze, route and store the given files");
        System.out.println("  search              Query the metadata index");
        System.out.println("  stats               Show index statistics");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config, -c        YAML configuration file (optional)");
        System.out.println("  --profile, -p       Storage profile: " + StorageProfile.getAvailableProfiles());
        System.out.println("  --store-dir         Root directory for media and documents (default: ./storage)");
        System.out.println("  --index-file        Metadata index file (default: ./sift-index.jsonl)");
        System.out.println("  --output, -o        Write output to this file instead of stdout");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Search options:");
        System.out.println("  --kind              media|document|json");
        System.out.println("  --category          Exact category or schema name");
        System.out.println("  --text              Substring of the filename or extracted text");
        System.out.println("  --limit             Maximum results, 0 for all (default: " + IndexFilter.DEFAULT_LIMIT + ")");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println(StorageProfile.getProfileHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar sift.jar ingest orders.json photo_of_food.jpg");
        System.out.println("  java -jar sift.jar ingest events.json --profile document-first");
        System.out.println("  java -jar sift.jar search --kind json --format markdown");
    }

    static SiftCliOptions parseArgs(String[] args) {
        SiftCliOptions options = new SiftCliOptions();
        options.setCommand(args[0]);
        options.setStoreDir(Paths.get("storage"));
        options.setIndexFile(Paths.get("sift-index.jsonl"));
        options.setOutputFormat(OutputFormat.JSON);

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config":
                case "-c":
                    options.setConfigFile(Paths.get(requireValue(args, i++, "Configuration file")));
                    break;

                case "--profile":
                case "-p":
                    options.setProfile(requireValue(args, i++, "Profile"));
                    break;

                case "--store-dir":
                    options.setStoreDir(Paths.get(requireValue(args, i++, "Storage directory")));
                    break;

                case "--index-file":
                    options.setIndexFile(Paths.get(requireValue(args, i++, "Index file")));
                    break;

                case "--output":
                case "-o":
                    options.setOutputFile(requireValue(args, i++, "Output file"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format");
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                case "--kind":
                    String kind = requireValue(args, i++, "Kind");
                    try {
                        options.setKind(IngestionKind.fromLabel(kind));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid kind. Use: media, document, or json");
                    }
                    break;

                case "--category":
                    options.setCategory(requireValue(args, i++, "Category"));
                    break;

                case "--text":
                    options.setText(requireValue(args, i++, "Search text"));
                    break;

                case "--limit":
                    String limit = requireValue(args, i++, "Limit");
                    try {
                        options.setLimit(Integer.parseInt(limit));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Limit must be a number: " + limit);
                    }
                    break;

                default:
                    if (arg.startsWith("--thresholds.")) {
                        // handled by ConfigurationLoader
                        requireValue(args, i++, arg);
                    } else if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if ("ingest".equals(options.getCommand())) {
                        options.getFiles().add(Paths.get(arg));
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
            }
        }

        validate(options);
        return options;
    }

    private static String requireValue(String[] args, int index, String what) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index + 1];
    }

    private static void validate(SiftCliOptions options) {
        switch (options.getCommand()) {
            case "ingest":
                if (options.getFiles().isEmpty()) {
                    throw new IllegalArgumentException("No files to ingest");
                }
                break;
            case "search":
            case "stats":
                break;
            default:
                throw new IllegalArgumentException("Unknown command: " + options.getCommand()
                        + ". Use: ingest, search, or stats");
        }
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

    private static void enableVerboseLogging() {
        Logger logger = LoggerFactory.getLogger("org.carball.sift");
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
