package com.svparser.dump;

import ch.qos.logback.classic.Level;
import com.svparser.Parser;
import com.svparser.ast.ClassDeclaration;
import com.svparser.ast.ModuleDeclaration;
import com.svparser.ast.Source;
import com.svparser.ast.SourceItem;
import com.svparser.jackson.JacksonAstJsonProvider;
import com.svparser.json.AstJsonException;
import com.svparser.json.AstJsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Writes the structural AST of SystemVerilog sources as JSON.
 *
 * Two modes of operation:
 * 1. Single file: {@code AstDump input.sv output.json}
 * 2. Batch: every matching file under the given files/directories is dumped into an output
 *    directory, one JSON file per input, on a fixed thread pool
 *
 * Usage:
 *   java -cp ... com.svparser.dump.AstDump [options] input.sv output.json
 *   java -cp ... com.svparser.dump.AstDump --out-dir=DIR [options] <files-or-dirs...>
 *
 * Options:
 *   --out-dir=PATH        Batch mode output directory
 *   --threads=N           Number of worker threads in batch mode (default: available processors)
 *   --extensions=ext,...  File extensions to pick up from directories (default: sv,svh,v)
 *   --compact             Single-line JSON instead of indented
 *   --verbose             Enable debug logging
 */
public class AstDump {

    private static final Logger log = LoggerFactory.getLogger(AstDump.class);

    private final Config config;
    private final AstJsonSerializer serializer;

    private final AtomicLong writtenFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }
        System.exit(new AstDump(config).run());
    }

    public AstDump(Config config) {
        this.config = config;
        this.serializer = new JacksonAstJsonProvider().getSerializer();
        if (config.verbose) {
            ch.qos.logback.classic.Logger appLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.svparser");
            appLogger.setLevel(Level.DEBUG);
        }
    }

    /**
     * @return process exit code: 0 if every input was written, 1 otherwise
     */
    public int run() {
        if (config.outputDir == null) {
            Path input = config.inputs.get(0);
            return dumpFile(input, config.outputFile) ? 0 : 1;
        }
        try {
            return runBatch();
        } catch (IOException e) {
            log.error("Cannot prepare output directory {}: {}", config.outputDir, e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted before all files were written");
            return 1;
        }
    }

    public long writtenFiles() {
        return writtenFiles.get();
    }

    public long failedFiles() {
        return failedFiles.get();
    }

    private int runBatch() throws IOException, InterruptedException {
        Files.createDirectories(config.outputDir);

        List<Job> jobs = discoverJobs();
        log.info("Found {} files to process", jobs.size());

        ExecutorService executor = Executors.newFixedThreadPool(config.threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Job job : jobs) {
                futures.add(executor.submit(() -> dumpFile(job.input(), job.output())));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    failedFiles.incrementAndGet();
                    log.error("Worker failed: {}", e.getCause().toString());
                }
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        log.info("Wrote {} of {} files to {} ({} failed)",
            writtenFiles.get(), jobs.size(), config.outputDir, failedFiles.get());
        return failedFiles.get() > 0 ? 1 : 0;
    }

    /**
     * Inputs named directly map to {@code <name>.json}; files found under a directory keep
     * their path relative to it.
     */
    private List<Job> discoverJobs() throws IOException {
        List<Job> jobs = new ArrayList<>();
        for (Path input : config.inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> paths = Files.walk(input)) {
                    paths.filter(Files::isRegularFile)
                         .filter(this::hasValidExtension)
                         .sorted()
                         .forEach(file -> jobs.add(new Job(file, config.outputDir.resolve(jsonName(input.relativize(file))))));
                }
            } else if (Files.exists(input)) {
                jobs.add(new Job(input, config.outputDir.resolve(jsonName(input.getFileName()))));
            } else {
                log.warn("Input does not exist: {}", input);
                failedFiles.incrementAndGet();
            }
        }
        return jobs;
    }

    private boolean dumpFile(Path input, Path output) {
        try {
            String text = Files.readString(input);
            Parser parser = new Parser(text);
            Source source = parser.parse();
            String json = config.compact ? serializer.serialize(source) : serializer.serializePretty(source);

            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json);

            writtenFiles.incrementAndGet();
            if (log.isDebugEnabled()) {
                log.debug("{}: {} tokens, {} top-level declarations",
                    input, parser.tokens().size(), source.items().size());
                for (SourceItem item : source.items()) {
                    if (!isTerminated(item)) {
                        log.debug("{}:{}: {} is missing its end keyword",
                            input, item.loc().start().line(), item.type());
                    }
                }
            }
            log.info("AST written to {}", output);
            return true;
        } catch (IOException | AstJsonException e) {
            failedFiles.incrementAndGet();
            log.error("Failed to dump {}: {}", input, e.getMessage());
            return false;
        }
    }

    private static boolean isTerminated(SourceItem item) {
        if (item instanceof ModuleDeclaration module) {
            return module.terminated();
        }
        return ((ClassDeclaration) item).terminated();
    }

    private boolean hasValidExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return config.extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    private static Path jsonName(Path relative) {
        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = relative.getParent();
        return parent == null ? Path.of(base + ".json") : parent.resolve(base + ".json");
    }

    private static void printUsage() {
        System.out.println("Usage: AstDump [options] <input.sv> <output.json>");
        System.out.println("       AstDump --out-dir=DIR [options] <files-or-dirs...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --out-dir=PATH        Batch mode: write one JSON file per input into PATH");
        System.out.println("  --threads=N           Number of worker threads (default: CPU count)");
        System.out.println("  --extensions=ext,...  File extensions to process (default: sv,svh,v)");
        System.out.println("  --compact             Write single-line JSON");
        System.out.println("  --verbose             Enable debug logging");
        System.out.println("  --help                Show this help");
    }

    // ========== Inner classes ==========

    private record Job(Path input, Path output) {}

    public static class Config {
        int threads = Runtime.getRuntime().availableProcessors();
        Path outputDir = null;
        Path outputFile = null;
        List<String> extensions = List.of("sv", "svh", "v");
        List<Path> inputs = new ArrayList<>();
        boolean compact = false;
        boolean verbose = false;

        /**
         * @return the configuration, or null when the arguments are invalid or help was asked for
         */
        public static Config parse(String[] args) {
            Config config = new Config();
            List<Path> positional = new ArrayList<>();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                    if (config.threads < 1) {
                        System.err.println("Thread count must be positive: " + config.threads);
                        return null;
                    }
                } else if (arg.startsWith("--out-dir=")) {
                    config.outputDir = Path.of(arg.substring(10));
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).toLowerCase().split(","));
                } else if (arg.equals("--compact")) {
                    config.compact = true;
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    positional.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.outputDir == null) {
                if (positional.size() != 2) {
                    System.err.println("Error: expected <input.sv> <output.json>");
                    return null;
                }
                config.inputs.add(positional.get(0));
                config.outputFile = positional.get(1);
            } else {
                if (positional.isEmpty()) {
                    System.err.println("Error: No input files or directories specified");
                    return null;
                }
                config.inputs.addAll(positional);
            }
            return config;
        }
    }
}
