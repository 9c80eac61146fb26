package org.netpreserve.scriptorium;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.scriptorium.catalog.MissingFinder;
import org.netpreserve.scriptorium.config.ConfigLoader;
import org.netpreserve.scriptorium.config.JobConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

public class Scriptorium {
    private static final Logger log = LoggerFactory.getLogger(Scriptorium.class);
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        // exiting while a shutdown hook is running would block, so only exit explicitly on failure
        if (status != EXIT_OK) System.exit(status);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (args.length > 0 && args[0].equals("missing")) {
                return missing(args, out);
            }
            return archive(args, out);
        } catch (ConfigurationException e) {
            err.println("scriptorium: " + e.getMessage());
            log.debug("Configuration error", e);
            return EXIT_CONFIG_ERROR;
        }
    }

    private static int archive(String[] args, PrintStream out) throws ConfigurationException {
        Path dataDir = Path.of("data");
        Path configFile = null;
        Path source = null;
        boolean dumpConfig = false;
        boolean force = false;
        var loader = new ConfigLoader();
        var overrides = JsonNodeFactory.instance.objectNode();

        int start = args.length > 0 && args[0].equals("archive") ? 1 : 0;
        for (int i = start; i < args.length; i++) {
            switch (args[i]) {
                case "-c", "--config" -> configFile = Path.of(value(args, ++i));
                case "-d", "--data-dir" -> dataDir = Path.of(value(args, ++i));
                case "-w", "--workers" -> ConfigLoader.section(overrides, "fetch")
                        .put("workers", intValue(args, ++i));
                case "--timeout" -> ConfigLoader.section(overrides, "fetch").put("timeout", value(args, ++i));
                case "--retries" -> ConfigLoader.section(overrides, "fetch").put("retries", intValue(args, ++i));
                case "--max-candidates" -> ConfigLoader.section(overrides, "fetch")
                        .put("maxCandidates", intValue(args, ++i));
                case "--run-timeout" -> ConfigLoader.section(overrides, "fetch").put("runTimeout", value(args, ++i));
                case "--allow-licensed" -> ConfigLoader.section(overrides, "trust").put("allowLicensed", true);
                case "--accept-scan-only" -> ConfigLoader.section(overrides, "trust").put("acceptScanOnly", true);
                case "--trust-host" -> ConfigLoader.section(overrides, "trust")
                        .withArray("extraHosts").addObject().put("host", value(args, ++i));
                case "--no-warc" -> ConfigLoader.section(overrides, "storage").put("warc", false);
                case "--force" -> force = true;
                case "--dump-config" -> dumpConfig = true;
                case "--log-file" -> addLogFile(value(args, ++i));
                case "-v", "--verbose" -> setLevel(Level.DEBUG);
                case "-h", "--help" -> {
                    usage(out);
                    return EXIT_OK;
                }
                default -> {
                    if (args[i].startsWith("-")) throw new ConfigurationException("Unknown option: " + args[i]);
                    if (source != null) throw new ConfigurationException("Only one source file may be given");
                    source = Path.of(args[i]);
                }
            }
        }

        ObjectNode tree = loader.load(configFile != null ? configFile : dataDir.resolve("config.yaml"),
                configFile != null);
        applyOverrides(tree, overrides);
        JobConfig config = loader.bind(tree);
        if (dumpConfig) {
            try {
                out.print(loader.dump(config));
            } catch (IOException e) {
                throw new ConfigurationException("Unable to print configuration: " + e.getMessage(), e);
            }
            return EXIT_OK;
        }
        if (source == null) throw new ConfigurationException("No candidate source given (try --help)");

        ArchiveJob job;
        try {
            job = new ArchiveJob(dataDir, config);
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Unable to open data directory " + dataDir + ": " + e.getMessage(), e);
        }
        Thread mainThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            log.warn("Interrupted, cancelling run");
            job.cancel();
            try {
                mainThread.join(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        try (job) {
            RunSummary summary = job.run(source, force);
            out.println("Run complete: " + summary);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Run failed", e);
            return EXIT_RUN_ERROR;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down, the hook is waiting for us
            }
        }
    }

    private static int missing(String[] args, PrintStream out) throws ConfigurationException {
        Path master = null;
        Path candidates = null;
        Path output = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--master" -> master = Path.of(value(args, ++i));
                case "--candidates" -> candidates = Path.of(value(args, ++i));
                case "--out" -> output = Path.of(value(args, ++i));
                case "-h", "--help" -> {
                    usage(out);
                    return EXIT_OK;
                }
                default -> throw new ConfigurationException("Unknown option: " + args[i]);
            }
        }
        if (master == null || candidates == null || output == null) {
            throw new ConfigurationException("missing needs --master, --candidates and --out");
        }
        var finder = new MissingFinder();
        int count;
        try {
            count = finder.run(master, candidates, output);
        } catch (IOException e) {
            log.error("Unable to write {}", output, e);
            return EXIT_RUN_ERROR;
        }
        out.println("Missing vs master: " + count + " -> " + output);
        return EXIT_OK;
    }

    /**
     * Command line trust hosts are appended to the configured list rather than replacing it.
     */
    private static void applyOverrides(ObjectNode tree, ObjectNode overrides) {
        JsonNode extraHosts = overrides.path("trust").path("extraHosts");
        if (overrides.get("trust") instanceof ObjectNode trust) trust.remove("extraHosts");
        overrides.fields().forEachRemaining(section -> {
            if (section.getValue() instanceof ObjectNode values) {
                ConfigLoader.section(tree, section.getKey()).setAll(values);
            }
        });
        if (extraHosts instanceof ArrayNode hosts && !hosts.isEmpty()) {
            ConfigLoader.section(tree, "trust").withArray("hosts").addAll(hosts);
        }
    }

    private static String value(String[] args, int i) throws ConfigurationException {
        if (i >= args.length) throw new ConfigurationException("Option " + args[i - 1] + " needs a value");
        return args[i];
    }

    private static int intValue(String[] args, int i) throws ConfigurationException {
        String value = value(args, i);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + args[i - 1] + " needs a number, not " + value);
        }
    }

    private static void usage(PrintStream out) {
        out.println("Usage: scriptorium [archive] [options] SOURCE");
        out.println("       scriptorium missing --master FILE --candidates FILE --out FILE");
        out.println("Options:");
        out.println("  -c, --config FILE         Configuration file (default DATA_DIR/config.yaml)");
        out.println("  -d, --data-dir DIR        Directory for the ledger and archived files (default data)");
        out.println("  -w, --workers N           Number of concurrent workers");
        out.println("      --timeout DURATION    Per-request timeout, e.g. 60s");
        out.println("      --retries N           Retries per URL on transient failures");
        out.println("      --allow-licensed      Fetch from hosts marked licensed");
        out.println("      --accept-scan-only    Fetch from scan-only hosts and keep documents without text");
        out.println("      --trust-host HOST     Add a trusted host (repeatable)");
        out.println("      --force               Re-fetch candidates that are already archived");
        out.println("      --max-candidates N    Only process the first N candidates");
        out.println("      --run-timeout DURATION Cancel the run after this long");
        out.println("      --no-warc             Don't write WARC files");
        out.println("      --dump-config         Print the effective configuration and exit");
        out.println("      --log-file FILE       Also write the log to FILE");
        out.println("  -v, --verbose             Debug logging");
        out.println("  -h, --help");
    }

    private static void setLevel(Level level) {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger("org.netpreserve.scriptorium").setLevel(level);
    }

    private static void addLogFile(String file) {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg %kvp%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
