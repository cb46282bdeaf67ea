/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.syndication.listingfeed.shared;

import org.syndication.listingfeed.export.ListingJsonExporter;
import org.syndication.listingfeed.export.RunHistoryCsvWriter;
import org.syndication.listingfeed.phase1.discover.DiscoveryException;
import org.syndication.listingfeed.phase1.discover.FeedClient;
import org.syndication.listingfeed.phase1.discover.FeedDiscovery;
import org.syndication.listingfeed.phase1.discover.HttpFeedClient;
import org.syndication.listingfeed.phase2.fetch.FetchException;
import org.syndication.listingfeed.phase2.fetch.Sleeper;
import org.syndication.listingfeed.phase2.fetch.Snapshot;
import org.syndication.listingfeed.phase2.fetch.SnapshotFetcher;
import org.syndication.listingfeed.phase3.decode.ArchiveDecoder;
import org.syndication.listingfeed.phase3.decode.DecodedBundle;
import org.syndication.listingfeed.phase4.extract.RecordExtractor;
import org.syndication.listingfeed.phase5.reconcile.FetchRunResult;
import org.syndication.listingfeed.phase5.reconcile.JdbcCatalogStore;
import org.syndication.listingfeed.phase5.reconcile.ReconciliationEngine;
import org.syndication.listingfeed.phase5.reconcile.ReconciliationException;
import org.syndication.listingfeed.phase5.reconcile.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Command line entry point: one synchronous import of the current bundle.
 *
 * Usage:
 * mvn exec:java -Dexec.args="--retries 3 --retry-seconds 60 --save-zip-dir bundles"
 *
 * Exit codes: 0 success, 1 usage or configuration error, 2 discovery or download failure,
 * 3 catalog failure.
 */
public class ListingFeedImporter {

    private static final Logger logger = LoggerFactory.getLogger(ListingFeedImporter.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FETCH = 2;
    public static final int EXIT_CATALOG = 3;

    private final Function<Configuration, FeedClient> clientFactory;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PrintStream out;

    public ListingFeedImporter() {
        this(HttpFeedClient::new, Clock.systemUTC(), Sleeper.SYSTEM, System.out);
    }

    ListingFeedImporter(Function<Configuration, FeedClient> clientFactory, Clock clock, Sleeper sleeper,
                        PrintStream out) {
        this.clientFactory = clientFactory;
        this.clock = clock;
        this.sleeper = sleeper;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new ListingFeedImporter().run(args));
    }

    /**
     * Runs one import and returns the process exit code.
     */
    public int run(String[] args) {
        long startNanos = System.nanoTime();
        Instant runTimestamp = Instant.now(clock);

        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage(System.err);
            return EXIT_USAGE;
        }
        if (options.help) {
            printUsage(out);
            return EXIT_OK;
        }

        Configuration config;
        try {
            config = Configuration.load(new File(options.configFile));
            options.applyTo(config);
            config.getFeedZoneId(); // fail fast on an unknown zone
        } catch (IOException | RuntimeException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        logger.info("=".repeat(60));
        logger.info("Listing feed import started at {}", runTimestamp);
        logger.info("=".repeat(60));

        // Phases 1-2: locate and fetch the bundle
        Snapshot snapshot;
        try {
            snapshot = obtainSnapshot(config, options);
        } catch (DiscoveryException e) {
            logger.error("Discovery failed: {}", e.getMessage());
            return EXIT_FETCH;
        } catch (FetchException e) {
            logger.error("Download failed after {} attempt(s): {}", e.getAttempts(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return EXIT_FETCH;
        } catch (IOException e) {
            logger.error("Could not read bundle file {}: {}", options.bundleFile, e.getMessage());
            return EXIT_FETCH;
        }

        // Phase 3: decode
        DecodedBundle bundle;
        try {
            bundle = new ArchiveDecoder().decode(snapshot.getBytes());
        } catch (IOException e) {
            logger.error("Bundle {} could not be opened: {}", snapshot.getBundle().getFilename(), e.getMessage());
            return EXIT_FETCH;
        }

        // Phases 4-5: extract and reconcile
        RunContext context = new RunContext(runTimestamp, snapshot.getBundle().getDate(),
                snapshot.getBundle().getUrl(), snapshot.getBundle().getFilename(), startNanos, config.isMarkSold());
        List<ListingRecord> extracted = new ArrayList<>();
        FetchRunResult result;
        try (JdbcCatalogStore store = new JdbcCatalogStore(config.getCatalogJdbcUrl(),
                config.getCatalogUser(), config.getCatalogPassword())) {
            ReconciliationEngine engine = new ReconciliationEngine(store, new RecordExtractor());
            result = engine.reconcile(bundle, context, extracted::add);
        } catch (ReconciliationException e) {
            logger.error("Import failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return EXIT_CATALOG;
        } catch (SQLException e) {
            logger.error("Catalog {} unavailable: {}", config.getCatalogJdbcUrl(), e.getMessage());
            return EXIT_CATALOG;
        }

        writeExtras(config, snapshot, extracted, result);

        logger.info("=".repeat(60));
        logger.info("Import of {} complete in {} s", result.getSourceName(),
                String.format("%.1f", result.getDurationSeconds()));
        logger.info("=".repeat(60));
        out.println("Import OK: " + result.summary());
        return EXIT_OK;
    }

    private Snapshot obtainSnapshot(Configuration config, Options options)
            throws DiscoveryException, FetchException, IOException {
        try (FeedClient client = clientFactory.apply(config)) {
            SnapshotFetcher fetcher = new SnapshotFetcher(client, new FeedDiscovery(client, config),
                    config, clock, sleeper);
            if (options.bundleFile != null) {
                return fetcher.load(Paths.get(options.bundleFile));
            }
            return fetcher.fetch();
        }
    }

    /**
     * Optional outputs. The catalog is already committed, so a failure here is only reported.
     */
    private void writeExtras(Configuration config, Snapshot snapshot, List<ListingRecord> extracted,
                             FetchRunResult result) {
        if (config.hasExportDir()) {
            try {
                new ListingJsonExporter(Paths.get(config.getExportDir()))
                        .export(snapshot.getBundle().getFilename(), extracted);
            } catch (IOException e) {
                logger.warn("JSON export to {} failed: {}", config.getExportDir(), e.getMessage());
            }
        }
        if (config.hasHistoryCsvPath()) {
            try {
                new RunHistoryCsvWriter(Path.of(config.getHistoryCsvPath())).append(result);
            } catch (IOException e) {
                logger.warn("Run history {} not updated: {}", config.getHistoryCsvPath(), e.getMessage());
            }
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: ListingFeedImporter [options]");
        stream.println("  --config <file>          configuration file (default: " + Configuration.DEFAULT_CONFIG_FILE + ")");
        stream.println("  --base-url <url>         feed directory URL");
        stream.println("  --retries <n>            download attempts (default: 12)");
        stream.println("  --retry-seconds <s>      pause between attempts (default: 300)");
        stream.println("  --save-zip-dir <dir>     keep the downloaded bundle in this directory");
        stream.println("  --no-mark-sold           do not retire listings missing from the bundle");
        stream.println("  --catalog-url <jdbc-url> catalog database");
        stream.println("  --export-dir <dir>       write the extracted listings as JSON");
        stream.println("  --history-csv <file>     append the run result to this CSV file");
        stream.println("  --bundle-file <zip>      import a saved bundle instead of downloading");
        stream.println("  --help                   show this help");
    }

    /**
     * Parsed command line. Only options given on the command line override the configuration file.
     */
    static final class Options {
        String configFile = Configuration.DEFAULT_CONFIG_FILE;
        String baseUrl;
        Integer retries;
        Integer retrySeconds;
        String saveZipDir;
        boolean noMarkSold;
        String catalogUrl;
        String exportDir;
        String historyCsv;
        String bundleFile;
        boolean help;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config":
                        options.configFile = value(args, ++i, arg);
                        break;
                    case "--base-url":
                        options.baseUrl = value(args, ++i, arg);
                        break;
                    case "--retries":
                        options.retries = intValue(args, ++i, arg);
                        break;
                    case "--retry-seconds":
                        options.retrySeconds = intValue(args, ++i, arg);
                        break;
                    case "--save-zip-dir":
                        options.saveZipDir = value(args, ++i, arg);
                        break;
                    case "--no-mark-sold":
                        options.noMarkSold = true;
                        break;
                    case "--catalog-url":
                        options.catalogUrl = value(args, ++i, arg);
                        break;
                    case "--export-dir":
                        options.exportDir = value(args, ++i, arg);
                        break;
                    case "--history-csv":
                        options.historyCsv = value(args, ++i, arg);
                        break;
                    case "--bundle-file":
                        options.bundleFile = value(args, ++i, arg);
                        break;
                    case "--help":
                    case "-h":
                        options.help = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            return options;
        }

        void applyTo(Configuration config) {
            if (baseUrl != null) config.setBaseUrl(baseUrl.trim());
            if (retries != null) config.setMaxAttempts(retries);
            if (retrySeconds != null) config.setRetrySeconds(retrySeconds);
            if (saveZipDir != null) config.setSaveBundleDir(saveZipDir.trim());
            if (noMarkSold) config.setMarkSold(false);
            if (catalogUrl != null) config.setCatalogJdbcUrl(catalogUrl);
            if (exportDir != null) config.setExportDir(exportDir);
            if (historyCsv != null) config.setHistoryCsvPath(historyCsv);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int intValue(String[] args, int index, String option) {
            String raw = value(args, index, option);
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for " + option + ": " + raw, e);
            }
        }
    }
}
