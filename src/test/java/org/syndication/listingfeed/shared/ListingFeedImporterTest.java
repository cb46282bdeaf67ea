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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.syndication.listingfeed.phase1.discover.FakeFeedClient;
import org.syndication.listingfeed.phase5.reconcile.JdbcCatalogStore;
import org.syndication.listingfeed.phase5.reconcile.ListingStatus;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.syndication.listingfeed.shared.BundleFixtures.bundle;
import static org.syndication.listingfeed.shared.BundleFixtures.csv;

/**
 * End-to-end tests of the command line entry point with a fake feed and a temporary catalog.
 */
public class ListingFeedImporterTest {

    private static final String BASE = "http://feed.test/centris/";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-12T15:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private FakeFeedClient client;
    private ByteArrayOutputStream output;
    private String catalogUrl;
    private String configFile;

    @BeforeEach
    public void setUp() {
        client = new FakeFeedClient();
        output = new ByteArrayOutputStream();
        catalogUrl = "jdbc:sqlite:" + tempDir.resolve("catalog.db");
        configFile = tempDir.resolve("config.json").toString();
    }

    private int run(String... extraArgs) {
        String[] base = {"--config", configFile, "--base-url", BASE, "--catalog-url", catalogUrl,
                "--retries", "2", "--retry-seconds", "0"};
        String[] args = new String[base.length + extraArgs.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extraArgs, 0, args, base.length, extraArgs.length);
        ListingFeedImporter importer = new ListingFeedImporter(config -> client, CLOCK, seconds -> { },
                new PrintStream(output, true, StandardCharsets.UTF_8));
        return importer.run(args);
    }

    private static byte[] sampleBundle() {
        return bundle()
                .listing("1001", "250000", "12", "Rue Principale", "J0K 1A0")
                .listing("1002", "189000", "", "", "")
                .entry(FeedLayout.Photos.ENTRY, csv("1001", "1", "", "SAL", "", "", "http://img.test/a.jpg"))
                .zip();
    }

    @Test
    public void testDownloadedBundleIsImported() throws Exception {
        client.withIndex("<a href=\"NOMADESMARKETING20250312.zip\">latest</a>")
                .withFile(BASE + "NOMADESMARKETING20250312.zip", sampleBundle());
        Path exportDir = tempDir.resolve("export");
        Path history = tempDir.resolve("runs.csv");

        int exit = run("--export-dir", exportDir.toString(), "--history-csv", history.toString(),
                "--save-zip-dir", tempDir.resolve("zips").toString());

        assertEquals(ListingFeedImporter.EXIT_OK, exit);
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("Import OK: total=2 +2 ~0 sold=0"));
        assertTrue(client.isClosed());
        assertTrue(Files.exists(exportDir.resolve("NOMADESMARKETING20250312.json")));
        assertTrue(Files.exists(exportDir.resolve("listings-latest.json")));
        assertTrue(Files.exists(history));
        assertTrue(Files.exists(tempDir.resolve("zips/NOMADESMARKETING20250312.zip")));

        JdbcCatalogStore store = new JdbcCatalogStore(catalogUrl);
        assertEquals(ListingStatus.ACTIVE, store.findEntry("1002").orElseThrow().getStatus());
        assertEquals(1, store.listRunResults().size());
        assertEquals(BASE + "NOMADESMARKETING20250312.zip", store.listRunResults().get(0).getSourceUrl());
    }

    @Test
    public void testReplayOfSavedBundleRetiresMissingListings() throws Exception {
        Path first = Files.write(tempDir.resolve("NOMADESMARKETING20250311.zip"), sampleBundle());
        Path second = Files.write(tempDir.resolve("NOMADESMARKETING20250312.zip"),
                bundle().listing("1001", "250000", "", "", "").zip());

        assertEquals(ListingFeedImporter.EXIT_OK, run("--bundle-file", first.toString()));
        assertEquals(ListingFeedImporter.EXIT_OK, run("--bundle-file", second.toString()));

        assertTrue(output.toString(StandardCharsets.UTF_8).contains("Import OK: total=1 +0 ~1 sold=1"));
        JdbcCatalogStore store = new JdbcCatalogStore(catalogUrl);
        assertEquals(ListingStatus.SOLD, store.findEntry("1002").orElseThrow().getStatus());
        assertTrue(client.getRequests().isEmpty());
    }

    @Test
    public void testNoMarkSoldOption() throws Exception {
        Path first = Files.write(tempDir.resolve("a.zip"), sampleBundle());
        Path second = Files.write(tempDir.resolve("b.zip"), bundle().listing("1001", "1", "", "", "").zip());

        run("--bundle-file", first.toString());
        assertEquals(ListingFeedImporter.EXIT_OK, run("--bundle-file", second.toString(), "--no-mark-sold"));

        JdbcCatalogStore store = new JdbcCatalogStore(catalogUrl);
        assertEquals(ListingStatus.ACTIVE, store.findEntry("1002").orElseThrow().getStatus());
        assertNull(store.listRunResults().get(0).getBundleDate());
    }

    @Test
    public void testMissingBundleExitsWithFetchCode() {
        assertEquals(ListingFeedImporter.EXIT_FETCH, run());
        assertEquals(8, client.getRequests().size());
    }

    @Test
    public void testCorruptBundleExitsWithFetchCode() throws Exception {
        Path bad = Files.writeString(tempDir.resolve("bad.zip"), "not a zip");

        assertEquals(ListingFeedImporter.EXIT_FETCH, run("--bundle-file", bad.toString()));
    }

    @Test
    public void testBrokenCatalogExitsWithCatalogCode() throws Exception {
        Path bundle = Files.write(tempDir.resolve("a.zip"), sampleBundle());
        catalogUrl = "jdbc:nosuchdriver:catalog";

        assertEquals(ListingFeedImporter.EXIT_CATALOG, run("--bundle-file", bundle.toString()));
    }

    @Test
    public void testUsageErrors() {
        ListingFeedImporter importer = new ListingFeedImporter(config -> client, CLOCK, seconds -> { },
                new PrintStream(output, true, StandardCharsets.UTF_8));

        assertEquals(ListingFeedImporter.EXIT_USAGE, importer.run(new String[] {"--bogus"}));
        assertEquals(ListingFeedImporter.EXIT_USAGE, importer.run(new String[] {"--retries", "many"}));
        assertEquals(ListingFeedImporter.EXIT_USAGE, importer.run(new String[] {"--retries"}));
        assertEquals(ListingFeedImporter.EXIT_OK, importer.run(new String[] {"--help"}));
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("--bundle-file"));
    }

    @Test
    public void testOptionsOverrideConfiguration() {
        Configuration config = new Configuration();
        ListingFeedImporter.Options options = ListingFeedImporter.Options.parse(new String[] {
            "--base-url", " http://other.test/ ", "--retries", "3", "--retry-seconds", "10",
            "--no-mark-sold", "--save-zip-dir", "zips"});

        options.applyTo(config);

        assertEquals("http://other.test/", config.getBaseUrl());
        assertEquals(3, config.getMaxAttempts());
        assertEquals(10, config.getRetrySeconds());
        assertFalse(config.isMarkSold());
        assertEquals("zips", config.getSaveBundleDir());
        assertEquals("jdbc:sqlite:listing-catalog.db", config.getCatalogJdbcUrl());
    }
}
