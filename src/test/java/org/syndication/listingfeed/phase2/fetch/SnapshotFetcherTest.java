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
package org.syndication.listingfeed.phase2.fetch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.syndication.listingfeed.phase1.discover.DiscoveryException;
import org.syndication.listingfeed.phase1.discover.FakeFeedClient;
import org.syndication.listingfeed.phase1.discover.FeedDiscovery;
import org.syndication.listingfeed.shared.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Phase 2 - bundle fetching with retries.
 */
public class SnapshotFetcherTest {

    private static final String BASE = "http://feed.test/centris/";
    private static final String TODAY_URL = BASE + "NOMADESMARKETING20250312.zip";
    private static final byte[] CONTENT = {'P', 'K', 3, 4, 42};

    // 2025-03-13 02:00 UTC is still 2025-03-12 in the feed's time zone
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-13T02:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final List<Integer> sleeps = new ArrayList<>();

    private Configuration config(int attempts) {
        Configuration config = new Configuration();
        config.setBaseUrl(BASE);
        config.setMaxAttempts(attempts);
        config.setRetrySeconds(7);
        return config;
    }

    private SnapshotFetcher fetcher(FakeFeedClient client, Configuration config, Sleeper sleeper) {
        return new SnapshotFetcher(client, new FeedDiscovery(client, config), config, CLOCK, sleeper);
    }

    @Test
    public void testFirstAttemptSucceedsAndSavesRawBundle() throws Exception {
        FakeFeedClient client = new FakeFeedClient().withFile(TODAY_URL, CONTENT);
        Configuration config = config(3);
        config.setSaveBundleDir(tempDir.resolve("bundles").toString());

        Snapshot snapshot = fetcher(client, config, sleeps::add).fetch();

        assertEquals(1, snapshot.getAttempts());
        assertEquals(LocalDate.of(2025, 3, 12), snapshot.getBundle().getDate());
        assertArrayEquals(CONTENT, snapshot.getBytes());
        assertArrayEquals(CONTENT, Files.readAllBytes(tempDir.resolve("bundles/NOMADESMARKETING20250312.zip")));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void testLatePublicationPickedUpByLaterAttempt() throws Exception {
        FakeFeedClient client = new FakeFeedClient();
        Sleeper publishWhileWaiting = seconds -> {
            sleeps.add(seconds);
            client.withFile(TODAY_URL, CONTENT);
        };

        Snapshot snapshot = fetcher(client, config(5), publishWhileWaiting).fetch();

        assertEquals(2, snapshot.getAttempts());
        assertEquals(List.of(7), sleeps);
    }

    @Test
    public void testDiscoveryFailingEveryAttempt() {
        FakeFeedClient client = new FakeFeedClient();

        DiscoveryException e = assertThrows(DiscoveryException.class,
                () -> fetcher(client, config(3), sleeps::add).fetch());

        assertTrue(e.getMessage().contains("3 attempt"));
        assertEquals(List.of(7, 7), sleeps);
    }

    @Test
    public void testDownloadFailingEveryAttempt() {
        FakeFeedClient client = new FakeFeedClient().withBrokenDownload(TODAY_URL);

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher(client, config(3), sleeps::add).fetch());

        assertEquals(3, e.getAttempts());
        assertTrue(e.getCause().getMessage().contains("Read timed out"));
        assertEquals(2, sleeps.size());
    }

    @Test
    public void testSaveFailureDoesNotFailFetch() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("occupied"), "x");
        FakeFeedClient client = new FakeFeedClient().withFile(TODAY_URL, CONTENT);
        Configuration config = config(1);
        config.setSaveBundleDir(notADirectory.toString());

        Snapshot snapshot = fetcher(client, config, sleeps::add).fetch();

        assertEquals(CONTENT.length, snapshot.size());
    }

    @Test
    public void testLoadSavedBundle() throws Exception {
        Path saved = Files.write(tempDir.resolve("NOMADESMARKETING20250301.zip"), CONTENT);
        Path other = Files.write(tempDir.resolve("manual-export.zip"), CONTENT);
        SnapshotFetcher fetcher = fetcher(new FakeFeedClient(), config(1), sleeps::add);

        Snapshot snapshot = fetcher.load(saved);
        assertEquals(LocalDate.of(2025, 3, 1), snapshot.getBundle().getDate());
        assertEquals("NOMADESMARKETING20250301.zip", snapshot.getBundle().getFilename());
        assertEquals(0, snapshot.getAttempts());

        assertNull(fetcher.load(other).getBundle().getDate());
    }
}
