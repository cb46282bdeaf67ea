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

import org.syndication.listingfeed.phase1.discover.DiscoveryException;
import org.syndication.listingfeed.phase1.discover.FeedClient;
import org.syndication.listingfeed.phase1.discover.FeedDiscovery;
import org.syndication.listingfeed.phase1.discover.ResolvedBundle;
import org.syndication.listingfeed.shared.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Downloads the current bundle, tolerating late publication.
 *
 * Each attempt re-runs discovery against the feed-local date, so a bundle published
 * while we wait is picked up by the next attempt. Attempts are separated by a fixed pause.
 */
public class SnapshotFetcher {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotFetcher.class);

    private final FeedClient client;
    private final FeedDiscovery discovery;
    private final Configuration config;
    private final Clock clock;
    private final Sleeper sleeper;

    public SnapshotFetcher(FeedClient client, Configuration config) {
        this(client, new FeedDiscovery(client, config), config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public SnapshotFetcher(FeedClient client, FeedDiscovery discovery, Configuration config,
                           Clock clock, Sleeper sleeper) {
        this.client = client;
        this.discovery = discovery;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Discovers and downloads the bundle, retrying up to the configured number of attempts.
     *
     * @throws DiscoveryException if every attempt failed to locate a bundle
     * @throws FetchException if attempts were exhausted and at least one got past discovery
     */
    public Snapshot fetch() throws DiscoveryException, FetchException {
        int maxAttempts = config.getEffectiveMaxAttempts();
        int retrySeconds = config.getEffectiveRetrySeconds();

        Exception lastFailure = null;
        boolean onlyDiscoveryFailures = true;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            LocalDate today = LocalDate.now(clock.withZone(config.getFeedZoneId()));
            try {
                ResolvedBundle bundle = discovery.resolve(today);
                logger.info("Attempt {}/{}: downloading {}", attempt, maxAttempts, bundle.getUrl());

                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                long size = client.download(bundle.getUrl(), buffer);
                logger.info("Downloaded {} ({} bytes)", bundle.getFilename(), size);

                Snapshot snapshot = new Snapshot(bundle, buffer.toByteArray(), attempt);
                saveRawBundle(snapshot);
                return snapshot;
            } catch (DiscoveryException e) {
                lastFailure = e;
                logger.warn("Attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            } catch (IOException | RuntimeException e) {
                lastFailure = e;
                onlyDiscoveryFailures = false;
                logger.warn("Attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                logger.info("Waiting {} seconds before next attempt...", retrySeconds);
                try {
                    sleeper.sleep(retrySeconds);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchException("Interrupted while waiting to retry after attempt " + attempt, e);
                }
            }
        }

        if (onlyDiscoveryFailures) {
            logger.error("No bundle could be discovered in {} attempt(s)", maxAttempts);
            throw new DiscoveryException("No bundle discovered after " + maxAttempts + " attempt(s): "
                    + lastFailure.getMessage(), lastFailure);
        }
        logger.error("Bundle download failed after {} attempt(s): {}", maxAttempts, lastFailure.getMessage());
        throw new FetchException(maxAttempts, lastFailure);
    }

    /**
     * Loads a previously saved bundle from disk for replay.
     */
    public Snapshot load(Path bundleFile) throws IOException {
        byte[] bytes = Files.readAllBytes(bundleFile);
        String filename = bundleFile.getFileName().toString();
        ResolvedBundle bundle = new ResolvedBundle(bundleFile.toUri().toString(),
                discovery.parseDate(filename), filename);
        logger.info("Loaded bundle {} from disk ({} bytes)", filename, bytes.length);
        return new Snapshot(bundle, bytes, 0);
    }

    private void saveRawBundle(Snapshot snapshot) {
        if (!config.hasSaveBundleDir()) {
            return;
        }
        Path target = Paths.get(config.getSaveBundleDir()).resolve(snapshot.getBundle().getFilename());
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, snapshot.getBytes());
            logger.info("Saved raw bundle to {}", target);
        } catch (IOException e) {
            logger.warn("Could not save raw bundle to {}: {}", target, e.getMessage());
        }
    }
}
