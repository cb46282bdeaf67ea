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
package org.syndication.listingfeed.phase1.discover;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.syndication.listingfeed.shared.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Comparator;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the newest publishable bundle on the feed host.
 *
 * The index page is scanned for dated filenames first. When the index is unreachable
 * or lists nothing usable, today's and the two previous days' filenames are probed
 * with HEAD requests. Discovery itself never retries; that is the fetcher's job.
 */
public class FeedDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(FeedDiscovery.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    /** Days probed when the index gives nothing: today, yesterday, the day before. */
    static final int PROBE_DAYS = 3;

    private final FeedClient client;
    private final String baseUrl;
    private final String prefix;
    private final String extension;
    private final Pattern filenamePattern;

    public FeedDiscovery(FeedClient client, Configuration config) {
        this.client = client;
        this.baseUrl = config.getBaseUrl();
        this.prefix = config.getBundlePrefix();
        this.extension = config.getBundleExtension();
        this.filenamePattern = Pattern.compile(
                Pattern.quote(prefix) + "(\\d{8})\\." + Pattern.quote(extension));
    }

    /**
     * Resolves the bundle to download for the given feed-local day.
     *
     * @throws DiscoveryException if neither the index nor the probes yield a bundle
     */
    public ResolvedBundle resolve(LocalDate today) throws DiscoveryException {
        Optional<LocalDate> fromIndex = scanIndex(today);
        if (fromIndex.isPresent()) {
            ResolvedBundle bundle = bundleFor(fromIndex.get());
            logger.info("Discovered bundle on index page: {}", bundle);
            return bundle;
        }

        for (int back = 0; back < PROBE_DAYS; back++) {
            ResolvedBundle candidate = bundleFor(today.minusDays(back));
            if (probe(candidate.getUrl())) {
                logger.info("Discovered bundle by probing: {}", candidate);
                return candidate;
            }
        }

        throw new DiscoveryException("No bundle found at " + baseUrl
                + " (index empty or unreachable, probes for " + today + " and "
                + (PROBE_DAYS - 1) + " previous days failed)");
    }

    /**
     * Builds the bundle for a date: base URL without trailing slash, then the dated filename.
     */
    public ResolvedBundle bundleFor(LocalDate date) {
        String filename = prefix + FILE_DATE.format(date) + "." + extension;
        return new ResolvedBundle(joinUrl(baseUrl, filename), date, filename);
    }

    /**
     * Publication date of a bundle filename, or {@code null} when the name is not a dated bundle name.
     */
    public LocalDate parseDate(String filename) {
        if (filename == null) {
            return null;
        }
        Matcher matcher = filenamePattern.matcher(filename);
        return matcher.matches() ? toDate(matcher.group(1)) : null;
    }

    private Optional<LocalDate> scanIndex(LocalDate today) {
        String html;
        try {
            html = client.fetchIndex(baseUrl);
        } catch (IOException e) {
            logger.warn("Index page {} unreachable: {}", baseUrl, e.getMessage());
            return Optional.empty();
        }

        TreeMap<LocalDate, String> found = new TreeMap<>(Comparator.naturalOrder());

        // Anchors first, then the raw text so plain directory listings are covered too
        Document doc = Jsoup.parse(html, baseUrl);
        for (Element link : doc.select("a[href]")) {
            collect(link.attr("href"), found);
            collect(link.text(), found);
        }
        collect(html, found);

        if (found.isEmpty()) {
            logger.info("Index page lists no {}yyyyMMdd.{} bundle", prefix, extension);
            return Optional.empty();
        }
        logger.debug("Index page lists {} dated bundles, newest {}", found.size(), found.lastKey());

        LocalDate notAfterToday = found.floorKey(today);
        return Optional.of(notAfterToday != null ? notAfterToday : found.lastKey());
    }

    private void collect(String text, TreeMap<LocalDate, String> found) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = filenamePattern.matcher(text);
        while (matcher.find()) {
            LocalDate date = toDate(matcher.group(1));
            if (date != null) {
                found.putIfAbsent(date, matcher.group());
            }
        }
    }

    private boolean probe(String url) {
        try {
            return client.exists(url);
        } catch (IOException e) {
            logger.debug("Probe failed for {}: {}", url, e.getMessage());
            return false;
        }
    }

    private static LocalDate toDate(String digits) {
        try {
            return LocalDate.parse(digits, FILE_DATE);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring invalid bundle date {}", digits);
            return null;
        }
    }

    static String joinUrl(String base, String filename) {
        String trimmed = base;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + "/" + filename;
    }
}
