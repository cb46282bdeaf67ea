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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small feed bundles and rows for tests.
 */
public final class BundleFixtures {

    private static final Charset FEED_CHARSET = Charset.forName(FeedLayout.FEED_CHARSET);
    private static final int PRIMARY_COLUMNS = 32;

    private final Map<String, List<String>> entries = new LinkedHashMap<>();

    public static BundleFixtures bundle() {
        return new BundleFixtures();
    }

    /**
     * Adds rows to an entry; every row is a ready CSV line.
     */
    public BundleFixtures entry(String name, String... lines) {
        entries.computeIfAbsent(name, k -> new ArrayList<>()).addAll(Arrays.asList(lines));
        return this;
    }

    public BundleFixtures listing(String id, String price, String civic, String street, String postal) {
        return entry(FeedLayout.Listings.ENTRY, csv(primaryRow(id, price, civic, street, postal)));
    }

    public byte[] zip() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                String text = String.join("\r\n", entry.getValue()) + "\r\n";
                zip.write(text.getBytes(FEED_CHARSET));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    /**
     * Primary row with every column empty except the given ones.
     */
    public static List<String> primaryRow(String id, String price, String civic, String street, String postal) {
        List<String> row = new ArrayList<>(Collections.nCopies(PRIMARY_COLUMNS, ""));
        row.set(FeedLayout.ID, id);
        row.set(FeedLayout.Listings.PRICE, price);
        row.set(FeedLayout.Listings.CIVIC_NUMBER, civic);
        row.set(FeedLayout.Listings.STREET, street);
        row.set(FeedLayout.Listings.POSTAL_CODE, postal);
        return row;
    }

    public static List<String> row(String... fields) {
        return Arrays.asList(fields);
    }

    /**
     * Quotes every field the way the feed does.
     */
    public static String csv(List<String> fields) {
        return fields.stream()
                .map(field -> "\"" + field.replace("\"", "\"\"") + "\"")
                .collect(Collectors.joining(","));
    }

    public static String csv(String... fields) {
        return csv(Arrays.asList(fields));
    }
}
