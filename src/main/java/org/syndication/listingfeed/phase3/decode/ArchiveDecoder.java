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
package org.syndication.listingfeed.phase3.decode;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.syndication.listingfeed.shared.FeedLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens a bundle archive and decodes its tables.
 *
 * Entries are legacy single-byte text; undecodable bytes are replaced, never fatal.
 * Only the bundle as a whole can fail: bytes that are not a zip archive raise an {@link IOException}.
 */
public class ArchiveDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveDecoder.class);

    private static final Charset FEED_CHARSET = Charset.forName(FeedLayout.FEED_CHARSET);

    // Local file header and end-of-central-directory signatures
    private static final byte[] ZIP_ENTRY_MAGIC = {'P', 'K', 3, 4};
    private static final byte[] ZIP_EMPTY_MAGIC = {'P', 'K', 5, 6};

    // Text after a closing quote (12" de large") and an unclosed quote at end of file are kept as data
    private static final CSVFormat FEED_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setTrailingData(true)
            .setLenientEof(true)
            .build();

    public DecodedBundle decode(byte[] bundle) throws IOException {
        if (!startsWith(bundle, ZIP_ENTRY_MAGIC) && !startsWith(bundle, ZIP_EMPTY_MAGIC)) {
            throw new IOException("Bundle is not a zip archive (" + bundle.length + " bytes)");
        }

        Map<FeedTable, List<List<String>>> tables = new EnumMap<>(FeedTable.class);
        byte[] addenda = null;

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bundle))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                FeedTable table = FeedTable.forEntry(entry.getName());
                if (table == null) {
                    logger.debug("Skipping unknown entry {}", entry.getName());
                    continue;
                }
                byte[] content = zip.readAllBytes();
                if (table.isDecodedOnDemand()) {
                    addenda = content;
                } else {
                    List<List<String>> rows = table == FeedTable.LISTINGS
                            ? parsePrimaryTable(content, table.getEntryName())
                            : parseTable(content, table.getEntryName());
                    tables.put(table, rows);
                    logger.info("Decoded {}: {} rows", table.getEntryName(), rows.size());
                }
            }
        }

        for (FeedTable table : FeedTable.values()) {
            if (!table.isDecodedOnDemand() && !tables.containsKey(table)) {
                if (table == FeedTable.LISTINGS) {
                    logger.warn("Bundle has no {} entry; no listings will be imported", table.getEntryName());
                } else {
                    logger.info("Bundle has no {} entry, treating as empty", table.getEntryName());
                }
            }
        }

        return new DecodedBundle(tables, addenda, bytes -> parseTable(bytes, FeedTable.ADDENDA.getEntryName()));
    }

    /**
     * Decodes legacy-encoded bytes and parses them as quoted comma-separated rows.
     * A parse fault keeps the rows read before it.
     */
    static List<List<String>> parseTable(byte[] content, String entryName) {
        List<List<String>> rows = new ArrayList<>();
        try {
            readRows(content, rows);
        } catch (IOException e) {
            logger.warn("Stopped reading {} after {} rows: {}", entryName, rows.size(), e.getMessage());
        }
        return Collections.unmodifiableList(rows);
    }

    /**
     * Like {@link #parseTable(byte[], String)}, but a parse fault fails the whole bundle.
     * Listings missing from a truncated primary table would otherwise be retired.
     */
    static List<List<String>> parsePrimaryTable(byte[] content, String entryName) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try {
            readRows(content, rows);
        } catch (IOException e) {
            throw new IOException("Cannot read " + entryName + " past row " + rows.size(), e);
        }
        return Collections.unmodifiableList(rows);
    }

    private static void readRows(byte[] content, List<List<String>> rows) throws IOException {
        String text = new String(content, FEED_CHARSET);
        try (CSVParser parser = CSVParser.parse(new StringReader(text), FEED_FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                rows.add(Collections.unmodifiableList(record.toList()));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalStateException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes == null || bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
