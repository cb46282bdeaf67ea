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
package org.syndication.listingfeed.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.syndication.listingfeed.phase5.reconcile.FetchRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keeps a cumulative CSV file with one row per committed import run.
 */
public class RunHistoryCsvWriter {

    private static final Logger logger = LoggerFactory.getLogger(RunHistoryCsvWriter.class);

    static final String[] HEADERS = {
        "created_at", "file_date", "source_url", "source_name",
        "items_total", "items_added", "items_updated", "items_marked_sold", "duration_seconds"
    };

    private final Path csvPath;

    public RunHistoryCsvWriter(Path csvPath) {
        this.csvPath = csvPath;
    }

    /**
     * Appends a run to the history file, creating it with a header on first use.
     * Existing rows are kept as they are.
     *
     * @throws IOException if the existing file has a different column layout
     */
    public void append(FetchRunResult result) throws IOException {
        Path parent = csvPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<String[]> rows = new ArrayList<>();
        if (Files.exists(csvPath) && Files.size(csvPath) > 0) {
            rows.addAll(readRows());
        }
        rows.add(toRow(result));

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setQuoteMode(QuoteMode.ALL)
            .setRecordSeparator(System.lineSeparator())
            .build();
        try (CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8), format)) {
            for (String[] row : rows) {
                printer.printRecord((Object[]) row);
            }
        }
        logger.info("Appended run to history {} ({} runs recorded)", csvPath, rows.size());
    }

    /**
     * All recorded rows, oldest first, without the header.
     */
    public List<String[]> readRows() throws IOException {
        List<String[]> rows = new ArrayList<>();
        if (!Files.exists(csvPath)) {
            return rows;
        }
        try (CSVParser parser = CSVParser.parse(csvPath, StandardCharsets.UTF_8,
                CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .build())) {

            List<String> existingHeaders = parser.getHeaderNames();
            if (existingHeaders.size() != HEADERS.length) {
                throw new IOException(String.format(
                    "Header mismatch in %s: existing file has %d columns, expected %d",
                    csvPath, existingHeaders.size(), HEADERS.length));
            }
            for (CSVRecord record : parser) {
                String[] row = new String[HEADERS.length];
                for (int i = 0; i < HEADERS.length; i++) {
                    row[i] = record.get(i);
                }
                rows.add(row);
            }
        }
        return rows;
    }

    static String[] toRow(FetchRunResult result) {
        return new String[] {
            String.valueOf(result.getCreatedAt()),
            result.getBundleDate() != null ? result.getBundleDate().toString() : "",
            nullToEmpty(result.getSourceUrl()),
            nullToEmpty(result.getSourceName()),
            String.valueOf(result.getItemsTotal()),
            String.valueOf(result.getItemsAdded()),
            String.valueOf(result.getItemsUpdated()),
            String.valueOf(result.getItemsMarkedSold()),
            String.format(Locale.ROOT, "%.3f", result.getDurationSeconds())
        };
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
