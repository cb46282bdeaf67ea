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

import org.syndication.listingfeed.shared.FeedLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Decoded tables of one bundle.
 *
 * A table whose entry is missing from the archive is reported as absent by {@link #table}
 * and as empty by {@link #rows}; downstream code treats both alike.
 */
public class DecodedBundle {

    private static final Logger logger = LoggerFactory.getLogger(DecodedBundle.class);

    private final Map<FeedTable, List<List<String>>> tables;
    private final Map<FeedTable, Map<String, List<List<String>>>> rowsById = new EnumMap<>(FeedTable.class);

    private final byte[] addendaBytes;
    private final Function<byte[], List<List<String>>> addendaDecoder;
    private Map<String, String> addendaById;

    DecodedBundle(Map<FeedTable, List<List<String>>> tables, byte[] addendaBytes,
                  Function<byte[], List<List<String>>> addendaDecoder) {
        this.tables = new EnumMap<>(FeedTable.class);
        this.tables.putAll(tables);
        this.addendaBytes = addendaBytes;
        this.addendaDecoder = addendaDecoder;
    }

    /**
     * Rows of a table, or empty when the archive has no such entry.
     */
    public Optional<List<List<String>>> table(FeedTable table) {
        return Optional.ofNullable(tables.get(table));
    }

    public List<List<String>> rows(FeedTable table) {
        return tables.getOrDefault(table, Collections.emptyList());
    }

    public boolean hasTable(FeedTable table) {
        if (table.isDecodedOnDemand()) {
            return addendaBytes != null;
        }
        return tables.containsKey(table);
    }

    public Set<FeedTable> presentTables() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    /**
     * Rows of an auxiliary table whose cleaned id column equals {@code id}, in file order.
     */
    public List<List<String>> rowsFor(FeedTable table, String id) {
        Map<String, List<List<String>>> index = rowsById.computeIfAbsent(table, t -> groupById(rows(t)));
        return index.getOrDefault(id, Collections.emptyList());
    }

    /**
     * Narrative addenda of a listing: the non-empty last column of every addenda row for
     * the id, joined by spaces, line-break tags replaced by spaces.
     * The addenda entry is decoded the first time any id is asked for.
     */
    public Optional<String> addendaFor(String id) {
        if (addendaBytes == null) {
            return Optional.empty();
        }
        if (addendaById == null) {
            addendaById = indexAddenda(addendaDecoder.apply(addendaBytes));
        }
        return Optional.ofNullable(addendaById.get(id));
    }

    private static Map<String, List<List<String>>> groupById(List<List<String>> rows) {
        Map<String, List<List<String>>> grouped = new HashMap<>();
        for (List<String> row : rows) {
            if (row.isEmpty()) {
                continue;
            }
            String id = FeedLayout.clean(row.get(FeedLayout.ID));
            grouped.computeIfAbsent(id, k -> new ArrayList<>()).add(row);
        }
        return grouped;
    }

    private static Map<String, String> indexAddenda(List<List<String>> rows) {
        Map<String, StringBuilder> chunks = new LinkedHashMap<>();
        for (List<String> row : rows) {
            if (row.isEmpty()) {
                continue;
            }
            String last = row.get(row.size() - 1);
            if (last == null || last.isEmpty()) {
                continue;
            }
            String id = FeedLayout.clean(row.get(FeedLayout.ID));
            StringBuilder text = chunks.computeIfAbsent(id, k -> new StringBuilder());
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(FeedLayout.clean(last));
        }

        Map<String, String> byId = new HashMap<>();
        chunks.forEach((id, text) -> byId.put(id, FeedLayout.replaceLineBreaks(text.toString())));
        logger.debug("Indexed addenda for {} listings", byId.size());
        return byId;
    }
}
