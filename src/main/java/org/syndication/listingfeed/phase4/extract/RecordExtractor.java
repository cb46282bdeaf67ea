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
package org.syndication.listingfeed.phase4.extract;

import org.jsoup.Jsoup;
import org.syndication.listingfeed.phase3.decode.DecodedBundle;
import org.syndication.listingfeed.phase3.decode.FeedTable;
import org.syndication.listingfeed.shared.Characteristic;
import org.syndication.listingfeed.shared.CodeTables;
import org.syndication.listingfeed.shared.FeedLayout;
import org.syndication.listingfeed.shared.FeedLayout.Characteristics;
import org.syndication.listingfeed.shared.FeedLayout.Listings;
import org.syndication.listingfeed.shared.FeedLayout.Photos;
import org.syndication.listingfeed.shared.FeedLayout.Remarks;
import org.syndication.listingfeed.shared.FeedLayout.Rooms;
import org.syndication.listingfeed.shared.FeedLayout.Units;
import org.syndication.listingfeed.shared.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives a {@link ListingRecord} from the primary row of a listing and its auxiliary rows.
 *
 * Every field is extracted on its own: a field whose heuristic fails or throws is left
 * null (or empty) and the remaining fields are still extracted. Nothing here throws for
 * malformed feed content.
 */
public class RecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RecordExtractor.class);

    private static final Pattern PROXIMITY_MARKER = Pattern.compile("À\\s*proximité\\s*:?\\s*(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    private static final Pattern PROXIMITY_SEPARATOR = Pattern.compile("[;,]\\s*");

    /**
     * Extracts the listing of a primary row, pulling its auxiliary rows from the bundle.
     * The primary row must carry a non-empty id.
     */
    public ListingRecord extract(List<String> primaryRow, DecodedBundle bundle) {
        String id = FeedLayout.clean(primaryRow.get(FeedLayout.ID));
        return extract(primaryRow,
                bundle.rowsFor(FeedTable.REMARKS, id),
                bundle.rowsFor(FeedTable.CHARACTERISTICS, id),
                bundle.rowsFor(FeedTable.PHOTOS, id),
                bundle.rowsFor(FeedTable.UNITS, id),
                bundle.rowsFor(FeedTable.ROOMS, id),
                safely("addenda", id, () -> bundle.addendaFor(id).orElse(null)));
    }

    /**
     * Extracts a listing from already grouped rows. {@code addenda} may be {@code null}.
     */
    public ListingRecord extract(List<String> primaryRow,
                                 List<List<String>> remarkRows,
                                 List<List<String>> characteristicRows,
                                 List<List<String>> photoRows,
                                 List<List<String>> unitRows,
                                 List<List<String>> roomRows,
                                 String addenda) {
        String id = FeedLayout.clean(primaryRow.get(FeedLayout.ID));
        ListingRecord record = new ListingRecord(id);

        record.setPrice(safely("price", id, () -> extractPrice(primaryRow)));
        record.setAddress(safely("address", id, () -> extractAddress(primaryRow)));
        record.setConstructionYear(safely("construction year", id, () -> extractYear(primaryRow)));
        record.setDescription(safely("description", id, () -> extractDescription(remarkRows)));
        record.setProximity(safely("proximity", id, () -> extractProximity(characteristicRows, addenda)));
        record.setCharacteristics(safely("characteristics", id, () -> extractCharacteristics(characteristicRows)));

        List<String> principal = safely("principal unit", id, () -> principalUnit(unitRows));
        if (principal != null && principal.size() >= Units.MIN_COLUMNS) {
            record.setTotalRooms(safely("total rooms", id, () -> digits(principal.get(Units.TOTAL_ROOMS))));
            record.setBedrooms(safely("bedrooms", id, () -> digits(principal.get(Units.BEDROOMS))));
        }
        record.setBathrooms(safely("bathrooms", id, () -> countBathrooms(roomRows)));
        record.setPhotos(safely("photos", id, () -> extractPhotos(photoRows)));

        return record;
    }

    static Integer extractPrice(List<String> row) {
        if (row.size() <= Listings.PRICE) {
            return null;
        }
        return digits(row.get(Listings.PRICE));
    }

    /**
     * Civic number, street and postal code joined by ", "; {@code null} if all are empty.
     */
    static String extractAddress(List<String> row) {
        List<String> parts = new ArrayList<>(3);
        for (int column : new int[] {Listings.CIVIC_NUMBER, Listings.STREET, Listings.POSTAL_CODE}) {
            String part = row.size() > column ? FeedLayout.clean(row.get(column)) : "";
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    /**
     * First field of the row that is exactly four digits with a value in the accepted year range.
     */
    static Integer extractYear(List<String> row) {
        for (String field : row) {
            String value = FeedLayout.clean(field);
            if (value.length() == 4 && isDigits(value)) {
                int year = Integer.parseInt(value);
                if (year >= Listings.YEAR_MIN && year <= Listings.YEAR_MAX) {
                    return year;
                }
            }
        }
        return null;
    }

    static String extractDescription(List<List<String>> remarkRows) {
        List<List<String>> chosen = new ArrayList<>();
        for (List<String> row : remarkRows) {
            if (row.size() >= Remarks.MIN_COLUMNS
                    && Remarks.DESCRIPTION_MARKER.equals(FeedLayout.clean(row.get(Remarks.MARKER)))) {
                chosen.add(row);
            }
        }

        // Sort by sequence only when every sequence is numeric; otherwise keep file order
        List<Long> keys = new ArrayList<>(chosen.size());
        boolean sortable = true;
        for (List<String> row : chosen) {
            String sequence = FeedLayout.clean(row.get(Remarks.SEQUENCE));
            if (sequence.isEmpty()) {
                keys.add(0L);
            } else if (isDigits(sequence) && sequence.length() < 19) {
                keys.add(Long.parseLong(sequence));
            } else {
                sortable = false;
                break;
            }
        }
        if (sortable) {
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < chosen.size(); i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingLong(i -> keys.get(i)));
            List<List<String>> sorted = new ArrayList<>(chosen.size());
            for (int i : order) {
                sorted.add(chosen.get(i));
            }
            chosen = sorted;
        }

        String text = chosen.stream()
                .map(row -> FeedLayout.clean(row.get(row.size() - 1)))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(" "));
        return FeedLayout.replaceLineBreaks(text).trim();
    }

    /**
     * Proximity items from the structured rows, or from the addenda prose when there are none.
     */
    static List<String> extractProximity(List<List<String>> characteristicRows, String addenda) {
        List<String> items = new ArrayList<>();
        for (List<String> row : characteristicRows) {
            if (row.size() >= Characteristics.MIN_COLUMNS
                    && Characteristics.PROXIMITY_CATEGORY.equals(FeedLayout.clean(row.get(Characteristics.CATEGORY)))) {
                String value = CodeTables.valueLabel(FeedLayout.clean(row.get(Characteristics.VALUE)));
                if (!value.isEmpty()) {
                    items.add(value);
                }
            }
        }
        if (items.isEmpty() && addenda != null && !addenda.isEmpty()) {
            items.addAll(proximityFromText(addenda));
        }
        return items;
    }

    static List<String> proximityFromText(String text) {
        Matcher matcher = PROXIMITY_MARKER.matcher(text);
        if (!matcher.find()) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (String piece : PROXIMITY_SEPARATOR.split(matcher.group(1))) {
            String item = Jsoup.parse(piece).text().trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    static List<Characteristic> extractCharacteristics(List<List<String>> characteristicRows) {
        List<Characteristic> items = new ArrayList<>();
        for (List<String> row : characteristicRows) {
            if (row.size() < Characteristics.MIN_COLUMNS) {
                continue;
            }
            String category = FeedLayout.clean(row.get(Characteristics.CATEGORY));
            if (Characteristics.PROXIMITY_CATEGORY.equals(category)) {
                continue;
            }
            String value = FeedLayout.clean(row.get(Characteristics.VALUE));
            String detail = row.size() > Characteristics.DETAIL ? FeedLayout.clean(row.get(Characteristics.DETAIL)) : "";
            items.add(new Characteristic(CodeTables.categoryLabel(category), CodeTables.valueLabel(value), detail));
        }
        return items;
    }

    /**
     * The unit whose sequence is "1", looked for in sequence order (missing sequence sorts last).
     * Falls back to the first row when there is no such unit or the sequences cannot be ordered.
     */
    static List<String> principalUnit(List<List<String>> unitRows) {
        if (unitRows.isEmpty()) {
            return null;
        }
        List<UnitRef> units = new ArrayList<>(unitRows.size());
        try {
            for (List<String> row : unitRows) {
                units.add(new UnitRef(unitSequence(row), row));
            }
        } catch (RuntimeException e) {
            logger.debug("Unit sequences not sortable, using first unit: {}", e.toString());
            return unitRows.get(0);
        }
        units.sort(Comparator.comparingInt(unit -> unit.sequence));
        for (UnitRef unit : units) {
            if (Units.PRINCIPAL_UNIT.equals(FeedLayout.clean(unit.row.get(Units.UNIT_SEQUENCE)))) {
                return unit.row;
            }
        }
        return unitRows.get(0);
    }

    private static int unitSequence(List<String> row) {
        String sequence = FeedLayout.clean(row.get(Units.UNIT_SEQUENCE));
        return sequence.isEmpty() ? Units.MISSING_SEQUENCE : Integer.parseInt(sequence);
    }

    /**
     * Bathrooms of the principal unit; {@code null} instead of zero.
     */
    static Integer countBathrooms(List<List<String>> roomRows) {
        int count = 0;
        for (List<String> row : roomRows) {
            if (row.size() >= Rooms.MIN_COLUMNS
                    && Units.PRINCIPAL_UNIT.equals(FeedLayout.clean(row.get(Rooms.UNIT_SEQUENCE)))
                    && Rooms.BATHROOM.equals(FeedLayout.clean(row.get(Rooms.ROOM_TYPE)))) {
                count++;
            }
        }
        return count == 0 ? null : count;
    }

    /**
     * Photo URLs ordered by the feed's sequence (non-numeric counts as 0, ties keep file order).
     * The stored sequence is the position in the returned list.
     */
    static List<String> extractPhotos(List<List<String>> photoRows) {
        List<PhotoRef> refs = new ArrayList<>();
        for (List<String> row : photoRows) {
            if (row.size() < Photos.MIN_COLUMNS) {
                continue;
            }
            String url = FeedLayout.clean(row.get(Photos.URL));
            if (!url.startsWith(Photos.URL_SCHEME_PREFIX)) {
                continue;
            }
            String sequence = FeedLayout.clean(row.get(Photos.SEQUENCE));
            long rawSequence = isDigits(sequence) && sequence.length() < 19 ? Long.parseLong(sequence) : 0L;
            refs.add(new PhotoRef(rawSequence, url));
        }
        // List.sort is stable
        refs.sort(Comparator.comparingLong(ref -> ref.rawSequence));
        return refs.stream().map(ref -> ref.url).collect(Collectors.toList());
    }

    private static Integer digits(String raw) {
        String value = FeedLayout.clean(raw);
        if (!isDigits(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static <T> T safely(String field, String id, Supplier<T> extraction) {
        try {
            return extraction.get();
        } catch (RuntimeException e) {
            logger.debug("Listing {}: could not extract {}: {}", id, field, e.toString());
            return null;
        }
    }

    private static final class PhotoRef {
        private final long rawSequence;
        private final String url;

        private PhotoRef(long rawSequence, String url) {
            this.rawSequence = rawSequence;
            this.url = url;
        }
    }

    private static final class UnitRef {
        private final int sequence;
        private final List<String> row;

        private UnitRef(int sequence, List<String> row) {
            this.sequence = sequence;
            this.row = row;
        }
    }
}
