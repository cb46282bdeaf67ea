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

import java.util.regex.Pattern;

/**
 * Column offsets, markers and entry names of the syndication bundle.
 *
 * The feed is undocumented; every table is read by fixed column position.
 * All offsets are zero-based and column 0 always carries the listing id.
 * A change of the feed format should only require an edit here.
 */
public final class FeedLayout {

    /** Encoding of every text entry inside the bundle. */
    public static final String FEED_CHARSET = "windows-1252";

    public static final int ID = 0;

    private static final Pattern LINE_BREAK_TAG = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);

    private FeedLayout() { }

    /** INSCRIPTIONS.TXT: one row per listing. */
    public static final class Listings {
        public static final String ENTRY = "INSCRIPTIONS.TXT";
        public static final int PRICE = 6;
        public static final int CIVIC_NUMBER = 25;
        public static final int STREET = 27;
        public static final int POSTAL_CODE = 29;
        public static final int YEAR_MIN = 1800;
        public static final int YEAR_MAX = 2035;

        private Listings() { }
    }

    /** REMARQUES.TXT: id, sequence, marker, ..., text (last column). */
    public static final class Remarks {
        public static final String ENTRY = "REMARQUES.TXT";
        public static final int SEQUENCE = 1;
        public static final int MARKER = 2;
        public static final String DESCRIPTION_MARKER = "F";
        public static final int MIN_COLUMNS = 7;

        private Remarks() { }
    }

    /** CARACTERISTIQUES.TXT: id, category code, value code, detail. */
    public static final class Characteristics {
        public static final String ENTRY = "CARACTERISTIQUES.TXT";
        public static final int CATEGORY = 1;
        public static final int VALUE = 2;
        public static final int DETAIL = 3;
        public static final String PROXIMITY_CATEGORY = "PROX";
        public static final int MIN_COLUMNS = 3;

        private Characteristics() { }
    }

    /** PHOTOS.TXT: id, sequence, _, room code, _, _, url, media id, timestamp. */
    public static final class Photos {
        public static final String ENTRY = "PHOTOS.TXT";
        public static final int SEQUENCE = 1;
        public static final int URL = 6;
        public static final String URL_SCHEME_PREFIX = "http";
        public static final int MIN_COLUMNS = 7;

        private Photos() { }
    }

    /** UNITES_DETAILLEES.TXT: id, unit sequence, _, total rooms, bedrooms. */
    public static final class Units {
        public static final String ENTRY = "UNITES_DETAILLEES.TXT";
        public static final int UNIT_SEQUENCE = 1;
        public static final int TOTAL_ROOMS = 3;
        public static final int BEDROOMS = 4;
        public static final String PRINCIPAL_UNIT = "1";
        /** Sort key used for a unit row without a sequence. */
        public static final int MISSING_SEQUENCE = 999;
        public static final int MIN_COLUMNS = 5;

        private Units() { }
    }

    /** PIECES_UNITES.TXT: id, unit sequence, _, room type code. */
    public static final class Rooms {
        public static final String ENTRY = "PIECES_UNITES.TXT";
        public static final int UNIT_SEQUENCE = 1;
        public static final int ROOM_TYPE = 3;
        public static final String BATHROOM = "SDB";
        public static final int MIN_COLUMNS = 4;

        private Rooms() { }
    }

    /** ADDENDA.TXT: id, ..., free text (last column). Decoded per id on demand. */
    public static final class Addenda {
        public static final String ENTRY = "ADDENDA.TXT";

        private Addenda() { }
    }

    /**
     * Trims a raw field and strips surrounding double quotes.
     * Returns an empty string for {@code null}.
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '"') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == '"') {
            end--;
        }
        return trimmed.substring(start, end);
    }

    /**
     * Replaces every {@code <br>}, {@code <br/>} and {@code <br />} tag (any case) with a space.
     */
    public static String replaceLineBreaks(String text) {
        return text == null ? null : LINE_BREAK_TAG.matcher(text).replaceAll(" ");
    }
}
