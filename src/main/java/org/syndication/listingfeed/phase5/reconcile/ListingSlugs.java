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
package org.syndication.listingfeed.phase5.reconcile;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Deterministic URL slugs for catalog entries.
 */
public final class ListingSlugs {

    static final int MAX_LENGTH = 64;

    private ListingSlugs() { }

    /**
     * Slug of a listing id, e.g. {@code listing-28475960}.
     * When folding changes the id ({@code AB-1}, {@code ab/1}) a checksum of the raw id is appended,
     * so distinct ids never share a slug.
     */
    public static String forListing(String id) {
        String plain = "listing-" + id;
        String slug = slugify(plain);
        if (slug.equals(plain)) {
            return slug;
        }
        String suffix = "-" + checksum(id);
        String base = slug.length() > MAX_LENGTH - suffix.length()
                ? slug.substring(0, MAX_LENGTH - suffix.length())
                : slug;
        return base.replaceAll("[-_]+$", "") + suffix;
    }

    static String checksum(String id) {
        CRC32 crc = new CRC32();
        crc.update(id.getBytes(StandardCharsets.UTF_8));
        return String.format(Locale.ROOT, "%08x", crc.getValue());
    }

    /**
     * Accents folded to ASCII, lower case, runs of other characters collapsed to one hyphen,
     * no leading or trailing hyphen, at most {@value #MAX_LENGTH} characters.
     */
    static String slugify(String text) {
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]+", "-")
                .replaceAll("^[-_]+|[-_]+$", "");
        return slug.length() > MAX_LENGTH ? slug.substring(0, MAX_LENGTH) : slug;
    }
}
