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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ListingSlugsTest {

    @Test
    public void testListingSlug() {
        assertEquals("listing-28475960", ListingSlugs.forListing("28475960"));
    }

    @Test
    public void testSlugifyFoldsAccentsAndPunctuation() {
        assertEquals("listing-ab-12-e", ListingSlugs.slugify("Listing AB/12 é"));
        assertEquals("x", ListingSlugs.slugify("--x--"));
    }

    @Test
    public void testSlugIsTruncated() {
        String slug = ListingSlugs.forListing("9".repeat(100));

        assertEquals(ListingSlugs.MAX_LENGTH, slug.length());
        assertTrue(slug.startsWith("listing-999"));
        assertTrue(slug.endsWith("-" + ListingSlugs.checksum("9".repeat(100))));
    }

    @Test
    public void testFoldedIdsGetDistinctSlugs() {
        String upper = ListingSlugs.forListing("AB-1");
        String slash = ListingSlugs.forListing("ab/1");

        assertNotEquals(upper, slash);
        assertNotEquals("listing-ab-1", upper);
        assertTrue(upper.startsWith("listing-ab-1-"));
        assertTrue(slash.startsWith("listing-ab-1-"));
        assertEquals("listing-ab-1", ListingSlugs.forListing("ab-1"));
        assertEquals(upper, ListingSlugs.forListing("AB-1"));
    }

    @Test
    public void testLongIdsSharingAPrefixGetDistinctSlugs() {
        String prefix = "1".repeat(70);

        assertNotEquals(ListingSlugs.forListing(prefix + "1"), ListingSlugs.forListing(prefix + "2"));
    }
}
