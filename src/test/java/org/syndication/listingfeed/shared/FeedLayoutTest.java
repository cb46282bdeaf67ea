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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the field helpers of the feed layout.
 */
public class FeedLayoutTest {

    @Test
    public void testCleanTrimsAndStripsQuotes() {
        assertEquals("abc", FeedLayout.clean("  \"abc\"  "));
        assertEquals("a\"b", FeedLayout.clean("\"a\"b\""));
        assertEquals("", FeedLayout.clean("\"\""));
        assertEquals("", FeedLayout.clean(null));
    }

    @Test
    public void testReplaceLineBreaksAnyCase() {
        assertEquals("a b c d", FeedLayout.replaceLineBreaks("a<br>b<BR/>c<br />d"));
        assertNull(FeedLayout.replaceLineBreaks(null));
    }
}
