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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.syndication.listingfeed.phase5.reconcile.FetchRunResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunHistoryCsvWriterTest {

    @TempDir
    Path tempDir;

    private static FetchRunResult result(String createdAt, int added) {
        FetchRunResult result = new FetchRunResult(Instant.parse(createdAt), LocalDate.of(2025, 3, 12),
                "http://feed.test/NOMADESMARKETING20250312.zip", "NOMADESMARKETING20250312.zip");
        result.setItemsTotal(10);
        result.setItemsAdded(added);
        result.setItemsUpdated(10 - added);
        result.setDurationSeconds(1.5);
        return result;
    }

    @Test
    public void testRunsAccumulate() throws Exception {
        Path csv = tempDir.resolve("history/runs.csv");
        RunHistoryCsvWriter writer = new RunHistoryCsvWriter(csv);

        writer.append(result("2025-03-12T10:00:00Z", 10));
        writer.append(result("2025-03-13T10:00:00Z", 0));

        List<String[]> rows = writer.readRows();
        assertEquals(2, rows.size());
        assertEquals("2025-03-12T10:00:00Z", rows.get(0)[0]);
        assertEquals("10", rows.get(0)[5]);
        assertEquals("0", rows.get(1)[5]);
        assertEquals("1.500", rows.get(1)[8]);
        assertTrue(Files.readAllLines(csv, StandardCharsets.UTF_8).get(0).contains("items_marked_sold"));
    }

    @Test
    public void testForeignLayoutIsRejected() throws Exception {
        Path csv = Files.writeString(tempDir.resolve("other.csv"), "a,b\n1,2\n");

        assertThrows(IOException.class, () -> new RunHistoryCsvWriter(csv).append(result("2025-03-12T10:00:00Z", 1)));
        assertEquals("a,b\n1,2\n", Files.readString(csv));
    }
}
