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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.syndication.listingfeed.shared.Characteristic;
import org.syndication.listingfeed.shared.ListingRecord;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListingJsonExporterTest {

    @TempDir
    Path tempDir;

    @Test
    public void testExportWritesBundleNamedFileAndLatestCopy() throws Exception {
        ListingRecord record = new ListingRecord("1001");
        record.setPrice(250000);
        record.setProximity(List.of("Autoroute"));
        record.setCharacteristics(List.of(new Characteristic("Fondation", "Béton", null)));
        record.setPhotos(List.of("http://img.test/a.jpg"));

        Path exported = new ListingJsonExporter(tempDir.resolve("out"))
                .export("NOMADESMARKETING20250312.zip", List.of(record));

        assertEquals("NOMADESMARKETING20250312.json", exported.getFileName().toString());
        Path latest = tempDir.resolve("out").resolve(ListingJsonExporter.LATEST_FILENAME);
        assertEquals(Files.readString(exported), Files.readString(latest));

        JsonNode root = new ObjectMapper().readTree(exported.toFile());
        assertEquals(1, root.size());
        JsonNode first = root.get(0);
        assertEquals("1001", first.get("id").asText());
        assertEquals(250000, first.get("price").asInt());
        assertTrue(first.get("bedrooms").isNull());
        assertEquals("Autoroute", first.get("proximity_text").asText());
        assertEquals("Béton", first.get("characteristics").get(0).get("value").asText());
        assertFalse(first.get("characteristics").get(0).has("detail"));
        assertEquals("http://img.test/a.jpg", first.get("photos").get(0).asText());
    }

    @Test
    public void testExportFilename() {
        assertEquals("bundle.json", ListingJsonExporter.exportFilename("bundle.zip"));
        assertEquals("bundle.json", ListingJsonExporter.exportFilename("bundle"));
    }
}
