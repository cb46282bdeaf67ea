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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.syndication.listingfeed.shared.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the records extracted from a bundle as a JSON array, plus a
 * {@value #LATEST_FILENAME} copy that always holds the most recent export.
 */
public class ListingJsonExporter {

    private static final Logger logger = LoggerFactory.getLogger(ListingJsonExporter.class);

    public static final String LATEST_FILENAME = "listings-latest.json";

    private final Path outputDir;
    private final ObjectMapper mapper;

    public ListingJsonExporter(Path outputDir) {
        this.outputDir = outputDir;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Exports the records under the bundle's name with a {@code .json} extension.
     *
     * @return path of the bundle-named export
     */
    public Path export(String bundleName, List<ListingRecord> records) throws IOException {
        Files.createDirectories(outputDir);

        Path target = outputDir.resolve(exportFilename(bundleName));
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), records);

        Path latest = outputDir.resolve(LATEST_FILENAME);
        Files.copy(target, latest, StandardCopyOption.REPLACE_EXISTING);

        logger.info("Exported {} listings to {} (and {})", records.size(), target, LATEST_FILENAME);
        return target;
    }

    static String exportFilename(String bundleName) {
        int dot = bundleName.lastIndexOf('.');
        String base = dot > 0 ? bundleName.substring(0, dot) : bundleName;
        return base + ".json";
    }
}
