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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.ZoneId;

/**
 * Configuration management for the listing feed importer.
 * Values come from {@code config.json}; command line options override single fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Configuration {

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public static final String DEFAULT_CONFIG_FILE = "config.json";

    // Default values
    private static final String DEFAULT_BASE_URL = "https://lpsep9.n0c.world/centris/";
    private static final String DEFAULT_BUNDLE_PREFIX = "NOMADESMARKETING";
    private static final String DEFAULT_BUNDLE_EXTENSION = "zip";
    private static final String DEFAULT_FEED_TIME_ZONE = "America/Toronto";
    private static final int DEFAULT_MAX_ATTEMPTS = 12;
    private static final int DEFAULT_RETRY_SECONDS = 300;
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_INDEX_TIMEOUT_MS = 20000;
    private static final int DEFAULT_PROBE_TIMEOUT_MS = 15000;
    private static final int DEFAULT_DOWNLOAD_TIMEOUT_MS = 60000;
    private static final String DEFAULT_USER_AGENT = "ListingFeedImporter/1.0";
    private static final String DEFAULT_CATALOG_JDBC_URL = "jdbc:sqlite:listing-catalog.db";
    private static final boolean DEFAULT_MARK_SOLD = true;

    private String baseUrl;
    private String bundlePrefix;
    private String bundleExtension;
    private String feedTimeZone;        // Zone used to decide what "today" is for the feed
    private int maxAttempts;
    private int retrySeconds;           // Fixed pause between fetch attempts
    private int connectTimeoutMs;
    private int indexTimeoutMs;
    private int probeTimeoutMs;
    private int downloadTimeoutMs;
    private String userAgent;
    private String saveBundleDir;       // Optional: keep the raw bundle for audit/replay
    private boolean markSold;
    private String catalogJdbcUrl;
    private String catalogUser;
    private String catalogPassword;
    private String exportDir;           // Optional: JSON snapshot of the extracted listings
    private String historyCsvPath;      // Optional: cumulative CSV of committed runs

    // Default constructor for Jackson
    public Configuration() {
        this.baseUrl = DEFAULT_BASE_URL;
        this.bundlePrefix = DEFAULT_BUNDLE_PREFIX;
        this.bundleExtension = DEFAULT_BUNDLE_EXTENSION;
        this.feedTimeZone = DEFAULT_FEED_TIME_ZONE;
        this.maxAttempts = DEFAULT_MAX_ATTEMPTS;
        this.retrySeconds = DEFAULT_RETRY_SECONDS;
        this.connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        this.indexTimeoutMs = DEFAULT_INDEX_TIMEOUT_MS;
        this.probeTimeoutMs = DEFAULT_PROBE_TIMEOUT_MS;
        this.downloadTimeoutMs = DEFAULT_DOWNLOAD_TIMEOUT_MS;
        this.userAgent = DEFAULT_USER_AGENT;
        this.markSold = DEFAULT_MARK_SOLD;
        this.catalogJdbcUrl = DEFAULT_CATALOG_JDBC_URL;
    }

    /**
     * Loads configuration from config.json in the working directory or creates default configuration.
     */
    public static Configuration load() throws IOException {
        return load(new File(DEFAULT_CONFIG_FILE));
    }

    /**
     * Loads configuration from the given file. A missing file is created with the defaults
     * so the operator has something to edit; an unreadable file falls back to the defaults.
     */
    public static Configuration load(File configFile) throws IOException {
        if (configFile.exists() && configFile.length() > 0) {
            logger.info("Loading configuration from {}", configFile);
            try {
                return newMapper().readValue(configFile, Configuration.class);
            } catch (IOException e) {
                logger.warn("Error reading {}, using defaults: {}", configFile, e.getMessage());
            }
        }

        logger.info("No valid {} found, using default configuration", configFile);
        Configuration config = new Configuration();

        // Save default configuration for user to edit
        if (!configFile.exists()) {
            config.save(configFile.getPath());
        }

        return config;
    }

    /**
     * Saves configuration to the specified file path.
     */
    public void save(String filePath) throws IOException {
        File configFile = new File(filePath);
        newMapper().writerWithDefaultPrettyPrinter()
              .writeValue(configFile, this);
        logger.info("Configuration saved to {}", filePath);
    }

    private static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    // Getters and setters
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getBundlePrefix() {
        return bundlePrefix;
    }

    public void setBundlePrefix(String bundlePrefix) {
        this.bundlePrefix = bundlePrefix;
    }

    public String getBundleExtension() {
        return bundleExtension;
    }

    public void setBundleExtension(String bundleExtension) {
        this.bundleExtension = bundleExtension;
    }

    public String getFeedTimeZone() {
        return feedTimeZone;
    }

    public void setFeedTimeZone(String feedTimeZone) {
        this.feedTimeZone = feedTimeZone;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getRetrySeconds() {
        return retrySeconds;
    }

    public void setRetrySeconds(int retrySeconds) {
        this.retrySeconds = retrySeconds;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getIndexTimeoutMs() {
        return indexTimeoutMs;
    }

    public void setIndexTimeoutMs(int indexTimeoutMs) {
        this.indexTimeoutMs = indexTimeoutMs;
    }

    public int getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(int probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public int getDownloadTimeoutMs() {
        return downloadTimeoutMs;
    }

    public void setDownloadTimeoutMs(int downloadTimeoutMs) {
        this.downloadTimeoutMs = downloadTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getSaveBundleDir() {
        return saveBundleDir;
    }

    public void setSaveBundleDir(String saveBundleDir) {
        this.saveBundleDir = saveBundleDir;
    }

    public boolean isMarkSold() {
        return markSold;
    }

    public void setMarkSold(boolean markSold) {
        this.markSold = markSold;
    }

    public String getCatalogJdbcUrl() {
        return catalogJdbcUrl;
    }

    public void setCatalogJdbcUrl(String catalogJdbcUrl) {
        this.catalogJdbcUrl = catalogJdbcUrl;
    }

    public String getCatalogUser() {
        return catalogUser;
    }

    public void setCatalogUser(String catalogUser) {
        this.catalogUser = catalogUser;
    }

    public String getCatalogPassword() {
        return catalogPassword;
    }

    public void setCatalogPassword(String catalogPassword) {
        this.catalogPassword = catalogPassword;
    }

    public String getExportDir() {
        return exportDir;
    }

    public void setExportDir(String exportDir) {
        this.exportDir = exportDir;
    }

    public String getHistoryCsvPath() {
        return historyCsvPath;
    }

    public void setHistoryCsvPath(String historyCsvPath) {
        this.historyCsvPath = historyCsvPath;
    }

    /**
     * Attempt ceiling, never below one.
     */
    @JsonIgnore
    public int getEffectiveMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    /**
     * Pause between attempts, never negative.
     */
    @JsonIgnore
    public int getEffectiveRetrySeconds() {
        return Math.max(0, retrySeconds);
    }

    @JsonIgnore
    public ZoneId getFeedZoneId() {
        return ZoneId.of(feedTimeZone);
    }

    @JsonIgnore
    public boolean hasSaveBundleDir() {
        return saveBundleDir != null && !saveBundleDir.isBlank();
    }

    @JsonIgnore
    public boolean hasExportDir() {
        return exportDir != null && !exportDir.isBlank();
    }

    @JsonIgnore
    public boolean hasHistoryCsvPath() {
        return historyCsvPath != null && !historyCsvPath.isBlank();
    }
}
