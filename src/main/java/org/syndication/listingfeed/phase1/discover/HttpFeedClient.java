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
package org.syndication.listingfeed.phase1.discover;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpHead;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.syndication.listingfeed.shared.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * {@link FeedClient} backed by Apache HttpClient 5.
 * Redirects are followed; each request kind has its own response timeout.
 */
public class HttpFeedClient implements FeedClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpFeedClient.class);

    private final CloseableHttpClient httpClient;
    private final String userAgent;
    private final RequestConfig indexConfig;
    private final RequestConfig probeConfig;
    private final RequestConfig downloadConfig;

    public HttpFeedClient(Configuration config) {
        this.userAgent = config.getUserAgent();

        // Configure HTTP client with timeouts
        RequestConfig defaultConfig = RequestConfig.custom()
                .setConnectTimeout(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .setResponseTimeout(config.getDownloadTimeoutMs(), TimeUnit.MILLISECONDS)
                .setRedirectsEnabled(true)
                .build();
        this.indexConfig = RequestConfig.copy(defaultConfig)
                .setResponseTimeout(config.getIndexTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        this.probeConfig = RequestConfig.copy(defaultConfig)
                .setResponseTimeout(config.getProbeTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        this.downloadConfig = defaultConfig;

        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(defaultConfig)
                .build();
    }

    @Override
    public String fetchIndex(String url) throws IOException {
        logger.debug("Fetching index page: {}", url);
        HttpGet request = new HttpGet(url);
        request.setConfig(indexConfig);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            if (statusCode / 100 != 2) {
                throw new IOException("Index request failed: HTTP " + statusCode + " for " + url);
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return "";
            }
            try {
                return EntityUtils.toString(entity, StandardCharsets.UTF_8);
            } catch (org.apache.hc.core5.http.ParseException pe) {
                throw new IOException("Failed to parse index page body", pe);
            }
        }
    }

    @Override
    public boolean exists(String url) throws IOException {
        HttpHead request = new HttpHead(url);
        request.setConfig(probeConfig);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            if (statusCode != 200) {
                logger.debug("Probe returned status code {}: {}", statusCode, url);
                return false;
            }
            Header contentLength = response.getFirstHeader(HttpHeaders.CONTENT_LENGTH);
            logger.debug("Probe found {} ({} bytes)", url,
                contentLength != null ? contentLength.getValue() : "unknown");
            return true;
        }
    }

    @Override
    public long download(String url, OutputStream sink) throws IOException {
        HttpGet request = new HttpGet(url);
        request.setConfig(downloadConfig);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            if (statusCode / 100 != 2) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new IOException("Download failed: HTTP " + statusCode + " for " + url);
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("No content received from: " + url);
            }

            long total = 0;
            try (InputStream inputStream = entity.getContent()) {
                byte[] buffer = new byte[1 << 16];
                int bytesRead;
                while ((bytesRead = inputStream.read(buffer)) != -1) {
                    sink.write(buffer, 0, bytesRead);
                    total += bytesRead;
                }
            }
            return total;
        }
    }

    /**
     * Closes the HTTP client.
     */
    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.error("Error closing HTTP client: {}", e.getMessage());
        }
    }
}
