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

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.syndication.listingfeed.shared.Configuration;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the HTTP client against a local server.
 */
public class HttpFeedClientTest {

    private static final byte[] BUNDLE = "PK-bundle-content".getBytes(StandardCharsets.US_ASCII);

    private HttpServer server;
    private HttpFeedClient client;
    private String baseUrl;
    private final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/centris/", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            String path = exchange.getRequestURI().getPath();
            byte[] body;
            int status;
            if (path.equals("/centris/")) {
                body = "<a href=\"NOMADESMARKETING20250312.zip\">x</a>".getBytes(StandardCharsets.UTF_8);
                status = 200;
            } else if (path.endsWith("NOMADESMARKETING20250312.zip")) {
                body = BUNDLE;
                status = 200;
            } else {
                body = "not found".getBytes(StandardCharsets.UTF_8);
                status = 404;
            }
            if ("HEAD".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(status, -1);
            } else {
                exchange.sendResponseHeaders(status, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            }
            exchange.close();
        });
        server.start();

        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/centris/";
        Configuration config = new Configuration();
        config.setBaseUrl(baseUrl);
        client = new HttpFeedClient(config);
    }

    @AfterEach
    public void tearDown() {
        client.close();
        server.stop(0);
    }

    @Test
    public void testFetchIndexSendsUserAgent() throws Exception {
        String html = client.fetchIndex(baseUrl);

        assertTrue(html.contains("NOMADESMARKETING20250312.zip"));
        assertEquals("ListingFeedImporter/1.0", userAgent.get());
    }

    @Test
    public void testExistsOnlyFor200() throws Exception {
        assertTrue(client.exists(baseUrl + "NOMADESMARKETING20250312.zip"));
        assertFalse(client.exists(baseUrl + "NOMADESMARKETING20250311.zip"));
    }

    @Test
    public void testDownloadStreamsBody() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();

        long size = client.download(baseUrl + "NOMADESMARKETING20250312.zip", sink);

        assertEquals(BUNDLE.length, size);
        assertArrayEquals(BUNDLE, sink.toByteArray());
    }

    @Test
    public void testDownloadOfMissingFileFails() {
        IOException e = assertThrows(IOException.class,
                () -> client.download(baseUrl + "missing.zip", new ByteArrayOutputStream()));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    public void testDiscoveryOverHttp() throws Exception {
        Configuration config = new Configuration();
        config.setBaseUrl(baseUrl);

        ResolvedBundle bundle = new FeedDiscovery(client, config).resolve(LocalDate.of(2025, 3, 12));

        assertEquals(baseUrl + "NOMADESMARKETING20250312.zip", bundle.getUrl());
    }
}
