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

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link FeedClient}: an optional index page and a set of downloadable URLs.
 */
public class FakeFeedClient implements FeedClient {

    private String indexPage;
    private final Map<String, byte[]> files = new HashMap<>();
    private final Set<String> failingDownloads = new HashSet<>();
    private final List<String> requests = new ArrayList<>();
    private boolean closed;

    /**
     * Index page to serve; {@code null} makes the index unreachable.
     */
    public FakeFeedClient withIndex(String html) {
        this.indexPage = html;
        return this;
    }

    public FakeFeedClient withFile(String url, byte[] content) {
        files.put(url, content);
        return this;
    }

    /**
     * The URL exists for probes but every download of it fails.
     */
    public FakeFeedClient withBrokenDownload(String url) {
        files.put(url, new byte[0]);
        failingDownloads.add(url);
        return this;
    }

    @Override
    public String fetchIndex(String url) throws IOException {
        requests.add("GET " + url);
        if (indexPage == null) {
            throw new IOException("Connection refused: " + url);
        }
        return indexPage;
    }

    @Override
    public boolean exists(String url) {
        requests.add("HEAD " + url);
        return files.containsKey(url);
    }

    @Override
    public long download(String url, OutputStream sink) throws IOException {
        requests.add("DOWNLOAD " + url);
        if (failingDownloads.contains(url)) {
            throw new IOException("Read timed out: " + url);
        }
        byte[] content = files.get(url);
        if (content == null) {
            throw new IOException("Download failed: HTTP 404 for " + url);
        }
        sink.write(content);
        return content.length;
    }

    public List<String> getRequests() {
        return requests;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
