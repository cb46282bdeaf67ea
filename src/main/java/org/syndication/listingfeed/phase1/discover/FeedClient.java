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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Network operations needed to discover and download a bundle.
 */
public interface FeedClient extends Closeable {

    /**
     * Retrieves the directory-style index page as text.
     *
     * @throws IOException if the page is unreachable or answers with a non-2xx status
     */
    String fetchIndex(String url) throws IOException;

    /**
     * Lightweight existence check (HTTP HEAD); {@code true} only for status 200.
     */
    boolean exists(String url) throws IOException;

    /**
     * Streams the body of {@code url} into {@code sink} and returns the number of bytes copied.
     *
     * @throws IOException if the request fails or answers with a non-2xx status
     */
    long download(String url, OutputStream sink) throws IOException;

    @Override
    void close();
}
