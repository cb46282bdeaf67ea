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

import java.time.LocalDate;
import java.util.Objects;

/**
 * A bundle chosen by {@link FeedDiscovery}: its absolute URL, publication date and filename.
 */
public final class ResolvedBundle {

    private final String url;
    private final LocalDate date;
    private final String filename;

    public ResolvedBundle(String url, LocalDate date, String filename) {
        this.url = Objects.requireNonNull(url, "url");
        this.date = date;
        this.filename = Objects.requireNonNull(filename, "filename");
    }

    public String getUrl() {
        return url;
    }

    /**
     * Publication date encoded in the filename; {@code null} for a replayed file whose
     * name does not follow the dated pattern.
     */
    public LocalDate getDate() {
        return date;
    }

    public String getFilename() {
        return filename;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedBundle)) return false;
        ResolvedBundle that = (ResolvedBundle) o;
        return url.equals(that.url) && Objects.equals(date, that.date) && filename.equals(that.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, date, filename);
    }

    @Override
    public String toString() {
        return filename + " (" + url + ")";
    }
}
