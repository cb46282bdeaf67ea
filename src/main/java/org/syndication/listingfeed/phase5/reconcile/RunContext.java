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
package org.syndication.listingfeed.phase5.reconcile;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Facts about the run that are not in the bundle itself.
 */
public class RunContext {

    private final Instant runTimestamp;
    private final LocalDate bundleDate;
    private final String sourceUrl;
    private final String sourceName;
    private final long startNanos;
    private final boolean markSold;

    public RunContext(Instant runTimestamp, LocalDate bundleDate, String sourceUrl, String sourceName,
                      long startNanos, boolean markSold) {
        this.runTimestamp = runTimestamp;
        this.bundleDate = bundleDate;
        this.sourceUrl = sourceUrl;
        this.sourceName = sourceName;
        this.startNanos = startNanos;
        this.markSold = markSold;
    }

    /** Timestamp written as last-seen, sold and run creation time. */
    public Instant getRunTimestamp() {
        return runTimestamp;
    }

    public LocalDate getBundleDate() {
        return bundleDate;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** {@link System#nanoTime()} at the start of the run, for the elapsed duration. */
    public long getStartNanos() {
        return startNanos;
    }

    public boolean isMarkSold() {
        return markSold;
    }
}
