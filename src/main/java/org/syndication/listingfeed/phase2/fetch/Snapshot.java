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
package org.syndication.listingfeed.phase2.fetch;

import org.syndication.listingfeed.phase1.discover.ResolvedBundle;

import java.util.Objects;

/**
 * Raw bytes of one bundle together with where they came from.
 */
public class Snapshot {

    private final ResolvedBundle bundle;
    private final byte[] bytes;
    private final int attempts;

    public Snapshot(ResolvedBundle bundle, byte[] bytes, int attempts) {
        this.bundle = Objects.requireNonNull(bundle, "bundle");
        this.bytes = Objects.requireNonNull(bytes, "bytes");
        this.attempts = attempts;
    }

    public ResolvedBundle getBundle() {
        return bundle;
    }

    public byte[] getBytes() {
        return bytes;
    }

    /**
     * Attempt that succeeded, starting at 1; 0 for a bundle replayed from disk.
     */
    public int getAttempts() {
        return attempts;
    }

    public int size() {
        return bytes.length;
    }
}
