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

import org.syndication.listingfeed.shared.ListingFeedException;

/**
 * Every download attempt failed. Carries the attempt count; the cause is the last failure.
 */
public class FetchException extends ListingFeedException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public FetchException(int attempts, Throwable lastCause) {
        super("Bundle download failed after " + attempts + " attempt(s)"
                + (lastCause != null ? ": " + lastCause.getMessage() : ""), lastCause);
        this.attempts = attempts;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.attempts = 0;
    }

    public int getAttempts() {
        return attempts;
    }
}
