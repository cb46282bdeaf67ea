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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One labelled characteristic of a listing, e.g. "Fondation: Béton".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Characteristic {

    private final String category;
    private final String value;
    private final String detail;

    @JsonCreator
    public Characteristic(@JsonProperty("category") String category,
                          @JsonProperty("value") String value,
                          @JsonProperty("detail") String detail) {
        this.category = category;
        this.value = value;
        this.detail = detail == null || detail.isEmpty() ? null : detail;
    }

    public String getCategory() {
        return category;
    }

    public String getValue() {
        return value;
    }

    /**
     * Optional free-form qualifier shown in parentheses; {@code null} when absent.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Renders {@code "category: value"} or {@code "category: value (detail)"}.
     */
    public String render() {
        String text = category + ": " + value;
        return detail != null ? text + " (" + detail + ")" : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Characteristic)) return false;
        Characteristic that = (Characteristic) o;
        return Objects.equals(category, that.category)
                && Objects.equals(value, that.value)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, value, detail);
    }

    @Override
    public String toString() {
        return render();
    }
}
