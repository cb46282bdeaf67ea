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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Normalized listing derived from one bundle for one listing id.
 *
 * Text fields are never {@code null}; numeric fields are {@code null} when the
 * feed did not yield a usable value. Proximity and characteristic lists are
 * deduplicated in first-seen order, and photo URLs are kept in storage order
 * (sequence number = index + 1).
 */
@JsonPropertyOrder({"id", "price", "address", "total_rooms", "bedrooms", "bathrooms",
        "construction_year", "description", "proximity", "proximity_text",
        "characteristics", "characteristics_text", "photos"})
public class ListingRecord {

    static final String LIST_SEPARATOR = ", ";

    @JsonProperty("id")
    private final String id;
    @JsonProperty("price")
    private Integer price;
    @JsonProperty("address")
    private String address = "";
    @JsonProperty("total_rooms")
    private Integer totalRooms;
    @JsonProperty("bedrooms")
    private Integer bedrooms;
    @JsonProperty("bathrooms")
    private Integer bathrooms;
    @JsonProperty("construction_year")
    private Integer constructionYear;
    @JsonProperty("description")
    private String description = "";
    @JsonProperty("proximity")
    private List<String> proximity = Collections.emptyList();
    @JsonProperty("characteristics")
    private List<Characteristic> characteristics = Collections.emptyList();
    @JsonProperty("photos")
    private List<String> photos = Collections.emptyList();

    public ListingRecord(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    public Integer getPrice() {
        return price;
    }

    public void setPrice(Integer price) {
        this.price = price;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address == null ? "" : address;
    }

    public Integer getTotalRooms() {
        return totalRooms;
    }

    public void setTotalRooms(Integer totalRooms) {
        this.totalRooms = totalRooms;
    }

    public Integer getBedrooms() {
        return bedrooms;
    }

    public void setBedrooms(Integer bedrooms) {
        this.bedrooms = bedrooms;
    }

    public Integer getBathrooms() {
        return bathrooms;
    }

    public void setBathrooms(Integer bathrooms) {
        this.bathrooms = bathrooms;
    }

    public Integer getConstructionYear() {
        return constructionYear;
    }

    public void setConstructionYear(Integer constructionYear) {
        this.constructionYear = constructionYear;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public List<String> getProximity() {
        return proximity;
    }

    /**
     * Stores the proximity items without duplicates, keeping first-seen order.
     */
    public void setProximity(List<String> items) {
        this.proximity = dedupe(items);
    }

    @JsonProperty("proximity_text")
    public String getProximityText() {
        return String.join(LIST_SEPARATOR, proximity);
    }

    public List<Characteristic> getCharacteristics() {
        return characteristics;
    }

    /**
     * Stores the characteristics without duplicates, keeping first-seen order.
     */
    public void setCharacteristics(List<Characteristic> items) {
        this.characteristics = dedupe(items);
    }

    @JsonProperty("characteristics_text")
    public String getCharacteristicsText() {
        return characteristics.stream()
                .map(Characteristic::render)
                .collect(Collectors.joining(LIST_SEPARATOR));
    }

    public List<String> getPhotos() {
        return photos;
    }

    public void setPhotos(List<String> photos) {
        this.photos = photos == null ? Collections.emptyList() : List.copyOf(photos);
    }

    private static <T> List<T> dedupe(List<T> items) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        LinkedHashSet<T> unique = new LinkedHashSet<>();
        for (T item : items) {
            if (item != null) {
                unique.add(item);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(unique));
    }

    @Override
    public String toString() {
        return "ListingRecord{id=" + id + ", price=" + price + ", address=" + address + "}";
    }
}
