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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.syndication.listingfeed.shared.Characteristic;
import org.syndication.listingfeed.shared.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CatalogStore} over plain JDBC. The schema is created on open when missing.
 *
 * Timestamps are stored as ISO-8601 text and list fields as JSON text, which keeps the
 * DDL portable; the default URL points at an embedded SQLite file.
 */
public class JdbcCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() { };
    private static final TypeReference<List<Characteristic>> CHARACTERISTIC_LIST =
            new TypeReference<List<Characteristic>>() { };

    private static final String LISTING_COLUMNS = "id, slug, price, address, total_rooms, bedrooms, bathrooms, "
            + "construction_year, description, proximity_text, proximity, characteristics_text, characteristics, "
            + "status, sold_at, first_seen_at, last_seen_at, updated_at";

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final ObjectMapper mapper = new ObjectMapper();

    public JdbcCatalogStore(String jdbcUrl) throws SQLException {
        this(jdbcUrl, null, null);
    }

    public JdbcCatalogStore(String jdbcUrl, String user, String password) throws SQLException {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        ensureSchema();
    }

    Connection connect() throws SQLException {
        if (user == null) {
            return DriverManager.getConnection(jdbcUrl);
        }
        return DriverManager.getConnection(jdbcUrl, user, password);
    }

    private void ensureSchema() throws SQLException {
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS listing (" +
                    "id TEXT PRIMARY KEY," +
                    "slug TEXT NOT NULL UNIQUE," +
                    "price INTEGER," +
                    "address TEXT NOT NULL," +
                    "total_rooms INTEGER," +
                    "bedrooms INTEGER," +
                    "bathrooms INTEGER," +
                    "construction_year INTEGER," +
                    "description TEXT NOT NULL," +
                    "proximity_text TEXT NOT NULL," +
                    "proximity TEXT NOT NULL," +
                    "characteristics_text TEXT NOT NULL," +
                    "characteristics TEXT NOT NULL," +
                    "status TEXT NOT NULL," +
                    "sold_at TEXT," +
                    "first_seen_at TEXT NOT NULL," +
                    "last_seen_at TEXT," +
                    "updated_at TEXT NOT NULL" +
                    ")");
            st.execute("CREATE INDEX IF NOT EXISTS idx_listing_status ON listing(status)");
            st.execute("CREATE TABLE IF NOT EXISTS listing_photo (" +
                    "listing_id TEXT NOT NULL REFERENCES listing(id)," +
                    "sequence INTEGER NOT NULL," +
                    "url TEXT NOT NULL," +
                    "PRIMARY KEY (listing_id, sequence)" +
                    ")");
            st.execute("CREATE TABLE IF NOT EXISTS fetch_log (" +
                    "created_at TEXT NOT NULL," +
                    "file_date TEXT," +
                    "source_url TEXT," +
                    "source_name TEXT," +
                    "items_total INTEGER NOT NULL," +
                    "items_added INTEGER NOT NULL," +
                    "items_updated INTEGER NOT NULL," +
                    "items_marked_sold INTEGER NOT NULL," +
                    "duration_seconds REAL NOT NULL" +
                    ")");
        }
        logger.debug("Catalog schema ready at {}", jdbcUrl);
    }

    @Override
    public CatalogTransaction begin() throws SQLException {
        Connection conn = connect();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return new JdbcTransaction(conn);
    }

    @Override
    public Optional<CatalogEntry> findEntry(String id) throws SQLException {
        try (Connection conn = connect()) {
            Optional<CatalogEntry> entry = loadEntry(conn, id);
            if (entry.isPresent()) {
                entry.get().getRecord().setPhotos(loadPhotos(conn, id));
            }
            return entry;
        }
    }

    @Override
    public List<String> findPhotos(String id) throws SQLException {
        try (Connection conn = connect()) {
            return loadPhotos(conn, id);
        }
    }

    @Override
    public List<FetchRunResult> listRunResults() throws SQLException {
        String sql = "SELECT created_at, file_date, source_url, source_name, items_total, items_added, "
                + "items_updated, items_marked_sold, duration_seconds FROM fetch_log ORDER BY created_at ASC";
        List<FetchRunResult> out = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String fileDate = rs.getString("file_date");
                FetchRunResult result = new FetchRunResult(Instant.parse(rs.getString("created_at")),
                        fileDate != null ? LocalDate.parse(fileDate) : null,
                        rs.getString("source_url"), rs.getString("source_name"));
                result.setItemsTotal(rs.getInt("items_total"));
                result.setItemsAdded(rs.getInt("items_added"));
                result.setItemsUpdated(rs.getInt("items_updated"));
                result.setItemsMarkedSold(rs.getInt("items_marked_sold"));
                result.setDurationSeconds(rs.getDouble("duration_seconds"));
                out.add(result);
            }
        }
        return out;
    }

    /**
     * Connections are opened per call, so there is nothing to release.
     */
    @Override
    public void close() {
        logger.debug("Catalog store {} closed", jdbcUrl);
    }

    private Optional<CatalogEntry> loadEntry(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + LISTING_COLUMNS + " FROM listing WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ListingRecord record = new ListingRecord(rs.getString("id"));
                record.setPrice(getNullableInt(rs, "price"));
                record.setAddress(rs.getString("address"));
                record.setTotalRooms(getNullableInt(rs, "total_rooms"));
                record.setBedrooms(getNullableInt(rs, "bedrooms"));
                record.setBathrooms(getNullableInt(rs, "bathrooms"));
                record.setConstructionYear(getNullableInt(rs, "construction_year"));
                record.setDescription(rs.getString("description"));
                record.setProximity(fromJson(rs.getString("proximity"), STRING_LIST));
                record.setCharacteristics(fromJson(rs.getString("characteristics"), CHARACTERISTIC_LIST));

                CatalogEntry entry = new CatalogEntry(record);
                entry.setSlug(rs.getString("slug"));
                entry.setStatus(ListingStatus.valueOf(rs.getString("status")));
                entry.setSoldAt(getInstant(rs, "sold_at"));
                entry.setFirstSeenAt(getInstant(rs, "first_seen_at"));
                entry.setLastSeenAt(getInstant(rs, "last_seen_at"));
                entry.setUpdatedAt(getInstant(rs, "updated_at"));
                return Optional.of(entry);
            }
        }
    }

    private static List<String> loadPhotos(Connection conn, String id) throws SQLException {
        List<String> urls = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT url FROM listing_photo WHERE listing_id=? ORDER BY sequence ASC")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    urls.add(rs.getString("url"));
                }
            }
        }
        return urls;
    }

    private String toJson(Object value) throws SQLException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize catalog column: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON in catalog column: " + e.getOriginalMessage(), e);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? Instant.parse(value) : null;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    /**
     * One connection with auto-commit off; rolled back on close unless committed.
     */
    private final class JdbcTransaction implements CatalogTransaction {

        private final Connection conn;
        private boolean committed;

        private JdbcTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public UpsertResult upsert(ListingRecord record, Instant now) throws SQLException {
            Optional<CatalogEntry> existing = loadEntry(conn, record.getId());
            CatalogEntry entry = existing.orElseGet(() -> new CatalogEntry(record));
            entry.setRecord(record);
            entry.setStatus(ListingStatus.ACTIVE);
            entry.setSoldAt(null);
            entry.setLastSeenAt(now);
            entry.setUpdatedAt(now);

            if (existing.isPresent()) {
                String sql = "UPDATE listing SET price=?, address=?, total_rooms=?, bedrooms=?, bathrooms=?, "
                        + "construction_year=?, description=?, proximity_text=?, proximity=?, "
                        + "characteristics_text=?, characteristics=?, status=?, sold_at=NULL, "
                        + "last_seen_at=?, updated_at=? WHERE id=?";
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    int next = bindRecordFields(ps, 1, record);
                    ps.setString(next++, ListingStatus.ACTIVE.name());
                    ps.setString(next++, toText(now));
                    ps.setString(next++, toText(now));
                    ps.setString(next, record.getId());
                    ps.executeUpdate();
                }
                return new UpsertResult(entry, false);
            }

            entry.setSlug(ListingSlugs.forListing(record.getId()));
            entry.setFirstSeenAt(now);
            String sql = "INSERT INTO listing(" + LISTING_COLUMNS + ") "
                    + "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NULL, ?, ?, ?)";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, record.getId());
                ps.setString(2, entry.getSlug());
                int next = bindRecordFields(ps, 3, record);
                ps.setString(next++, ListingStatus.ACTIVE.name());
                ps.setString(next++, toText(now));
                ps.setString(next++, toText(now));
                ps.setString(next, toText(now));
                ps.executeUpdate();
            }
            return new UpsertResult(entry, true);
        }

        private int bindRecordFields(PreparedStatement ps, int start, ListingRecord record) throws SQLException {
            int i = start;
            setNullableInt(ps, i++, record.getPrice());
            ps.setString(i++, record.getAddress());
            setNullableInt(ps, i++, record.getTotalRooms());
            setNullableInt(ps, i++, record.getBedrooms());
            setNullableInt(ps, i++, record.getBathrooms());
            setNullableInt(ps, i++, record.getConstructionYear());
            ps.setString(i++, record.getDescription());
            ps.setString(i++, record.getProximityText());
            ps.setString(i++, toJson(record.getProximity()));
            ps.setString(i++, record.getCharacteristicsText());
            ps.setString(i++, toJson(record.getCharacteristics()));
            return i;
        }

        @Override
        public int markSoldExcept(Set<String> seenIds, Instant now) throws SQLException {
            List<String> absent = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM listing WHERE status=?")) {
                ps.setString(1, ListingStatus.ACTIVE.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String id = rs.getString("id");
                        if (!seenIds.contains(id)) {
                            absent.add(id);
                        }
                    }
                }
            }
            if (absent.isEmpty()) {
                return 0;
            }

            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE listing SET status=?, sold_at=?, updated_at=? WHERE id=?")) {
                for (String id : absent) {
                    ps.setString(1, ListingStatus.SOLD.name());
                    ps.setString(2, toText(now));
                    ps.setString(3, toText(now));
                    ps.setString(4, id);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            logger.info("Marked {} absent listings as sold", absent.size());
            return absent.size();
        }

        @Override
        public void replacePhotos(String id, List<String> urls) throws SQLException {
            try (PreparedStatement delete = conn.prepareStatement("DELETE FROM listing_photo WHERE listing_id=?");
                 PreparedStatement insert = conn.prepareStatement(
                         "INSERT INTO listing_photo(listing_id, sequence, url) VALUES(?, ?, ?)")) {
                delete.setString(1, id);
                delete.executeUpdate();

                int sequence = 1;
                for (String url : urls) {
                    insert.setString(1, id);
                    insert.setInt(2, sequence++);
                    insert.setString(3, url);
                    insert.addBatch();
                }
                insert.executeBatch();
            }
        }

        @Override
        public void appendRunResult(FetchRunResult result) throws SQLException {
            String sql = "INSERT INTO fetch_log(created_at, file_date, source_url, source_name, items_total, "
                    + "items_added, items_updated, items_marked_sold, duration_seconds) "
                    + "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, toText(result.getCreatedAt()));
                ps.setString(2, result.getBundleDate() != null ? result.getBundleDate().toString() : null);
                ps.setString(3, result.getSourceUrl());
                ps.setString(4, result.getSourceName());
                ps.setInt(5, result.getItemsTotal());
                ps.setInt(6, result.getItemsAdded());
                ps.setInt(7, result.getItemsUpdated());
                ps.setInt(8, result.getItemsMarkedSold());
                ps.setDouble(9, result.getDurationSeconds());
                ps.executeUpdate();
            }
        }

        @Override
        public void commit() throws SQLException {
            conn.commit();
            committed = true;
        }

        @Override
        public void close() throws SQLException {
            try {
                if (!committed) {
                    conn.rollback();
                    logger.warn("Catalog transaction rolled back");
                }
            } finally {
                conn.close();
            }
        }
    }
}
