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

import org.syndication.listingfeed.phase3.decode.DecodedBundle;
import org.syndication.listingfeed.phase3.decode.FeedTable;
import org.syndication.listingfeed.phase4.extract.RecordExtractor;
import org.syndication.listingfeed.shared.FeedLayout;
import org.syndication.listingfeed.shared.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Writes a decoded bundle through to the catalog.
 *
 * Every listing of the primary table is extracted and upserted, photos are replaced when
 * the bundle carries any, listings absent from the bundle are retired, and the run result
 * is appended. All of it commits together or not at all.
 */
public class ReconciliationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final CatalogStore store;
    private final RecordExtractor extractor;

    public ReconciliationEngine(CatalogStore store, RecordExtractor extractor) {
        this.store = store;
        this.extractor = extractor;
    }

    public FetchRunResult reconcile(DecodedBundle bundle, RunContext context) throws ReconciliationException {
        return reconcile(bundle, context, record -> { });
    }

    /**
     * Reconciles the bundle and hands every extracted record to {@code extracted} as it goes.
     * Records already handed out stay valid even if the run is rolled back.
     */
    public FetchRunResult reconcile(DecodedBundle bundle, RunContext context,
                                    Consumer<ListingRecord> extracted) throws ReconciliationException {
        FetchRunResult result = new FetchRunResult(context.getRunTimestamp(), context.getBundleDate(),
                context.getSourceUrl(), context.getSourceName());
        Set<String> seen = new HashSet<>();

        try (CatalogTransaction tx = store.begin()) {
            for (List<String> row : bundle.rows(FeedTable.LISTINGS)) {
                if (row.isEmpty()) {
                    continue;
                }
                String id = FeedLayout.clean(row.get(FeedLayout.ID));
                if (id.isEmpty()) {
                    continue;
                }
                result.setItemsTotal(result.getItemsTotal() + 1);
                seen.add(id);

                ListingRecord record = extractor.extract(row, bundle);
                extracted.accept(record);

                UpsertResult upsert = tx.upsert(record, context.getRunTimestamp());
                if (upsert.isCreated()) {
                    result.setItemsAdded(result.getItemsAdded() + 1);
                } else {
                    result.setItemsUpdated(result.getItemsUpdated() + 1);
                }

                // An empty photo set leaves the stored gallery alone
                if (!record.getPhotos().isEmpty()) {
                    tx.replacePhotos(id, record.getPhotos());
                }
            }

            if (context.isMarkSold()) {
                result.setItemsMarkedSold(tx.markSoldExcept(seen, context.getRunTimestamp()));
            } else {
                logger.info("Retirement disabled, absent listings stay active");
            }

            result.setDurationSeconds((System.nanoTime() - context.getStartNanos()) / 1_000_000_000.0);
            tx.appendRunResult(result);
            tx.commit();
        } catch (SQLException | RuntimeException e) {
            logger.error("Reconciliation of {} failed after {} listings, rolled back: {}",
                    context.getSourceName(), result.getItemsTotal(), e.getMessage());
            throw new ReconciliationException("Catalog update failed for " + context.getSourceName()
                    + ", no changes were kept", e);
        }

        logger.info("Reconciled {}: {}", context.getSourceName(), result.summary());
        return result;
    }
}
