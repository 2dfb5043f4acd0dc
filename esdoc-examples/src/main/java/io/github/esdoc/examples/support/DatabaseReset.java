package io.github.esdoc.examples.support;

/*-
 * #%L
 * esdoc
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.esdoc.EventSourcedStore;
import io.github.esdoc.examples.bank.AccountBalance;
import io.github.esdoc.examples.bank.TransactionHistory;
import io.github.esdoc.examples.catalog.Contact;
import io.github.esdoc.examples.catalog.Order;
import io.github.esdoc.examples.catalog.Product;
import io.github.esdoc.examples.catalog.User;
import io.github.esdoc.store.StoreException;
import io.github.esdoc.store.jdbc.DatabaseCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Resetting the example database between demo runs.
 */
public class DatabaseReset {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseReset.class);

    private static final List<Class<?>> DOCUMENT_TYPES = Arrays.asList(User.class, Product.class, Order.class,
        Contact.class, AccountBalance.class, TransactionHistory.class);

    private final DatabaseCleaner cleaner;

    public DatabaseReset(EventSourcedStore store) {
        this.cleaner = store.cleaner();
    }

    /**
     * Delete documents of all example types, including read models. Events are kept, so the read models can be
     * rebuilt.
     * @throws StoreException when the store fails
     */
    public void resetDocuments() throws StoreException {
        int deleted = 0;
        for (Class<?> type : DOCUMENT_TYPES) {
            deleted += cleaner.deleteDocumentsOfType(type);
        }
        logger.info("Deleted {} documents", deleted);
    }

    public void resetEvents() throws StoreException {
        cleaner.deleteAllEventData();
    }

    public void completeReset() throws StoreException {
        resetEvents();
        resetDocuments();
        logger.info("Database reset complete");
    }

    /**
     * Drop all tables and create them again.
     * @throws StoreException when the store fails
     */
    public void recreateSchema() throws StoreException {
        cleaner.completelyRemoveAll();
        cleaner.applyAllConfiguredChanges();
        logger.info("Schema recreated");
    }
}
