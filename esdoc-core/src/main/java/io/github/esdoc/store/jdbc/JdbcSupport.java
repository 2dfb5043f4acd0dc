package io.github.esdoc.store.jdbc;

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

import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Common connection and transaction handling of the JDBC stores.
 */
abstract class JdbcSupport {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSupport.class);

    protected final DataSource dataSource;
    protected final JdbcSchema schema;
    protected final TxHandler txHandler;

    JdbcSupport(DataSource dataSource, JdbcSchema schema, TxHandler txHandler) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.txHandler = Objects.requireNonNull(txHandler, "TxHandler cannot be null");
    }

    @FunctionalInterface
    interface Work<R> {
        R execute(Connection connection) throws SQLException, StoreException;
    }

    /**
     * Execute work in a transaction, commit it when it completes, roll it back when it throws.
     * @param key stream or document key for reporting failures
     * @param work the work
     * @param <R> type of result
     * @return result of the work
     * @throws StoreException when the work throws it, or with {@link StoreException.Fault#STORAGE_UNAVAILABLE}
     *                        if database fails
     */
    protected <R> R inTransaction(String key, Work<R> work) throws StoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                R result = work.execute(connection);
                txHandler.commit(connection);
                return result;
            } catch (SQLException | StoreException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate(key, e);
        }
    }

    /**
     * Execute read-only work on a connection outside of explicit transaction.
     */
    protected <R> R withConnection(String key, Work<R> work) throws StoreException {
        try (Connection connection = dataSource.getConnection()) {
            return work.execute(connection);
        } catch (SQLException e) {
            throw translate(key, e);
        }
    }

    protected StoreException translate(String key, SQLException e) {
        return StoreException.storeFailed(key, e);
    }

    protected void rollback(Connection connection, Exception cause) {
        try {
            txHandler.rollback(connection);
        } catch (SQLException e) {
            logger.warn("Rollback failed", e);
            cause.addSuppressed(e);
        }
    }

    static void cleanup(AutoCloseable resource) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Suppressing cleanup exception", e);
            }
        }
    }
}
