package io.github.esdoc;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.esdoc.document.DocumentMapping;
import io.github.esdoc.document.DocumentMappings;
import io.github.esdoc.event.EventTypes;
import io.github.esdoc.projection.Projection;
import io.github.esdoc.store.AutoCreate;
import io.github.esdoc.store.jackson.ObjectMappers;
import io.github.esdoc.store.jdbc.DefaultJdbcSchema;
import io.github.esdoc.store.jdbc.JdbcSchema;
import io.github.esdoc.store.jdbc.TxHandler;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration of an {@link EventSourcedStore}.
 * <pre>
 * StoreOptions options = StoreOptions.builder(dataSource)
 *         .autoCreate(AutoCreate.CREATE_OR_UPDATE)
 *         .event(AccountOpened.class)
 *         .document(DocumentMapping.builder(AccountBalance.class, AccountBalance::getAccountId).build())
 *         .projection(balanceProjection)
 *         .build();
 * </pre>
 */
public final class StoreOptions {
    private final DataSource dataSource;
    private final AutoCreate autoCreate;
    private final JdbcSchema schema;
    private final boolean strictReads;
    private final EventTypes eventTypes;
    private final DocumentMappings documentMappings;
    private final List<Projection<?>> projections;
    private final ObjectMapper objectMapper;
    private final TxHandler txHandler;

    private StoreOptions(Builder b) {
        this.dataSource = b.dataSource;
        this.autoCreate = b.autoCreate;
        this.schema = b.schema != null ? b.schema : new DefaultJdbcSchema(b.tablePrefix);
        this.strictReads = b.strictReads;
        this.eventTypes = b.eventTypes;
        this.documentMappings = b.documentMappings;
        this.projections = Collections.unmodifiableList(new ArrayList<>(b.projections));
        this.objectMapper = b.objectMapper;
        this.txHandler = b.txHandler;
    }

    public static Builder builder(DataSource dataSource) {
        return new Builder(dataSource);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public AutoCreate getAutoCreate() {
        return autoCreate;
    }

    public JdbcSchema getSchema() {
        return schema;
    }

    public boolean isStrictReads() {
        return strictReads;
    }

    public EventTypes getEventTypes() {
        return eventTypes;
    }

    public DocumentMappings getDocumentMappings() {
        return documentMappings;
    }

    public List<Projection<?>> getProjections() {
        return projections;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public TxHandler getTxHandler() {
        return txHandler;
    }

    public static class Builder {
        private final DataSource dataSource;
        private AutoCreate autoCreate = AutoCreate.CREATE_OR_UPDATE;
        private String tablePrefix = DefaultJdbcSchema.DEFAULT_PREFIX;
        private JdbcSchema schema;
        private boolean strictReads = true;
        private final EventTypes eventTypes = new EventTypes();
        private final DocumentMappings documentMappings = new DocumentMappings();
        private final List<Projection<?>> projections = new ArrayList<>();
        private ObjectMapper objectMapper = ObjectMappers.createDefault();
        private TxHandler txHandler = TxHandler.LOCAL;

        Builder(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "DataSource cannot be null");
        }

        public Builder autoCreate(AutoCreate autoCreate) {
            this.autoCreate = Objects.requireNonNull(autoCreate);
            return this;
        }

        public Builder tablePrefix(String tablePrefix) {
            this.tablePrefix = Objects.requireNonNull(tablePrefix);
            return this;
        }

        /**
         * Use custom database layout, table prefix is ignored then.
         * @param schema the schema
         * @return this
         */
        public Builder schema(JdbcSchema schema) {
            this.schema = Objects.requireNonNull(schema);
            return this;
        }

        /**
         * Whether reading an event that cannot be deserialized fails the read (default), or the event is skipped.
         * @param strictReads true for strict reads
         * @return this
         */
        public Builder strictReads(boolean strictReads) {
            this.strictReads = strictReads;
            return this;
        }

        public Builder event(Class<?> eventClass) {
            eventTypes.register(eventClass);
            return this;
        }

        public Builder event(String typeName, Class<?> eventClass) {
            eventTypes.register(typeName, eventClass);
            return this;
        }

        public Builder events(Class<?>... eventClasses) {
            for (Class<?> eventClass : eventClasses) {
                eventTypes.register(eventClass);
            }
            return this;
        }

        public Builder document(DocumentMapping<?> mapping) {
            documentMappings.register(mapping);
            return this;
        }

        public Builder projection(Projection<?> projection) {
            projections.add(Objects.requireNonNull(projection));
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper);
            return this;
        }

        /**
         * Customize the object mapper used for events and documents.
         * @param customizer callback receiving the mapper
         * @return this
         */
        public Builder configureObjectMapper(Consumer<ObjectMapper> customizer) {
            customizer.accept(objectMapper);
            return this;
        }

        public Builder txHandler(TxHandler txHandler) {
            this.txHandler = Objects.requireNonNull(txHandler);
            return this;
        }

        /**
         * Validate and build the options.
         * @return options
         * @throws IllegalStateException if a projection maintains a document class without mapping
         */
        public StoreOptions build() {
            for (Projection<?> projection : projections) {
                if (!documentMappings.mappingFor(projection.getDocumentClass()).isPresent()) {
                    throw new IllegalStateException("Projection " + projection.getName()
                            + " maintains unmapped document " + projection.getDocumentClass().getName());
                }
            }
            return new StoreOptions(this);
        }
    }
}
