package io.github.esdoc.examples;

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

import io.github.esdoc.store.AutoCreate;
import io.github.esdoc.store.jdbc.DefaultJdbcSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of the demo application, read from {@code esdoc.properties} on the classpath. Environment variable
 * {@code CONN} overrides the configured JDBC URL.
 */
public final class DemoConfiguration {
    public static final String RESOURCE = "esdoc.properties";
    public static final String CONNECTION_ENV = "CONN";
    static final String CONNECTION = "esdoc.connection";
    static final String AUTO_CREATE = "esdoc.autoCreate";
    static final String TABLE_PREFIX = "esdoc.tablePrefix";

    private final String connection;
    private final AutoCreate autoCreate;
    private final String tablePrefix;

    private DemoConfiguration(String connection, AutoCreate autoCreate, String tablePrefix) {
        this.connection = connection;
        this.autoCreate = autoCreate;
        this.tablePrefix = tablePrefix;
    }

    public static DemoConfiguration load() {
        Properties properties = new Properties();
        try (InputStream in = DemoConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(RESOURCE + " not found on classpath");
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return from(properties, System.getenv());
    }

    /**
     * Resolve configuration. Unknown schema management mode means no schema changes.
     * @param properties configured properties
     * @param environment environment variables
     * @return the configuration
     * @throws IllegalStateException when no connection is configured
     */
    public static DemoConfiguration from(Properties properties, Map<String, String> environment) {
        String connection = environment.get(CONNECTION_ENV);
        if (connection == null || connection.trim().isEmpty()) {
            connection = properties.getProperty(CONNECTION);
        }
        if (connection == null || connection.trim().isEmpty()) {
            throw new IllegalStateException("No database connection found in environment variable "
                    + CONNECTION_ENV + " or property " + CONNECTION);
        }
        return new DemoConfiguration(connection.trim(),
                AutoCreate.parse(properties.getProperty(AUTO_CREATE), AutoCreate.NONE),
                properties.getProperty(TABLE_PREFIX, DefaultJdbcSchema.DEFAULT_PREFIX));
    }

    public String getConnection() {
        return connection;
    }

    public AutoCreate getAutoCreate() {
        return autoCreate;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }
}
