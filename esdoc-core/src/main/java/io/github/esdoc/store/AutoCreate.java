package io.github.esdoc.store;

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

/**
 * How the store treats its database tables when it starts.
 */
public enum AutoCreate {
    /**
     * Create missing tables, drop and recreate tables whose columns differ from the expected ones. Loses data, meant
     * for development.
     */
    ALL,
    /**
     * Create missing tables and add missing columns to existing ones. Nothing is dropped.
     */
    CREATE_OR_UPDATE,
    /**
     * Create missing tables, leave existing ones untouched.
     */
    CREATE_ONLY,
    /**
     * Never change the database. Missing tables are only reported.
     */
    NONE;

    /**
     * Parse configured value, ignoring case and the difference between {@code CreateOrUpdate} and
     * {@code CREATE_OR_UPDATE}.
     * @param value configured value, may be null
     * @param fallback value to use when configured value is missing or unknown
     * @return the mode
     */
    public static AutoCreate parse(String value, AutoCreate fallback) {
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().replace("_", "").replace("-", "");
        for (AutoCreate mode : values()) {
            if (mode.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        return fallback;
    }
}
