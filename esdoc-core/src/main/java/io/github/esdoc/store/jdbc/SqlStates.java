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

import java.sql.SQLException;

/**
 * Classification of SQL errors.
 */
final class SqlStates {
    private SqlStates() {

    }

    /**
     * Whether the error was caused by a concurrent writer: a unique constraint violation (class 23), a serialization
     * failure (40001), or H2's concurrent update (90131).
     * @param e the error
     * @return true for conflicts
     */
    static boolean isConflict(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (state != null && (state.startsWith("23") || state.equals("40001") || state.equals("90131"))) {
                return true;
            }
        }
        return false;
    }
}
