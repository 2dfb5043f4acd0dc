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

import io.github.esdoc.document.Filter;
import io.github.esdoc.examples.bank.AccountBalance;
import io.github.esdoc.examples.catalog.User;
import io.github.esdoc.store.StoreException;
import org.junit.Test;

import java.sql.SQLException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;


public class DemoApplicationTest extends ExampleStoreTest {

    @Test
    public void demo_runs_against_store() throws StoreException {
        assertEquals(0, new DemoApplication(store).run());
        assertEquals(1, store.documents().count(User.class, Filter.eq("email", "h@ennuba.com")));
        assertEquals(1, store.documents().count(AccountBalance.class, Filter.eq("balance", 1300)));
    }

    @Test
    public void recoverable_failure_is_reported_and_skipped() throws StoreException {
        DemoApplication demo = new DemoApplication(store);
        assertEquals(1, demo.step("missing", () -> {
            throw StoreException.streamNotFound("missing");
        }));
    }

    @Test
    public void storage_failure_stops_the_demo() {
        DemoApplication demo = new DemoApplication(store);
        StoreException failure = StoreException.storeFailed("es_events", new SQLException("Connection refused"));
        try {
            demo.step("down", () -> {
                throw failure;
            });
            fail("Storage failure should propagate");
        } catch (StoreException e) {
            assertSame(failure, e);
        }
    }
}
