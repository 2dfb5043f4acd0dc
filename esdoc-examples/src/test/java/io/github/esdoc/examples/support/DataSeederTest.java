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

import io.github.esdoc.document.Document;
import io.github.esdoc.document.Filter;
import io.github.esdoc.document.Query;
import io.github.esdoc.examples.ExampleStoreTest;
import io.github.esdoc.examples.bank.AccountBalance;
import io.github.esdoc.examples.bank.BankAccount;
import io.github.esdoc.examples.bank.TransactionHistory;
import io.github.esdoc.examples.catalog.Product;
import io.github.esdoc.examples.catalog.User;
import io.github.esdoc.store.StoreException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;


public class DataSeederTest extends ExampleStoreTest {
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private DataSeeder seeder;
    private DatabaseReset reset;

    @Before
    public void createHelpers() {
        seeder = new DataSeeder(store, new Random(42));
        reset = new DatabaseReset(store);
    }

    @Test
    public void seeds_all_sample_data() throws StoreException {
        seeder.seedAll();

        assertEquals(10, store.documents().count(User.class, Filter.all()));
        assertEquals(20, store.documents().count(Product.class, Filter.all()));
        assertEquals(5, store.documents().count(AccountBalance.class, Filter.all()));
        assertEquals(1, store.documents().count(User.class, Filter.eq("email", "alice@example.com")));
    }

    @Test
    public void seeded_accounts_match_their_events() throws StoreException {
        List<String> ids = seeder.seedBankAccounts(5);

        for (String id : ids) {
            BankAccount account = store.aggregates().rebuild(id, BankAccount.AGGREGATOR).get();
            AccountBalance balance = store.documents().load(AccountBalance.class, id).get().getValue();
            TransactionHistory history = store.documents().load(TransactionHistory.class, id).get().getValue();
            collector.checkThat(id, balance.getBalance(), comparesEqualTo(account.getBalance()));
            collector.checkThat(id, balance.getBalance().signum() >= 0, equalTo(true));
            collector.checkThat(id, (long) history.getTransactions().size(),
                equalTo(store.streams().version(id).getAsLong()));
            collector.checkThat(id, history.getTransactions().stream().map(t -> t.getAmount())
                    .reduce(BigDecimal.ZERO, BigDecimal::add), comparesEqualTo(account.getBalance()));
        }
    }

    @Test
    public void products_are_priced_within_range() throws StoreException {
        seeder.seedProducts(20);

        for (Document<Product> product : store.documents().query(Query.of(Product.class).orderBy("price"))) {
            BigDecimal price = product.getValue().getPrice();
            collector.checkThat(product.getId(), price.compareTo(BigDecimal.TEN) >= 0
                    && price.compareTo(new BigDecimal("510")) <= 0, equalTo(true));
        }
    }

    @Test
    public void resetting_documents_keeps_events() throws StoreException {
        List<String> ids = seeder.seedBankAccounts(3);
        seeder.seedUsers(3);

        reset.resetDocuments();

        assertEquals(0, store.documents().count(User.class, Filter.all()));
        assertEquals(0, store.documents().count(AccountBalance.class, Filter.all()));
        assertDb(3, "select count(*) from es_streams");
        store.rebuildProjection(AccountBalance.class);
        assertEquals(3, store.documents().count(AccountBalance.class, Filter.all()));
        assertEquals(ids.get(0), store.documents().load(AccountBalance.class, ids.get(0)).get().getId());
    }

    @Test
    public void complete_reset_removes_everything() throws StoreException {
        seeder.seedAll();

        reset.completeReset();

        assertDb(0, "select count(*) from es_events");
        assertDb(0, "select count(*) from es_documents");
    }

    @Test
    public void recreated_schema_is_empty_and_usable() throws StoreException {
        List<String> ids = seeder.seedBankAccounts(1);

        reset.recreateSchema();

        assertFalse(store.streams().version(ids.get(0)).isPresent());
        seeder.seedUsers(2);
        assertEquals(2, store.documents().count(User.class, Filter.all()));
    }
}
