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

import io.github.esdoc.EventSourcedStore;
import io.github.esdoc.StoreOptions;
import io.github.esdoc.document.Document;
import io.github.esdoc.document.Filter;
import io.github.esdoc.document.Query;
import io.github.esdoc.examples.bank.AccountBalance;
import io.github.esdoc.examples.bank.BankAccountService;
import io.github.esdoc.examples.catalog.User;
import io.github.esdoc.store.StoreException;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Stores and queries a user, then runs a short bank account scenario. Failures of single steps are reported with
 * their fault and key; only an unavailable database ends the run.
 */
public class DemoApplication {
    private static final Logger logger = LoggerFactory.getLogger(DemoApplication.class);

    private final EventSourcedStore store;

    interface Step {
        void run() throws StoreException;
    }

    public DemoApplication(EventSourcedStore store) {
        this.store = store;
    }

    public static void main(String[] args) {
        DemoConfiguration configuration = DemoConfiguration.load();
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setURL(configuration.getConnection());
        try (EventSourcedStore store = EventSourcedStore.create(options(dataSource, configuration))) {
            new DemoApplication(store).run();
        } catch (StoreException e) {
            logger.error("Demo stopped: {} on {}", e.getFault(), e.getKey(), e);
            System.exit(1);
        }
    }

    static StoreOptions options(DataSource dataSource, DemoConfiguration configuration) {
        return ExampleModel.register(StoreOptions.builder(dataSource)
                .autoCreate(configuration.getAutoCreate())
                .tablePrefix(configuration.getTablePrefix()))
                .build();
    }

    /**
     * Run all steps.
     * @return number of steps that failed with recoverable fault
     * @throws StoreException when the database is not available
     */
    public int run() throws StoreException {
        int failed = 0;
        failed += step("store user", this::storeUser);
        failed += step("bank account", this::bankScenario);
        return failed;
    }

    int step(String name, Step step) throws StoreException {
        try {
            step.run();
            return 0;
        } catch (StoreException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            logger.warn("Step {} failed: {} on {}: {}", name, e.getFault(), e.getKey(), e.getMessage());
            return 1;
        }
    }

    void storeUser() throws StoreException {
        String email = "h@ennuba.com";
        store.documents().store(User.builder().id(UUID.randomUUID().toString()).name("Hermann").email(email).build());
        List<Document<User>> found = store.documents().query(Query.of(User.class)
                .where(Filter.eq("email", email))
                .limit(1));
        for (Document<User> user : found) {
            logger.info("Stored user: {} - {}", user.getValue().getName(), user.getValue().getEmail());
        }
    }

    void bankScenario() throws StoreException {
        BankAccountService accounts = new BankAccountService(store);
        String id = accounts.open("ACC-" + System.currentTimeMillis() % 100000, "Hermann Smith",
            new BigDecimal("1000"));
        accounts.deposit(id, new BigDecimal("500"), "Salary");
        accounts.withdraw(id, new BigDecimal("200"), "Rent");
        AccountBalance balance = accounts.balance(id).orElseThrow(() -> new IllegalStateException(
            "Balance of " + id + " was not projected"));
        logger.info("Account {} of {} has balance {}", balance.getAccountNumber(), balance.getOwnerName(),
            balance.getBalance());
    }
}
