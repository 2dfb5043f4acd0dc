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
import io.github.esdoc.examples.bank.BankAccountService;
import io.github.esdoc.examples.catalog.Product;
import io.github.esdoc.examples.catalog.User;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;

/**
 * Fills the store with sample users, products and bank accounts with random transactions.
 */
public class DataSeeder {
    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    private static final String[] USER_NAMES = { "Alice", "Bob", "Charlie", "Diana", "Eve", "Frank", "Grace", "Henry",
            "Iris", "Jack" };
    private static final String[] DOMAINS = { "example.com", "test.com", "demo.com" };
    private static final String[] PRODUCT_NAMES = { "Laptop", "Mouse", "Keyboard", "Monitor", "Headphones", "Webcam",
            "Microphone", "Speakers", "USB Hub", "Cable", "Desk", "Chair", "Lamp", "Notebook", "Pen", "Backpack",
            "Water Bottle", "Coffee Mug", "Plant", "Calendar" };
    private static final String[] TAGS = { "electronics", "office", "home", "tech", "productivity", "comfort",
            "wireless", "ergonomic" };
    private static final String[] OWNERS = { "Hermann Smith", "Alice Johnson", "Bob Williams", "Charlie Brown",
            "Diana Davis" };
    private static final String[] DESCRIPTIONS = { "Salary", "Bonus", "Rent", "Groceries", "Utilities",
            "Shopping" };

    private final EventSourcedStore store;
    private final BankAccountService accounts;
    private final Random random;

    public DataSeeder(EventSourcedStore store) {
        this(store, new Random());
    }

    public DataSeeder(EventSourcedStore store, Random random) {
        this.store = store;
        this.accounts = new BankAccountService(store);
        this.random = random;
    }

    /**
     * Store sample users, at most one per known name.
     * @param count number of users
     * @return the users
     * @throws StoreException when the store fails
     */
    public List<User> seedUsers(int count) throws StoreException {
        List<User> users = new ArrayList<>();
        for (int i = 0; i < Math.min(count, USER_NAMES.length); i++) {
            users.add(User.builder()
                    .id(UUID.randomUUID().toString())
                    .name(USER_NAMES[i])
                    .email(USER_NAMES[i].toLowerCase(Locale.ROOT) + "@" + DOMAINS[i % DOMAINS.length])
                    .build());
        }
        store.documents().storeAll(users);
        logger.info("Seeded {} users", users.size());
        return users;
    }

    public List<Product> seedProducts(int count) throws StoreException {
        List<Product> products = new ArrayList<>();
        Instant now = Instant.now();
        for (int i = 0; i < Math.min(count, PRODUCT_NAMES.length); i++) {
            String name = PRODUCT_NAMES[i];
            products.add(Product.builder()
                    .id(UUID.randomUUID().toString())
                    .sku("PRD-" + (1000 + i))
                    .name(name)
                    .description("High quality " + name.toLowerCase(Locale.ROOT) + " for professionals")
                    .price(BigDecimal.valueOf(random.nextDouble() * 500 + 10).setScale(2, RoundingMode.HALF_UP))
                    .stockQuantity(random.nextInt(100))
                    .tags(randomTags())
                    .createdAt(now.minus(Duration.ofDays(random.nextInt(365))))
                    .build());
        }
        store.documents().storeAll(products);
        logger.info("Seeded {} products", products.size());
        return products;
    }

    /**
     * Open sample accounts and run random deposits and withdrawals on them. Withdrawals that the account cannot
     * cover are turned into deposits.
     * @param count number of accounts
     * @return ids of the accounts
     * @throws StoreException when the store fails
     */
    public List<String> seedBankAccounts(int count) throws StoreException {
        List<String> ids = new ArrayList<>();
        Instant now = Instant.now();
        for (int i = 0; i < Math.min(count, OWNERS.length); i++) {
            BigDecimal balance = BigDecimal.valueOf(500 + random.nextInt(4500));
            String id = accounts.open(UUID.randomUUID().toString(), "ACC-" + (10000 + i), OWNERS[i], balance,
                now.minus(Duration.ofDays(30 + random.nextInt(335))));
            int transactions = 3 + random.nextInt(7);
            for (int j = 0; j < transactions; j++) {
                BigDecimal amount = BigDecimal.valueOf(50 + random.nextInt(450));
                String description = DESCRIPTIONS[random.nextInt(DESCRIPTIONS.length)];
                if (random.nextBoolean() && balance.compareTo(amount) >= 0) {
                    accounts.withdraw(id, amount, description);
                    balance = balance.subtract(amount);
                } else {
                    accounts.deposit(id, amount, description);
                    balance = balance.add(amount);
                }
            }
            ids.add(id);
        }
        logger.info("Seeded {} bank accounts with transactions", ids.size());
        return ids;
    }

    public void seedAll() throws StoreException {
        seedUsers(USER_NAMES.length);
        seedProducts(PRODUCT_NAMES.length);
        seedBankAccounts(OWNERS.length);
        logger.info("All sample data seeded");
    }

    private List<String> randomTags() {
        List<String> tags = new ArrayList<>(Arrays.asList(TAGS));
        Collections.shuffle(tags, random);
        return tags.subList(0, 1 + random.nextInt(3));
    }
}
