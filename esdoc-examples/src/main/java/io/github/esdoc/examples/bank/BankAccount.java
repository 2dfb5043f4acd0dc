package io.github.esdoc.examples.bank;

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

import io.github.esdoc.aggregate.Aggregator;
import io.github.esdoc.examples.bank.event.AccountClosed;
import io.github.esdoc.examples.bank.event.AccountOpened;
import io.github.esdoc.examples.bank.event.MoneyDeposited;
import io.github.esdoc.examples.bank.event.MoneyWithdrawn;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * State of an account as rebuilt from its events. Instances are immutable, every event produces a new one.
 */
public final class BankAccount {
    public static final String AGGREGATE_TYPE = "BankAccount";

    public static final Aggregator<BankAccount> AGGREGATOR = Aggregator.<BankAccount>startingWith(BankAccount::empty)
            .on(AccountOpened.class, BankAccount::opened)
            .on(MoneyDeposited.class, BankAccount::deposited)
            .on(MoneyWithdrawn.class, BankAccount::withdrawn)
            .on(AccountClosed.class, BankAccount::closed)
            .build();

    private final String id;
    private final String accountNumber;
    private final String ownerName;
    private final BigDecimal balance;
    private final boolean closed;
    private final Instant createdAt;
    private final Instant lastModified;

    private BankAccount(String id, String accountNumber, String ownerName, BigDecimal balance, boolean closed,
            Instant createdAt, Instant lastModified) {
        this.id = id;
        this.accountNumber = accountNumber;
        this.ownerName = ownerName;
        this.balance = balance;
        this.closed = closed;
        this.createdAt = createdAt;
        this.lastModified = lastModified;
    }

    static BankAccount empty() {
        return new BankAccount(null, "", "", BigDecimal.ZERO, false, null, null);
    }

    BankAccount opened(AccountOpened e) {
        return new BankAccount(e.getAccountId(), e.getAccountNumber(), e.getOwnerName(), e.getInitialBalance(), false,
                e.getOpenedAt(), e.getOpenedAt());
    }

    BankAccount deposited(MoneyDeposited e) {
        return new BankAccount(id, accountNumber, ownerName, balance.add(e.getAmount()), closed, createdAt,
                e.getDepositedAt());
    }

    BankAccount withdrawn(MoneyWithdrawn e) {
        return new BankAccount(id, accountNumber, ownerName, balance.subtract(e.getAmount()), closed, createdAt,
                e.getWithdrawnAt());
    }

    BankAccount closed(AccountClosed e) {
        return new BankAccount(id, accountNumber, ownerName, balance, true, createdAt, e.getClosedAt());
    }

    public boolean canWithdraw(BigDecimal amount) {
        return !closed && balance.compareTo(amount) >= 0;
    }

    public boolean canDeposit() {
        return !closed;
    }

    public String getId() {
        return id;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    @Override
    public String toString() {
        return "BankAccount{" + "id=" + id + ", accountNumber=" + accountNumber + ", balance=" + balance
                + ", closed=" + closed + '}';
    }
}
