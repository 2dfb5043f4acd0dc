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

import io.github.esdoc.EventSourcedStore;
import io.github.esdoc.document.Document;
import io.github.esdoc.event.ExpectedVersion;
import io.github.esdoc.examples.bank.event.AccountClosed;
import io.github.esdoc.examples.bank.event.AccountOpened;
import io.github.esdoc.examples.bank.event.MoneyDeposited;
import io.github.esdoc.examples.bank.event.MoneyWithdrawn;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Commands on bank accounts. Every command reads the stream version, rebuilds the account up to that version, checks
 * the business rules on it and appends expecting the same version, so two commands racing on one account cannot both
 * succeed. The loser gets {@link StoreException.Fault#CONCURRENCY_CONFLICT} and may retry.
 */
public class BankAccountService {
    private static final Logger logger = LoggerFactory.getLogger(BankAccountService.class);

    private final EventSourcedStore store;
    private final Clock clock;

    public BankAccountService(EventSourcedStore store) {
        this(store, Clock.systemUTC());
    }

    public BankAccountService(EventSourcedStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Open new account.
     * @param accountNumber the account number
     * @param ownerName name of the owner
     * @param initialBalance initial deposit, zero or more
     * @return id of the account, which is also the id of its stream
     * @throws StoreException when the store fails
     */
    public String open(String accountNumber, String ownerName, BigDecimal initialBalance) throws StoreException {
        return open(UUID.randomUUID().toString(), accountNumber, ownerName, initialBalance, clock.instant());
    }

    public String open(String accountId, String accountNumber, String ownerName, BigDecimal initialBalance,
            Instant openedAt) throws StoreException {
        if (initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        store.events().startStream(accountId, BankAccount.AGGREGATE_TYPE, AccountOpened.builder()
                .accountId(accountId)
                .accountNumber(accountNumber)
                .ownerName(ownerName)
                .initialBalance(initialBalance)
                .openedAt(openedAt)
                .build());
        logger.info("Opened account {} for {}", accountNumber, ownerName);
        return accountId;
    }

    public long deposit(String accountId, BigDecimal amount, String description) throws StoreException {
        requirePositive(amount);
        Loaded loaded = load(accountId);
        BankAccount account = loaded.account;
        if (!account.canDeposit()) {
            throw new IllegalStateException("Account " + account.getAccountNumber() + " is closed");
        }
        return append(loaded, MoneyDeposited.builder()
                .accountId(accountId)
                .amount(amount)
                .description(description)
                .depositedAt(clock.instant())
                .build());
    }

    public long withdraw(String accountId, BigDecimal amount, String description) throws StoreException {
        requirePositive(amount);
        Loaded loaded = load(accountId);
        BankAccount account = loaded.account;
        if (!account.canWithdraw(amount)) {
            throw new IllegalStateException(account.isClosed()
                    ? "Account " + account.getAccountNumber() + " is closed"
                    : "Insufficient funds on " + account.getAccountNumber() + " to withdraw " + amount);
        }
        return append(loaded, MoneyWithdrawn.builder()
                .accountId(accountId)
                .amount(amount)
                .description(description)
                .withdrawnAt(clock.instant())
                .build());
    }

    public long close(String accountId, String reason) throws StoreException {
        Loaded loaded = load(accountId);
        BankAccount account = loaded.account;
        if (account.isClosed()) {
            throw new IllegalStateException("Account " + account.getAccountNumber() + " is already closed");
        }
        return append(loaded, AccountClosed.builder()
                .accountId(accountId)
                .finalBalance(account.getBalance())
                .reason(reason)
                .closedAt(clock.instant())
                .build());
    }

    /**
     * Rebuild the account from its events.
     * @param accountId the account
     * @return current state, or empty if there is no such account
     * @throws StoreException when events cannot be read
     */
    public Optional<BankAccount> account(String accountId) throws StoreException {
        return store.aggregates().rebuild(accountId, BankAccount.AGGREGATOR);
    }

    public Optional<AccountBalance> balance(String accountId) throws StoreException {
        return store.documents().load(AccountBalance.class, accountId).map(Document::getValue);
    }

    public Optional<TransactionHistory> history(String accountId) throws StoreException {
        return store.documents().load(TransactionHistory.class, accountId).map(Document::getValue);
    }

    private Loaded load(String accountId) throws StoreException {
        long version = store.streams().version(accountId).orElseThrow(() -> StoreException.streamNotFound(accountId));
        BankAccount account = store.aggregates().rebuild(accountId, BankAccount.AGGREGATOR, version)
                .orElseThrow(() -> StoreException.streamNotFound(accountId));
        return new Loaded(accountId, account, version);
    }

    private long append(Loaded loaded, Object event) throws StoreException {
        long version = store.events().append(loaded.accountId, ExpectedVersion.exact(loaded.version), event);
        logger.debug("Account {} at version {}", loaded.account.getAccountNumber(), version);
        return version;
    }

    private static final class Loaded {
        private final String accountId;
        private final BankAccount account;
        private final long version;

        Loaded(String accountId, BankAccount account, long version) {
            this.accountId = accountId;
            this.account = account;
            this.version = version;
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }
}
