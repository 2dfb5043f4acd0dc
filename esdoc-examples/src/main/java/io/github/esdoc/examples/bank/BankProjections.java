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

import io.github.esdoc.StoreOptions;
import io.github.esdoc.document.DocumentMapping;
import io.github.esdoc.document.IndexedField;
import io.github.esdoc.examples.bank.event.AccountClosed;
import io.github.esdoc.examples.bank.event.AccountOpened;
import io.github.esdoc.examples.bank.event.MoneyDeposited;
import io.github.esdoc.examples.bank.event.MoneyWithdrawn;
import io.github.esdoc.projection.Projection;

import java.math.BigDecimal;

/**
 * Event types, read model mappings and inline projections of the bank account domain.
 */
public final class BankProjections {
    private BankProjections() {

    }

    public static final DocumentMapping<AccountBalance> BALANCE_MAPPING = DocumentMapping
            .builder(AccountBalance.class, AccountBalance::getId)
            .index("accountNumber", IndexedField.Kind.TEXT, AccountBalance::getAccountNumber)
            .index("ownerName", IndexedField.Kind.TEXT, AccountBalance::getOwnerName)
            .index("balance", IndexedField.Kind.NUMBER, AccountBalance::getBalance)
            .index("closed", IndexedField.Kind.BOOLEAN, AccountBalance::isClosed)
            .build();

    public static final DocumentMapping<TransactionHistory> HISTORY_MAPPING = DocumentMapping
            .builder(TransactionHistory.class, TransactionHistory::getId)
            .index("accountNumber", IndexedField.Kind.TEXT, TransactionHistory::getAccountNumber)
            .build();

    public static final Projection<AccountBalance> BALANCE = Projection.singleStream(AccountBalance.class)
            .createOn(AccountOpened.class, e -> ImmutableAccountBalance.builder()
                    .id(e.getAccountId())
                    .accountNumber(e.getAccountNumber())
                    .ownerName(e.getOwnerName())
                    .balance(e.getInitialBalance())
                    .lastModified(e.getOpenedAt())
                    .closed(false)
                    .build())
            .applyOn(MoneyDeposited.class, (view, e) -> ImmutableAccountBalance.copyOf(view)
                    .withBalance(view.getBalance().add(e.getAmount()))
                    .withLastModified(e.getDepositedAt()))
            .applyOn(MoneyWithdrawn.class, (view, e) -> ImmutableAccountBalance.copyOf(view)
                    .withBalance(view.getBalance().subtract(e.getAmount()))
                    .withLastModified(e.getWithdrawnAt()))
            .applyOn(AccountClosed.class, (view, e) -> ImmutableAccountBalance.copyOf(view)
                    .withClosed(true)
                    .withLastModified(e.getClosedAt()))
            .build();

    public static final Projection<TransactionHistory> HISTORY = Projection.singleStream(TransactionHistory.class)
            .createOn(AccountOpened.class, e -> ImmutableTransactionHistory.builder()
                    .id(e.getAccountId())
                    .accountNumber(e.getAccountNumber())
                    .addTransaction(ImmutableTransaction.of(Transaction.OPENED, e.getInitialBalance(),
                            "Account opened with initial deposit", e.getOpenedAt()))
                    .build())
            .applyOn(MoneyDeposited.class, (view, e) -> append(view, ImmutableTransaction.of(Transaction.DEPOSIT,
                    e.getAmount(), e.getDescription(), e.getDepositedAt())))
            .applyOn(MoneyWithdrawn.class, (view, e) -> append(view, ImmutableTransaction.of(Transaction.WITHDRAWAL,
                    e.getAmount().negate(), e.getDescription(), e.getWithdrawnAt())))
            .applyOn(AccountClosed.class, (view, e) -> append(view, ImmutableTransaction.of(Transaction.CLOSED,
                    BigDecimal.ZERO, e.getReason(), e.getClosedAt())))
            .build();

    /**
     * Register the bank account events, read models and projections.
     * @param options store options under construction
     * @return the options
     */
    public static StoreOptions.Builder register(StoreOptions.Builder options) {
        return options.events(AccountOpened.class, MoneyDeposited.class, MoneyWithdrawn.class, AccountClosed.class)
                .document(BALANCE_MAPPING)
                .document(HISTORY_MAPPING)
                .projection(BALANCE)
                .projection(HISTORY);
    }

    private static TransactionHistory append(TransactionHistory view, Transaction transaction) {
        return ImmutableTransactionHistory.builder().from(view).addTransaction(transaction).build();
    }
}
