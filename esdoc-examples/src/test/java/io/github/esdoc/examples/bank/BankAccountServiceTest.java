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
import io.github.esdoc.aggregate.Aggregator;
import io.github.esdoc.event.ExpectedVersion;
import io.github.esdoc.examples.ExampleStoreTest;
import io.github.esdoc.examples.bank.event.AccountOpened;
import io.github.esdoc.examples.bank.event.MoneyDeposited;
import io.github.esdoc.store.StoreException;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class BankAccountServiceTest extends ExampleStoreTest {
    private BankAccountService accounts;

    @Override
    protected StoreOptions.Builder configure(StoreOptions.Builder options) {
        return options.event(StatementRequested.class);
    }

    @Before
    public void createService() {
        accounts = new BankAccountService(store);
    }

    private String openWithHistory() throws StoreException {
        String id = accounts.open("ACC-1", "Hermann Smith", new BigDecimal("1000"));
        accounts.deposit(id, new BigDecimal("500"), "Salary");
        accounts.withdraw(id, new BigDecimal("200"), "Rent");
        return id;
    }

    @Test
    public void balance_is_projected_after_every_command() throws StoreException {
        String id = openWithHistory();

        AccountBalance balance = accounts.balance(id).get();
        assertThat(balance.getBalance(), comparesEqualTo(new BigDecimal("1300")));
        assertEquals("ACC-1", balance.getAccountNumber());
        assertFalse(balance.isClosed());
        assertEquals(OptionalLong.of(3), store.streams().version(id));
    }

    @Test
    public void aggregate_agrees_with_projection() throws StoreException {
        String id = openWithHistory();

        BankAccount account = accounts.account(id).get();
        assertThat(account.getBalance(), comparesEqualTo(accounts.balance(id).get().getBalance()));
        assertEquals("Hermann Smith", account.getOwnerName());
        assertTrue(account.canWithdraw(new BigDecimal("1300")));
        assertFalse(account.canWithdraw(new BigDecimal("1300.01")));
    }

    @Test
    public void history_lists_transactions_in_order() throws StoreException {
        String id = openWithHistory();

        List<Transaction> transactions = accounts.history(id).get().getTransactions();
        assertEquals(3, transactions.size());
        assertEquals(Transaction.OPENED, transactions.get(0).getType());
        assertEquals("Salary", transactions.get(1).getDescription());
        assertThat(transactions.get(2).getAmount(), comparesEqualTo(new BigDecimal("-200")));
    }

    @Test
    public void stale_expected_version_persists_nothing() throws StoreException {
        String id = openWithHistory();
        try {
            store.events().append(id, ExpectedVersion.exact(5), MoneyDeposited.builder()
                    .accountId(id)
                    .amount(BigDecimal.TEN)
                    .description("Late")
                    .depositedAt(Instant.now())
                    .build());
            fail("Append at stale version should fail");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
            assertEquals(id, e.getKey());
        }
        assertEquals(OptionalLong.of(3), store.streams().version(id));
        assertThat(accounts.balance(id).get().getBalance(), comparesEqualTo(new BigDecimal("1300")));
        assertEquals(3, accounts.history(id).get().getTransactions().size());
    }

    @Test
    public void commands_append_to_the_stream_they_were_loaded_from() throws StoreException {
        // stream imported under another id than the one carried by its events
        store.events().startStream("legacy-7", BankAccount.AGGREGATE_TYPE, AccountOpened.builder()
                .accountId("ACC-7-id")
                .accountNumber("ACC-7")
                .ownerName("Frank Miller")
                .initialBalance(new BigDecimal("10"))
                .openedAt(Instant.now())
                .build());

        assertEquals(2, accounts.deposit("legacy-7", new BigDecimal("5"), "Refund"));
        assertEquals(OptionalLong.of(2), store.streams().version("legacy-7"));
        assertFalse(store.streams().version("ACC-7-id").isPresent());
        assertThat(accounts.account("legacy-7").get().getBalance(), comparesEqualTo(new BigDecimal("15")));
    }

    @Test
    public void withdrawal_beyond_balance_is_refused() throws StoreException {
        String id = accounts.open("ACC-2", "Alice Johnson", new BigDecimal("100"));
        try {
            accounts.withdraw(id, new BigDecimal("100.50"), "Too much");
            fail("Withdrawal should be refused");
        } catch (IllegalStateException e) {
            assertEquals(OptionalLong.of(1), store.streams().version(id));
        }
    }

    @Test
    public void closed_account_accepts_no_money() throws StoreException {
        String id = accounts.open("ACC-3", "Bob Williams", new BigDecimal("50"));
        accounts.close(id, "Moving abroad");
        try {
            accounts.deposit(id, BigDecimal.ONE, "Gift");
            fail("Deposit to closed account should be refused");
        } catch (IllegalStateException e) {
            assertTrue(accounts.balance(id).get().isClosed());
        }
        assertEquals(Transaction.CLOSED, accounts.history(id).get().getTransactions().get(1).getType());
    }

    @Test
    public void commands_on_missing_account_fail() throws StoreException {
        try {
            accounts.deposit("nobody", BigDecimal.ONE, "Gift");
            fail("Deposit to missing account should fail");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.STREAM_NOT_FOUND, e.getFault());
        }
        assertFalse(accounts.account("nobody").isPresent());
        assertFalse(accounts.balance("nobody").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void amounts_must_be_positive() throws StoreException {
        String id = accounts.open("ACC-4", "Charlie Brown", BigDecimal.ZERO);
        accounts.deposit(id, BigDecimal.ZERO, "Nothing");
    }

    @Test
    public void unhandled_event_leaves_projection_untouched() throws StoreException {
        String id = accounts.open("ACC-5", "Diana Davis", new BigDecimal("1000"));
        AccountBalance before = accounts.balance(id).get();

        store.events().append(id, ExpectedVersion.exact(1), new StatementRequested("email"));

        assertEquals(before, accounts.balance(id).get());
        assertEquals(1, accounts.history(id).get().getTransactions().size());
        Aggregator<Integer> statements = Aggregator.<Integer>startingWith(() -> 0)
                .on(StatementRequested.class, (count, e) -> count + 1)
                .build();
        assertEquals(Integer.valueOf(1), store.aggregates().rebuild(id, statements).get());
    }

    @Test
    public void commands_continue_after_unhandled_event() throws StoreException {
        String id = accounts.open("ACC-6", "Eve", new BigDecimal("10"));
        store.events().append(id, ExpectedVersion.exact(1), new StatementRequested("post"));

        assertEquals(3, accounts.deposit(id, new BigDecimal("5"), "Refund"));
        assertThat(accounts.balance(id).get().getBalance(), comparesEqualTo(new BigDecimal("15")));
    }

    @Test
    public void projection_rebuild_restores_read_model() throws StoreException {
        String id = openWithHistory();
        AccountBalance before = accounts.balance(id).get();
        store.documents().delete(AccountBalance.class, id);

        store.rebuildProjection(AccountBalance.class);

        assertEquals(before, accounts.balance(id).get());
        assertEquals(3, accounts.history(id).get().getTransactions().size());
    }
}
