package io.github.esdoc.examples.catalog;

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
import io.github.esdoc.store.StoreException;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;


public class CatalogDocumentsTest extends ExampleStoreTest {

    private static Product product(String id, String sku, String price) {
        return Product.builder()
                .id(id)
                .sku(sku)
                .name("Item " + sku)
                .price(new BigDecimal(price))
                .stockQuantity(10)
                .addTag("office")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    private static Order order(String id, String userId, OrderStatus status, int quantity, String unitPrice) {
        return Order.builder()
                .id(id)
                .orderNumber("ORD-" + id)
                .userId(userId)
                .addItem(ImmutableOrderItem.builder()
                        .productId("p1")
                        .productName("Laptop")
                        .quantity(quantity)
                        .unitPrice(new BigDecimal(unitPrice))
                        .build())
                .status(status)
                .orderedAt(Instant.parse("2024-05-02T10:00:00Z"))
                .build();
    }

    @Test
    public void user_is_found_by_email() throws StoreException {
        store.documents().store(User.builder().id("u1").name("Hermann").email("h@ennuba.com").build());
        store.documents().store(User.builder().id("u2").name("Alice").email("alice@example.com").build());

        List<Document<User>> found = store.documents().query(Query.of(User.class)
                .where(Filter.eq("email", "h@ennuba.com")));
        assertEquals(1, found.size());
        assertEquals("Hermann", found.get(0).getValue().getName());
    }

    @Test
    public void missing_document_is_empty() throws StoreException {
        assertFalse(store.documents().load(User.class, "ghost").isPresent());
    }

    @Test
    public void product_round_trips_with_defaults() throws StoreException {
        Product stored = product("p1", "PRD-1000", "19.99");
        store.documents().store(stored);

        Product loaded = store.documents().load(Product.class, "p1").get().getValue();
        assertEquals(stored, loaded);
        assertEquals("", loaded.getDescription());
        assertEquals(Optional.empty(), loaded.getUpdatedAt());
    }

    @Test
    public void only_one_of_racing_writers_wins() throws StoreException {
        store.documents().store(product("p1", "PRD-1000", "10.00"));
        Document<Product> first = store.documents().load(Product.class, "p1").get();
        Document<Product> second = store.documents().load(Product.class, "p1").get();

        String token = store.documents().store(ImmutableProduct.copyOf(first.getValue())
                .withPrice(new BigDecimal("12.00"))
                .withUpdatedAt(Instant.now()), first.getVersionToken());
        assertThat(token, not(first.getVersionToken()));
        try {
            store.documents().store(ImmutableProduct.copyOf(second.getValue()).withStockQuantity(0),
                second.getVersionToken());
            fail("Second writer should lose");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
        Product current = store.documents().load(Product.class, "p1").get().getValue();
        assertThat(current.getPrice(), comparesEqualTo(new BigDecimal("12.00")));
        assertEquals(10, current.getStockQuantity());
    }

    @Test
    public void products_are_queried_by_price_range() throws StoreException {
        store.documents().storeAll(Arrays.asList(product("p1", "PRD-1", "5"), product("p2", "PRD-2", "15"),
            product("p3", "PRD-3", "25"), product("p4", "PRD-4", "35")));

        List<Document<Product>> found = store.documents().query(Query.of(Product.class)
                .where(Filter.between("price", 10, 30))
                .orderByDescending("price"));
        assertEquals(Arrays.asList("p3", "p2"), ids(found));
        assertEquals(2, store.documents().count(Product.class, Filter.gt("price", new BigDecimal("10"))
                .and(Filter.lt("price", 35))));
    }

    @Test
    public void orders_are_filtered_by_status_and_sorted_by_total() throws StoreException {
        store.documents().storeAll(Arrays.asList(order("o1", "u1", OrderStatus.PENDING, 1, "100"),
            order("o2", "u1", OrderStatus.SHIPPED, 3, "100"),
            order("o3", "u1", OrderStatus.PENDING, 2, "100"),
            order("o4", "u2", OrderStatus.PENDING, 5, "100")));

        List<Document<Order>> found = store.documents().query(Query.of(Order.class)
                .where(Filter.eq("status", OrderStatus.PENDING).and(Filter.eq("userId", "u1")))
                .orderByDescending("total"));
        assertEquals(Arrays.asList("o3", "o1"), ids(found));
        assertThat(found.get(0).getValue().getTotal(), comparesEqualTo(new BigDecimal("200")));
    }

    @Test
    public void contact_keeps_optional_addresses() throws StoreException {
        Contact contact = Contact.builder()
                .id("c1")
                .name("Hermann")
                .email("h@ennuba.com")
                .addPhoneNumber("+49 30 1234")
                .homeAddress(ImmutableAddress.of("Main Street 1", "Berlin", "BE", "10115", "DE"))
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
        store.documents().insert(contact);

        Contact loaded = store.documents().load(Contact.class, "c1").get().getValue();
        assertEquals(contact, loaded);
        assertFalse(loaded.getWorkAddress().isPresent());
        assertThat(ids(store.documents().query(Query.of(Contact.class).where(Filter.eq("homeCity", "Berlin")))),
            contains("c1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void query_on_field_without_index_is_rejected() throws StoreException {
        store.documents().query(Query.of(Product.class).where(Filter.eq("description", "x")));
    }

    private static <T> List<String> ids(List<Document<T>> documents) {
        String[] ids = new String[documents.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = documents.get(i).getId();
        }
        return Arrays.asList(ids);
    }
}
