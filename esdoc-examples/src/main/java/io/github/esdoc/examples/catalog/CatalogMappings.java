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

import io.github.esdoc.StoreOptions;
import io.github.esdoc.document.DocumentMapping;
import io.github.esdoc.document.IndexedField.Kind;

/**
 * Document mappings of the catalog. Only the indexed fields can be used in queries.
 */
public final class CatalogMappings {
    private CatalogMappings() {

    }

    public static final DocumentMapping<User> USER = DocumentMapping.builder(User.class, User::getId)
            .index("name", Kind.TEXT, User::getName)
            .index("email", Kind.TEXT, User::getEmail)
            .build();

    public static final DocumentMapping<Product> PRODUCT = DocumentMapping.builder(Product.class, Product::getId)
            .index("sku", Kind.TEXT, Product::getSku)
            .index("name", Kind.TEXT, Product::getName)
            .index("price", Kind.NUMBER, Product::getPrice)
            .index("stockQuantity", Kind.NUMBER, Product::getStockQuantity)
            .index("createdAt", Kind.TIMESTAMP, Product::getCreatedAt)
            .build();

    public static final DocumentMapping<Order> ORDER = DocumentMapping.builder(Order.class, Order::getId)
            .index("orderNumber", Kind.TEXT, Order::getOrderNumber)
            .index("userId", Kind.TEXT, Order::getUserId)
            .index("status", Kind.TEXT, Order::getStatus)
            .index("total", Kind.NUMBER, Order::getTotal)
            .index("orderedAt", Kind.TIMESTAMP, Order::getOrderedAt)
            .build();

    public static final DocumentMapping<Contact> CONTACT = DocumentMapping.builder(Contact.class, Contact::getId)
            .index("name", Kind.TEXT, Contact::getName)
            .index("email", Kind.TEXT, Contact::getEmail)
            .index("homeCity", Kind.TEXT, c -> c.getHomeAddress().map(Address::getCity).orElse(null))
            .build();

    public static StoreOptions.Builder register(StoreOptions.Builder options) {
        return options.document(USER).document(PRODUCT).document(ORDER).document(CONTACT);
    }
}
