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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Order of a user. Total is the sum of line totals of its items.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableOrder.class)
@JsonDeserialize(as = ImmutableOrder.class)
public interface Order {
    String getId();

    String getOrderNumber();

    String getUserId();

    List<OrderItem> getItems();

    @Value.Derived
    default BigDecimal getTotal() {
        return getItems().stream().map(OrderItem::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Value.Default
    default OrderStatus getStatus() {
        return OrderStatus.PENDING;
    }

    Instant getOrderedAt();

    Optional<Instant> getShippedAt();

    static ImmutableOrder.Builder builder() {
        return ImmutableOrder.builder();
    }
}
