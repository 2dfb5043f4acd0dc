package io.github.esdoc.document;

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

import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;


public class DocumentMappingTest {
    enum Status {
        PENDING, SHIPPED
    }

    static class Shipment {
        final String id;
        final Status status;
        final double weight;
        final Instant sent;

        Shipment(String id, Status status, double weight, Instant sent) {
            this.id = id;
            this.status = status;
            this.weight = weight;
            this.sent = sent;
        }
    }

    static class ExpressShipment extends Shipment {
        ExpressShipment(String id) {
            super(id, Status.PENDING, 1, null);
        }
    }

    private final DocumentMapping<Shipment> mapping = DocumentMapping.builder(Shipment.class, s -> s.id)
            .index("status", IndexedField.Kind.TEXT, s -> s.status)
            .index("weight", IndexedField.Kind.NUMBER, s -> s.weight)
            .index("sent", IndexedField.Kind.TIMESTAMP, s -> s.sent)
            .build();

    @Test
    public void type_name_defaults_to_simple_class_name() {
        assertEquals("Shipment", mapping.getTypeName());
        assertEquals("Parcel", DocumentMapping.builder(Shipment.class, s -> s.id).typeName("Parcel").build()
            .getTypeName());
    }

    @Test
    public void index_values_are_normalized() {
        Shipment shipment = new Shipment("s1", Status.SHIPPED, 2.5, Instant.ofEpochMilli(1000));
        assertEquals("SHIPPED", mapping.requireIndex("status").indexValueOf(shipment));
        assertThat((BigDecimal) mapping.requireIndex("weight").indexValueOf(shipment),
            comparesEqualTo(new BigDecimal("2.5")));
        assertThat((BigDecimal) mapping.requireIndex("sent").indexValueOf(shipment),
            comparesEqualTo(BigDecimal.valueOf(1000)));
        assertNull(mapping.requireIndex("sent").indexValueOf(new Shipment("s2", Status.PENDING, 1, null)));
    }

    @Test
    public void long_text_is_indexed_by_prefix() {
        StringBuilder text = new StringBuilder();
        while (text.length() <= IndexedField.MAX_TEXT_LENGTH) {
            text.append("abcdefghij");
        }
        Object indexed = mapping.requireIndex("status").toIndexValue(text.toString());
        assertEquals(text.substring(0, IndexedField.MAX_TEXT_LENGTH), indexed);
    }

    @Test(expected = IllegalArgumentException.class)
    public void undeclared_field_is_rejected() {
        mapping.requireIndex("owner");
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrong_kind_of_value_is_rejected() {
        mapping.requireIndex("weight").toIndexValue("heavy");
    }

    @Test(expected = IllegalArgumentException.class)
    public void document_needs_identity() {
        mapping.idOf(new Shipment(null, Status.PENDING, 0, null));
    }

    @Test
    public void subclass_uses_mapping_of_closest_supertype() {
        DocumentMappings mappings = new DocumentMappings().register(mapping);
        Optional<DocumentMapping<? super ExpressShipment>> found = mappings.mappingFor(ExpressShipment.class);
        assertSame(mapping, found.get());
        assertFalse(mappings.mappingFor(String.class).isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_name_is_unique_across_classes() {
        new DocumentMappings().register(mapping)
                .register(DocumentMapping.builder(ExpressShipment.class, s -> s.id).typeName("Shipment").build());
    }

    @Test
    public void filters_combine_into_comparisons() {
        Filter filter = Filter.eq("status", Status.SHIPPED).and(Filter.between("weight", 1, 5));
        assertThat(filter.comparisons(), hasSize(3));
        assertEquals(Filter.Operator.GE, filter.comparisons().get(1).getOperator());
        assertThat(Filter.all().comparisons(), empty());
        assertThat(Filter.all().and(Filter.all()).comparisons(), empty());
    }
}
