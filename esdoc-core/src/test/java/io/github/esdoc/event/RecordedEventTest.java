package io.github.esdoc.event;

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

import java.time.Instant;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;


public class RecordedEventTest {
    private final Instant recordedAt = Instant.ofEpochMilli(1000);
    private final RecordedEvent<Object> recorded = new RecordedEvent<>(7, "acc-1", 2, "Deposited", 15, recordedAt);

    @Test
    public void typed_view_keeps_position_and_data() {
        RecordedEvent<Integer> typed = recorded.as(Integer.class);
        assertEquals(7, typed.getSequence());
        assertEquals("acc-1", typed.getStreamId());
        assertEquals(2, typed.getVersion());
        assertEquals("Deposited", typed.getType());
        assertEquals(15, typed.getData().intValue());
        assertSame(recordedAt, typed.getRecordedAt());
        assertSame(recorded.getData(), recorded.as(Number.class).getData());
    }

    @Test(expected = ClassCastException.class)
    public void typed_view_of_other_class_is_rejected() {
        recorded.as(String.class);
    }
}
