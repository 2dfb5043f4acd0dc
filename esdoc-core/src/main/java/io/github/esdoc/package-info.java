/**
 * Embedded event store and document store sharing one relational database.
 *
 * <p>{@link io.github.esdoc.EventSourcedStore} is the entry point. Events are appended to streams through
 * {@link io.github.esdoc.event.EventStore}, read back through {@link io.github.esdoc.event.EventLog} and folded into
 * aggregate state by {@link io.github.esdoc.aggregate.AggregateRebuilder}. Inline
 * {@link io.github.esdoc.projection.Projection projections} turn appended events into documents within the append
 * transaction, and {@link io.github.esdoc.document.DocumentStore} stores and queries documents with optimistic
 * concurrency.</p>
 */
package io.github.esdoc;

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
