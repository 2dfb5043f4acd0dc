package io.github.esdoc.examples;

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
import io.github.esdoc.examples.bank.BankProjections;
import io.github.esdoc.examples.catalog.CatalogMappings;

/**
 * Everything the examples register with the store.
 */
public final class ExampleModel {
    private ExampleModel() {

    }

    public static StoreOptions.Builder register(StoreOptions.Builder options) {
        return CatalogMappings.register(BankProjections.register(options));
    }
}
