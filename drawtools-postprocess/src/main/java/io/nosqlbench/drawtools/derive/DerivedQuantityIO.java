/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.drawtools.derive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/// Discovers [DerivedQuantity] implementations through [ServiceLoader].
///
/// ```java
/// List<DerivedQuantity> all = DerivedQuantityIO.getAll();
/// Optional<DerivedQuantity> xi = DerivedQuantityIO.get("xi");
/// ```
public final class DerivedQuantityIO {

    private static final ServiceLoader<DerivedQuantity> serviceLoader =
        ServiceLoader.load(DerivedQuantity.class);

    private DerivedQuantityIO() {
    }

    /// @param name the [QuantityName] value, or the target class when unannotated
    /// @return a new instance of the quantity, or empty if none is registered
    public static synchronized Optional<DerivedQuantity> get(String name) {
        return providers()
            .filter(provider -> name.equals(nameOf(provider)))
            .findFirst()
            .map(ServiceLoader.Provider::get);
    }

    /// @return new instances of all registered quantities
    public static synchronized List<DerivedQuantity> getAll() {
        List<DerivedQuantity> result = new ArrayList<>();
        providers().forEach(provider -> result.add(provider.get()));
        return result;
    }

    public static synchronized List<String> getAvailableNames() {
        return providers().map(DerivedQuantityIO::nameOf).toList();
    }

    public static synchronized void reload() {
        serviceLoader.reload();
    }

    private static Stream<ServiceLoader.Provider<DerivedQuantity>> providers() {
        return serviceLoader.stream();
    }

    private static String nameOf(ServiceLoader.Provider<DerivedQuantity> provider) {
        QuantityName annotation = provider.type().getAnnotation(QuantityName.class);
        if (annotation != null) {
            return annotation.value();
        }
        return provider.get().targetClass();
    }
}
