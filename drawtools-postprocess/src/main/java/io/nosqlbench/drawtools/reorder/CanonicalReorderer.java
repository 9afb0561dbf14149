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

package io.nosqlbench.drawtools.reorder;

import io.nosqlbench.drawtools.store.Parameter;
import io.nosqlbench.drawtools.store.ParameterIndex;
import io.nosqlbench.drawtools.store.SampleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// Permutes a [SampleStore] into canonical presentation order.
///
/// ## Algorithm
///
/// ```text
///  parameters ──► (class rank, intercept placement, original position) ──► stable sort
///        │
///        ▼
///  columns laid out parameter by parameter, original order within a parameter
///        │
///        ▼
///  one column permutation, applied to the name table and every chain
/// ```
///
/// Whole columns move, so per-column attributes travel with their values.
/// Unknown classes keep their relative order after all known classes.
public class CanonicalReorderer {

    private static final Logger logger = LogManager.getLogger(CanonicalReorderer.class);

    private final ParameterClasses classes;
    private final boolean interceptsFirst;
    private final boolean parallel;

    public CanonicalReorderer(List<String> distributionalParameters) {
        this(distributionalParameters, true, false);
    }

    /// @param distributionalParameters the model's distributional parameter classes
    /// @param interceptsFirst place intercept-type parameters before the other
    ///        parameters of their class, otherwise after them
    /// @param parallel mutate chains concurrently
    public CanonicalReorderer(List<String> distributionalParameters, boolean interceptsFirst, boolean parallel) {
        this.classes = new ParameterClasses(Objects.requireNonNull(distributionalParameters,
            "distributionalParameters cannot be null"));
        this.interceptsFirst = interceptsFirst;
        this.parallel = parallel;
    }

    private record SortKey(int rank, int placement, int sequence) {
        static final Comparator<SortKey> ORDER = Comparator.comparingInt(SortKey::rank)
            .thenComparingInt(SortKey::placement)
            .thenComparingInt(SortKey::sequence);
    }

    private record Ranked(Parameter parameter, SortKey key) {
    }

    /// @return the store with parameters in canonical order
    public SampleStore reorder(SampleStore store) {
        Objects.requireNonNull(store, "store cannot be null");
        List<String> names = store.flatNames();

        Map<String, List<Integer>> columnsByParameter = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columnsByParameter.computeIfAbsent(ParameterIndex.baseName(names.get(i)), k -> new ArrayList<>()).add(i);
        }
        List<Parameter> parameters = store.parameters();
        Set<String> indexed = parameters.stream().map(Parameter::name).collect(Collectors.toSet());
        if (parameters.size() != columnsByParameter.size() || !indexed.equals(columnsByParameter.keySet())) {
            logger.debug("Parameter index does not describe the name table, rebuilding it");
            parameters = ParameterIndex.fromFlatNames(names);
        }

        List<Ranked> ranked = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            int rank = classes.rank(ParameterClasses.classOf(parameter.name()));
            boolean intercept = ParameterClasses.isIntercept(parameter.name());
            int placement = intercept == interceptsFirst ? 0 : 1;
            ranked.add(new Ranked(parameter, new SortKey(rank, placement, i)));
        }
        ranked.sort(Comparator.comparing(Ranked::key, SortKey.ORDER));

        int[] order = new int[names.size()];
        int k = 0;
        List<Parameter> newParameters = new ArrayList<>(ranked.size());
        List<String> newNames = new ArrayList<>(names.size());
        for (Ranked r : ranked) {
            newParameters.add(r.parameter());
            for (int column : columnsByParameter.get(r.parameter().name())) {
                order[k++] = column;
                newNames.add(names.get(column));
            }
        }
        logger.debug("Reordered {} parameters ({} columns) across {} chains",
            newParameters.size(), order.length, store.chainCount());
        return store.mapChains(newNames, newParameters, chain -> chain.reordered(order), parallel);
    }

    public ParameterClasses classes() {
        return classes;
    }
}
