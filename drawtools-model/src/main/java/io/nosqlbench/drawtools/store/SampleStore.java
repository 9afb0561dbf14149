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

package io.nosqlbench.drawtools.store;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/// In-memory table of named draw columns, replicated per chain.
///
/// ## Layout
///
/// ```text
/// ┌────────────────────────────────────────────────────────────────┐
/// │ flat names:  b_Intercept   b_x1   sd_site__Intercept   lp__     │
/// ├────────────────────────────────────────────────────────────────┤
/// │ chain 1:     [w.., k..]    [..]   [..]                 [..]     │
/// │ chain 2:     [w.., k..]    [..]   [..]                 [..]     │
/// └────────────────────────────────────────────────────────────────┘
///   w = saved warmup draws, k = kept draws
/// ```
///
/// ## Invariants
///
/// - every chain has one column per flat name, named identically and in
///   the same order
/// - flat names are unique
/// - within a chain all columns have the same length
/// - the parameter index covers the flat names
///
/// Stores are immutable. Every transformation returns a new store, so the
/// post-processing steps compose as plain functions.
public final class SampleStore {

    private final List<String> flatNames;
    private final List<Parameter> parameters;
    private final List<Chain> chains;
    private final PreviousOrder previousOrder;

    private SampleStore(List<String> flatNames, List<Parameter> parameters, List<Chain> chains,
                        PreviousOrder previousOrder) {
        this.flatNames = List.copyOf(flatNames);
        this.parameters = List.copyOf(parameters);
        this.chains = List.copyOf(chains);
        this.previousOrder = previousOrder;
        validate();
    }

    /// Creates a store whose name table and parameter index are taken from the chains.
    ///
    /// @param chains the chains, possibly none
    /// @throws IllegalArgumentException if the chains disagree on their column names
    public static SampleStore of(List<Chain> chains) {
        Objects.requireNonNull(chains, "chains cannot be null");
        List<String> names = chains.isEmpty() ? List.of() : chains.get(0).names();
        return new SampleStore(names, ParameterIndex.fromFlatNames(names), chains, null);
    }

    public static SampleStore of(Chain... chains) {
        return of(List.of(chains));
    }

    public static SampleStore empty() {
        return of(List.of());
    }

    private void validate() {
        Set<String> seen = new HashSet<>();
        for (String name : flatNames) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate flat name: " + name);
            }
        }
        for (int c = 0; c < chains.size(); c++) {
            Chain chain = chains.get(c);
            if (!chain.names().equals(flatNames)) {
                throw new IllegalArgumentException("Chain " + (c + 1) + " columns " + chain.names()
                    + " do not match the name table " + flatNames);
            }
        }
    }

    public List<String> flatNames() {
        return flatNames;
    }

    /// @return the number of flat columns
    public int flatCount() {
        return flatNames.size();
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<Chain> chains() {
        return chains;
    }

    public int chainCount() {
        return chains.size();
    }

    /// @return true if nothing was sampled
    public boolean isEmpty() {
        return chains.isEmpty();
    }

    public Optional<PreviousOrder> previousOrder() {
        return Optional.ofNullable(previousOrder);
    }

    public boolean contains(String flatName) {
        return flatNames.contains(flatName);
    }

    public int indexOf(String flatName) {
        return flatNames.indexOf(flatName);
    }

    /// Concatenates the post-warmup draws of one column across all chains,
    /// chain by chain.
    ///
    /// @param flatName the column name
    /// @return kept draws of all chains
    /// @throws IllegalArgumentException if the column does not exist
    public double[] keptDraws(String flatName) {
        int index = indexOf(flatName);
        if (index < 0) {
            throw new IllegalArgumentException("No column named " + flatName);
        }
        int total = chains.stream().mapToInt(Chain::keptDraws).sum();
        double[] draws = new double[total];
        int offset = 0;
        for (Chain chain : chains) {
            double[] tail = chain.column(index).tail(chain.warmup());
            System.arraycopy(tail, 0, draws, offset, tail.length);
            offset += tail.length;
        }
        return draws;
    }

    /// @return total kept draws across all chains
    public int keptDrawCount() {
        return chains.stream().mapToInt(Chain::keptDraws).sum();
    }

    /// Records the current layout as the previous order.
    public SampleStore withPreviousOrder() {
        return new SampleStore(flatNames, parameters, chains, new PreviousOrder(parameters, flatNames));
    }

    /// Recomputes the parameter index from the current flat names.
    public SampleStore withRepairedIndex() {
        return new SampleStore(flatNames, ParameterIndex.fromFlatNames(flatNames), chains, previousOrder);
    }

    /// Replaces names and chains in one step. Used by the renaming and
    /// reordering steps, which compute the name table once and apply it to
    /// every chain.
    ///
    /// @param newFlatNames the new name table
    /// @param newParameters the parameter index matching the new name table
    /// @param newChains chains whose columns match the new name table
    public SampleStore withLayout(List<String> newFlatNames, List<Parameter> newParameters, List<Chain> newChains) {
        return new SampleStore(newFlatNames, newParameters, newChains, previousOrder);
    }

    /// Applies the same chain transformation to every chain.
    public SampleStore mapChains(List<String> newFlatNames, List<Parameter> newParameters,
                                 UnaryOperator<Chain> transform, boolean parallel) {
        return withLayout(newFlatNames, newParameters, Chains.map(chains, transform, parallel));
    }

    /// Appends a new scalar column to every chain and registers it in the
    /// name table and parameter index.
    ///
    /// @param name the new column name
    /// @param perChainValues full-length values for each chain, warmup segment included
    /// @param attributes attributes of the new column
    /// @throws IllegalArgumentException if the name exists or a chain's values have the wrong length
    public SampleStore withAppendedColumn(String name, List<double[]> perChainValues, Map<String, String> attributes) {
        if (contains(name)) {
            throw new IllegalArgumentException("Column already exists: " + name);
        }
        if (perChainValues.size() != chains.size()) {
            throw new IllegalArgumentException("Expected values for " + chains.size() + " chains, got "
                + perChainValues.size());
        }
        List<Chain> updated = new ArrayList<>(chains.size());
        for (int c = 0; c < chains.size(); c++) {
            Chain chain = chains.get(c);
            double[] values = perChainValues.get(c);
            if (!chain.columns().isEmpty() && values.length != chain.drawCount()) {
                throw new IllegalArgumentException("Chain " + (c + 1) + " needs " + chain.drawCount()
                    + " values for " + name + ", got " + values.length);
            }
            updated.add(chain.withColumn(new DrawColumn(name, values, attributes)));
        }
        List<String> names = new ArrayList<>(flatNames);
        names.add(name);
        List<Parameter> params = new ArrayList<>(parameters);
        params.add(Parameter.scalar(name));
        return new SampleStore(names, params, updated, previousOrder);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SampleStore other)) {
            return false;
        }
        return flatNames.equals(other.flatNames)
            && parameters.equals(other.parameters)
            && chains.equals(other.chains)
            && Objects.equals(previousOrder, other.previousOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flatNames, parameters, chains, previousOrder);
    }

    @Override
    public String toString() {
        return "SampleStore{chains=" + chains.size() + ", columns=" + flatNames.size() + "}";
    }
}
