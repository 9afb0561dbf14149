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

import java.util.List;
import java.util.function.UnaryOperator;

/// Fan-out of a per-chain transformation.
///
/// Chains are independent, so the transformation may run on the common
/// ForkJoin pool. Callers must compute anything shared between chains
/// (name tables, orderings) before fanning out; the transformation only
/// reads and writes its own chain.
public final class Chains {

    private Chains() {
    }

    /// @param chains the chains to transform
    /// @param transform the per-chain transformation
    /// @param parallel whether to run on the common ForkJoin pool
    /// @return transformed chains, in input order
    public static List<Chain> map(List<Chain> chains, UnaryOperator<Chain> transform, boolean parallel) {
        if (parallel && chains.size() > 1) {
            return chains.parallelStream().map(transform).toList();
        }
        return chains.stream().map(transform).toList();
    }
}
