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

package io.nosqlbench.drawtools.rename;

import io.nosqlbench.drawtools.store.Chain;
import io.nosqlbench.drawtools.store.SampleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Applies a [RenamePlan] to a [SampleStore].
///
/// ## Phases
///
/// 1. **Planning** (single writer): every operation is resolved against the
///    name table. Masks were computed on the backend names, so positions are
///    stable while the replacement names accumulate into a new table.
///    Value permutations are collected in plan order.
/// 2. **Fan-out**: each chain gets the same permutations and the new name
///    table. Chains share nothing, so this runs on the common pool when
///    parallel execution is enabled.
///
/// ## Mismatches
///
/// An operation providing fewer or more names than it matched renames only
/// the first `min(matched, provided)` matched columns. The mismatch is
/// logged at warn level and reported, or raised as a
/// [RenameMismatchException] in strict mode.
///
/// The parameter index of the returned store still describes the input
/// names; call [SampleStore#withRepairedIndex()] afterwards.
public class RenameExecutor {

    private static final Logger logger = LogManager.getLogger(RenameExecutor.class);

    private final boolean strict;
    private final boolean parallel;

    public RenameExecutor() {
        this(false, false);
    }

    /// @param strict throw on replacement/match-count mismatch
    /// @param parallel mutate chains concurrently
    public RenameExecutor(boolean strict, boolean parallel) {
        this.strict = strict;
        this.parallel = parallel;
    }

    /// Result of executing a plan.
    public record Outcome(SampleStore store, RenameReport report) {
    }

    /// @return the renamed store
    public SampleStore apply(SampleStore store, RenamePlan plan) {
        return execute(store, plan).store();
    }

    /// Renames the store and reports what happened.
    ///
    /// @param store the store with backend names
    /// @param plan operations computed on the store's current names
    /// @return the renamed store and a report
    /// @throws RenameMismatchException in strict mode, before any chain is touched
    public Outcome execute(SampleStore store, RenamePlan plan) {
        Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(plan, "plan cannot be null");

        List<String> names = new ArrayList<>(store.flatNames());
        List<int[][]> permutations = new ArrayList<>();
        List<RenameReport.Mismatch> mismatches = new ArrayList<>();
        int applied = 0;
        int noOps = 0;

        List<RenameOperation> operations = plan.operations();
        for (int i = 0; i < operations.size(); i++) {
            RenameOperation op = operations.get(i);
            if (op.isNoOp()) {
                noOps++;
                continue;
            }
            int[] positions = op.positions();
            if (positions.length > 0 && positions[positions.length - 1] >= names.size()) {
                throw new IllegalArgumentException("Rename operation " + i + " selects position "
                    + positions[positions.length - 1] + " of " + names.size() + " columns");
            }
            if (op.isMismatched()) {
                if (strict) {
                    throw new RenameMismatchException(i, op.matchCount(), op.names().size());
                }
                logger.warn("Rename operation {} matched {} columns but provides {} names; renaming the first {}",
                    i, op.matchCount(), op.names().size(), Math.min(op.matchCount(), op.names().size()));
                mismatches.add(new RenameReport.Mismatch(i, op.matchCount(), op.names().size()));
            }
            int renamed = Math.min(positions.length, op.names().size());
            for (int k = 0; k < renamed; k++) {
                names.set(positions[k], op.names().get(k));
            }
            int index = i;
            op.sort().ifPresent(sort -> {
                if (isPermutation(sort, positions.length)) {
                    permutations.add(new int[][]{positions, sort});
                } else {
                    logger.warn("Rename operation {} has an invalid value order {} for {} columns; values left in place",
                        index, Arrays.toString(sort), positions.length);
                }
            });
            applied++;
        }
        logger.debug("Applied {} rename operations ({} no-op, {} mismatched) to {} chains",
            applied, noOps, mismatches.size(), store.chainCount());

        if (applied == 0) {
            return new Outcome(store, new RenameReport(0, noOps, mismatches));
        }
        int[] all = new int[names.size()];
        Arrays.setAll(all, k -> k);
        List<String> table = List.copyOf(names);
        SampleStore renamed = store.mapChains(table, store.parameters(), chain -> {
            Chain current = chain;
            for (int[][] permutation : permutations) {
                current = current.permuted(permutation[0], permutation[1]);
            }
            return current.renamed(all, table);
        }, parallel);
        return new Outcome(renamed, new RenameReport(applied, noOps, mismatches));
    }

    static boolean isPermutation(int[] sort, int size) {
        if (sort.length != size) {
            return false;
        }
        boolean[] seen = new boolean[size];
        for (int k : sort) {
            if (k < 0 || k >= size || seen[k]) {
                return false;
            }
            seen[k] = true;
        }
        return true;
    }
}
