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

import io.nosqlbench.drawtools.rename.NamePattern;
import io.nosqlbench.drawtools.store.Chain;
import io.nosqlbench.drawtools.store.ParameterIndex;
import io.nosqlbench.drawtools.store.SampleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Appends derived quantities that the backend does not emit.
///
/// ## Flow
///
/// ```text
///  tmp_xi_y ──► kept draws ──┐
///                            ├─► DerivedQuantity.compute ──► split per chain ──► zero warmup prefix ──► xi_y
///  predictions(y) ───────────┘
/// ```
///
/// ## Failure
///
/// A quantity whose predictions cannot be obtained, or whose computation
/// rejects its inputs, is logged at warn level and skipped. Columns are only
/// appended once fully computed, so a failure never leaves a partial
/// column behind. A target column that already exists is left as it is.
public class DerivedQuantitySynthesizer {

    private static final Logger logger = LogManager.getLogger(DerivedQuantitySynthesizer.class);

    private final List<DerivedQuantity> quantities;
    private final PredictionProvider provider;

    /// Uses all quantities registered with [DerivedQuantityIO].
    public DerivedQuantitySynthesizer(PredictionProvider provider) {
        this(DerivedQuantityIO.getAll(), provider);
    }

    public DerivedQuantitySynthesizer(List<DerivedQuantity> quantities, PredictionProvider provider) {
        this.quantities = List.copyOf(quantities);
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    }

    private record Pending(DerivedQuantity quantity, String source, String target, String response) {
    }

    /// @param store the renamed and reordered store
    /// @return the store with synthesized columns and what was skipped
    public SynthesisResult synthesize(SampleStore store) {
        Objects.requireNonNull(store, "store cannot be null");
        List<Pending> pending = new ArrayList<>();
        for (DerivedQuantity quantity : quantities) {
            NamePattern pattern = NamePattern.of(quantity.sourceClass(), NamePattern.Boundary.UNDERSCORE_OR_END);
            for (String name : store.flatNames()) {
                if (!pattern.matches(name) || !ParameterIndex.baseName(name).equals(name)) {
                    continue;
                }
                String suffix = name.substring(quantity.sourceClass().length());
                String target = quantity.targetClass() + suffix;
                if (store.contains(target)) {
                    logger.debug("{} is already present, not recomputing it", target);
                    continue;
                }
                String response = suffix.isEmpty() ? "" : suffix.substring(1);
                pending.add(new Pending(quantity, name, target, response));
            }
        }
        if (pending.isEmpty()) {
            return new SynthesisResult(store, List.of(), List.of());
        }

        Predictions predictions;
        try {
            predictions = Objects.requireNonNull(provider.prepare(store), "provider returned no predictions");
        } catch (PredictionException | RuntimeException e) {
            logger.warn("Cannot compute derived quantities {}: {}",
                pending.stream().map(Pending::target).toList(), e.getMessage());
            return new SynthesisResult(store, List.of(), pending.stream().map(Pending::target).toList());
        }

        SampleStore current = store;
        List<String> synthesized = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Pending p : pending) {
            try {
                ResponsePredictions fitted = Objects.requireNonNull(predictions.forResponse(p.response()),
                    "no predictions for response '" + p.response() + "'");
                double[] kept = p.quantity().compute(current.keptDraws(p.source()), fitted);
                current = current.withAppendedColumn(p.target(), splitByChain(current, kept), Map.of());
                synthesized.add(p.target());
                logger.debug("Synthesized {} from {}", p.target(), p.source());
            } catch (PredictionException | RuntimeException e) {
                logger.warn("Skipping derived quantity {}: {}", p.target(), e.getMessage());
                skipped.add(p.target());
            }
        }
        return new SynthesisResult(current, synthesized, skipped);
    }

    /// Splits kept draws into full-length per-chain columns whose warmup
    /// segment is zero.
    static List<double[]> splitByChain(SampleStore store, double[] kept) {
        if (kept.length != store.keptDrawCount()) {
            throw new IllegalArgumentException("Computed " + kept.length + " draws, store keeps "
                + store.keptDrawCount());
        }
        List<double[]> perChain = new ArrayList<>(store.chainCount());
        int offset = 0;
        for (Chain chain : store.chains()) {
            double[] values = new double[chain.drawCount()];
            System.arraycopy(kept, offset, values, chain.warmup(), chain.keptDraws());
            offset += chain.keptDraws();
            perChain.add(values);
        }
        return perChain;
    }
}
