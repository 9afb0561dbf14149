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

package io.nosqlbench.drawtools;

import io.nosqlbench.drawtools.config.PostprocessConfig;
import io.nosqlbench.drawtools.derive.DerivedQuantity;
import io.nosqlbench.drawtools.derive.DerivedQuantityIO;
import io.nosqlbench.drawtools.derive.DerivedQuantitySynthesizer;
import io.nosqlbench.drawtools.derive.PredictionException;
import io.nosqlbench.drawtools.derive.PredictionProvider;
import io.nosqlbench.drawtools.derive.SynthesisResult;
import io.nosqlbench.drawtools.model.ModelDescription;
import io.nosqlbench.drawtools.rename.RenameExecutor;
import io.nosqlbench.drawtools.rename.RenamePlan;
import io.nosqlbench.drawtools.rename.RenamePlanBuilder;
import io.nosqlbench.drawtools.rename.RenameReport;
import io.nosqlbench.drawtools.reorder.CanonicalReorderer;
import io.nosqlbench.drawtools.store.SampleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Turns the raw draws of a sampling backend into labelled, ordered draws.
///
/// ## Pipeline
///
/// ```text
///  raw store ──► snapshot previous order
///            ──► build rename plan (model description + name table)
///            ──► execute plan
///            ──► repair parameter index
///            ──► canonical reordering
///            ──► derived quantities (optional)
///            ──► PostprocessResult
/// ```
///
/// Every step is a `SampleStore -> SampleStore` function; the input store
/// is never modified. A store without chains is returned unchanged.
///
/// ## Usage
///
/// ```java
/// DrawPostprocessor postprocessor = new DrawPostprocessor(PostprocessConfig.defaults(), predictions);
/// PostprocessResult result = postprocessor.process(description, rawStore);
/// SampleStore labelled = result.store();
/// ```
public class DrawPostprocessor {

    private static final Logger logger = LogManager.getLogger(DrawPostprocessor.class);

    /// Provider for models without derived quantities.
    public static final PredictionProvider NO_PREDICTIONS = store -> {
        throw new PredictionException("No prediction provider configured");
    };

    private final PostprocessConfig config;
    private final PredictionProvider predictions;
    private final List<DerivedQuantity> quantities;

    public DrawPostprocessor() {
        this(PostprocessConfig.defaults(), NO_PREDICTIONS);
    }

    public DrawPostprocessor(PostprocessConfig config, PredictionProvider predictions) {
        this(config, predictions, DerivedQuantityIO.getAll());
    }

    /// @param config pipeline settings
    /// @param predictions source of fitted predictions for derived quantities
    /// @param quantities the derived quantities to synthesize
    public DrawPostprocessor(PostprocessConfig config, PredictionProvider predictions,
                             List<DerivedQuantity> quantities) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.predictions = Objects.requireNonNull(predictions, "predictions cannot be null");
        this.quantities = List.copyOf(quantities);
    }

    /// Runs the pipeline.
    ///
    /// @param description the model description
    /// @param raw the store with backend names
    /// @return the final store and the step reports
    /// @throws io.nosqlbench.drawtools.rename.RenameMismatchException in strict mode
    public PostprocessResult process(ModelDescription description, SampleStore raw) {
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(raw, "raw cannot be null");
        if (raw.isEmpty()) {
            logger.debug("Store has no chains, nothing to post-process");
            return new PostprocessResult(raw, RenameReport.empty(), List.of(), List.of());
        }

        SampleStore store = raw.withPreviousOrder();
        RenamePlan plan = new RenamePlanBuilder(config.getWhitespaceFiller()).build(description, store.flatNames());
        RenameExecutor.Outcome renamed = new RenameExecutor(config.isStrictRenaming(), config.isParallelChains())
            .execute(store, plan);
        store = renamed.store().withRepairedIndex();

        store = new CanonicalReorderer(description.distributionalParameters(),
            config.isInterceptsFirst(), config.isParallelChains()).reorder(store);

        List<String> synthesized = List.of();
        List<String> skipped = List.of();
        if (config.isDerivedQuantities()) {
            SynthesisResult synthesis = new DerivedQuantitySynthesizer(quantities, predictions).synthesize(store);
            store = synthesis.store();
            synthesized = synthesis.synthesized();
            skipped = synthesis.skipped();
        }
        logger.debug("Post-processed {} columns into {} columns across {} chains",
            raw.flatCount(), store.flatCount(), store.chainCount());
        return new PostprocessResult(store, renamed.report(), synthesized, skipped);
    }

    public PostprocessConfig config() {
        return config;
    }
}
