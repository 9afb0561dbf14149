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

import io.nosqlbench.drawtools.store.SampleStore;

/// Computes fitted predictions from the renamed draws.
///
/// Evaluating linear predictors is outside this library; callers supply an
/// implementation backed by their model code.
@FunctionalInterface
public interface PredictionProvider {

    /// Prepares predictions for a store.
    ///
    /// @param store the renamed and reordered store
    /// @return predictions for the responses of the model
    /// @throws PredictionException if the model state does not allow prediction
    Predictions prepare(SampleStore store) throws PredictionException;
}
