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

/// A parameter that the sampling backend never emits but that can be
/// computed from an emitted unconstrained column and the fitted predictions.
///
/// ## Naming
///
/// The emitted column is `<sourceClass><suffix>` and the computed column
/// `<targetClass><suffix>`, where the suffix is empty for univariate models
/// and `_<response>` otherwise: `tmp_xi_y1` becomes `xi_y1`.
///
/// ## Registering
///
/// 1. Implement this interface with a public no-args constructor
/// 2. Add the [QuantityName] annotation
/// 3. List the class in `META-INF/services/io.nosqlbench.drawtools.derive.DerivedQuantity`
///
/// @see DerivedQuantityIO
/// @see DerivedQuantitySynthesizer
public interface DerivedQuantity {

    /// @return class of the emitted unconstrained column
    String sourceClass();

    /// @return class of the computed column
    String targetClass();

    /// Computes the quantity for every kept draw.
    ///
    /// @param unconstrained kept draws of the emitted column, chain by chain
    /// @param predictions fitted predictions for the response, one row per kept draw
    /// @return one value per kept draw
    /// @throws IllegalArgumentException if the inputs disagree in shape
    double[] compute(double[] unconstrained, ResponsePredictions predictions);
}
