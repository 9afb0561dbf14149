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

package io.nosqlbench.drawtools.model;

/// Discriminator for the [TermGroup] variants.
///
/// ## Traversal Order
///
/// The declaration order of the constants is the order in which the rename
/// plan visits term groups:
///
/// ```
///  fixed → special → category-specific → smooth → gaussian process
///    → autocorrelation → group-level → thresholds → hazard baseline
///    → measurement error → missing values → family / residual correlation
/// ```
///
/// ## Scope
///
/// Each kind lives at exactly one level of the [ModelDescription] tree:
///
/// | Scope     | Holder            | Kinds                                          |
/// |-----------|-------------------|------------------------------------------------|
/// | PREDICTOR | [PredictorNode]   | fixed, special, category-specific, smooth, gp, autocorrelation |
/// | RESPONSE  | [ResponseNode]    | thresholds, hazard baseline, missing values, family correlation |
/// | MODEL     | [ModelDescription]| group-level, measurement error, residual correlation |
public enum TermKind {

    FIXED("fixed", Scope.PREDICTOR, FixedEffects.class),
    SPECIAL("special", Scope.PREDICTOR, SpecialEffects.class),
    CATEGORY_SPECIFIC("category_specific", Scope.PREDICTOR, CategorySpecificEffects.class),
    SMOOTH("smooth", Scope.PREDICTOR, Smooths.class),
    GAUSSIAN_PROCESS("gaussian_process", Scope.PREDICTOR, GaussianProcesses.class),
    AUTOCORRELATION("autocorrelation", Scope.PREDICTOR, Autocorrelation.class),
    GROUP_LEVEL("group_level", Scope.MODEL, GroupLevelEffects.class),
    THRESHOLDS("thresholds", Scope.RESPONSE, Thresholds.class),
    HAZARD_BASELINE("hazard_baseline", Scope.RESPONSE, HazardBaseline.class),
    MEASUREMENT_ERROR("measurement_error", Scope.MODEL, MeasurementError.class),
    MISSING_VALUES("missing_values", Scope.RESPONSE, MissingValues.class),
    FAMILY_CORRELATION("family_correlation", Scope.RESPONSE, FamilyCorrelation.class),
    RESIDUAL_CORRELATION("residual_correlation", Scope.MODEL, ResidualCorrelation.class);

    /// Tree level a term group kind is attached to.
    public enum Scope {
        PREDICTOR,
        RESPONSE,
        MODEL
    }

    private final String jsonName;
    private final Scope scope;
    private final Class<? extends TermGroup> type;

    TermKind(String jsonName, Scope scope, Class<? extends TermGroup> type) {
        this.jsonName = jsonName;
        this.scope = scope;
        this.type = type;
    }

    /// @return the name used for the `kind` field in JSON model descriptions
    public String getJsonName() {
        return jsonName;
    }

    public Scope getScope() {
        return scope;
    }

    public Class<? extends TermGroup> getType() {
        return type;
    }

    /// Looks up a kind by its JSON name.
    ///
    /// @param jsonName the value of a `kind` field
    /// @return the matching kind
    /// @throws IllegalArgumentException if no kind has that name
    public static TermKind fromJsonName(String jsonName) {
        for (TermKind kind : values()) {
            if (kind.jsonName.equals(jsonName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown term group kind: " + jsonName);
    }
}
