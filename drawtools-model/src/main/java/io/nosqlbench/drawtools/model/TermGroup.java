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

/// One group of model terms sharing a parameter naming family.
///
/// ## Purpose
///
/// A fitted model is described as a tree of nodes, each carrying zero or
/// more term groups. A term group lists the labels the sampling backend
/// never saw: predictor names, grouping factor levels, smooth labels and
/// so on. Each variant is a record with exactly the fields its renaming
/// rule needs, and [#kind()] names the variant so that consumers can
/// dispatch over it with a `switch`.
///
/// ## Variants
///
/// | Variant                     | Kind                  |
/// |-----------------------------|-----------------------|
/// | [FixedEffects]              | [TermKind#FIXED]      |
/// | [SpecialEffects]            | [TermKind#SPECIAL]    |
/// | [CategorySpecificEffects]   | [TermKind#CATEGORY_SPECIFIC] |
/// | [Smooths]                   | [TermKind#SMOOTH]     |
/// | [GaussianProcesses]         | [TermKind#GAUSSIAN_PROCESS] |
/// | [Autocorrelation]           | [TermKind#AUTOCORRELATION] |
/// | [GroupLevelEffects]         | [TermKind#GROUP_LEVEL] |
/// | [Thresholds]                | [TermKind#THRESHOLDS] |
/// | [HazardBaseline]            | [TermKind#HAZARD_BASELINE] |
/// | [MeasurementError]          | [TermKind#MEASUREMENT_ERROR] |
/// | [MissingValues]             | [TermKind#MISSING_VALUES] |
/// | [FamilyCorrelation]         | [TermKind#FAMILY_CORRELATION] |
/// | [ResidualCorrelation]       | [TermKind#RESIDUAL_CORRELATION] |
///
/// @see TermGroupTypeAdapterFactory
public sealed interface TermGroup
    permits FixedEffects, SpecialEffects, CategorySpecificEffects, Smooths,
    GaussianProcesses, Autocorrelation, GroupLevelEffects, Thresholds,
    HazardBaseline, MeasurementError, MissingValues, FamilyCorrelation,
    ResidualCorrelation {

    /// @return the variant tag of this group
    TermKind kind();
}
