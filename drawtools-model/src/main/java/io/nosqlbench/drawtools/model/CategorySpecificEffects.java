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

import java.util.List;

/// Category-specific coefficients of an ordinal model.
///
/// @param coefficients coefficient labels
/// @param thresholds number of thresholds; when zero it is inferred from the
///                   `b_Intercept[...]` columns present in the draws
public record CategorySpecificEffects(List<String> coefficients, int thresholds) implements TermGroup {

    public CategorySpecificEffects {
        coefficients = Copies.list(coefficients);
        if (thresholds < 0) {
            throw new IllegalArgumentException("thresholds must be >= 0: " + thresholds);
        }
    }

    @Override
    public TermKind kind() {
        return TermKind.CATEGORY_SPECIFIC;
    }
}
