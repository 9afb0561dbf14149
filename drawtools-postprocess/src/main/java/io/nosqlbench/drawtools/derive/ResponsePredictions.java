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

import java.util.Objects;

/// Fitted per-draw location and scale of one response, with its observed data.
///
/// Rows of `mu` and `sigma` are kept draws (chain by chain, in the same
/// order as [io.nosqlbench.drawtools.store.SampleStore#keptDraws(String)]),
/// columns are observations.
///
/// @param mu fitted location, `[draw][observation]`
/// @param sigma fitted scale, `[draw][observation]`
/// @param y observed response values
public record ResponsePredictions(double[][] mu, double[][] sigma, double[] y) {

    public ResponsePredictions {
        Objects.requireNonNull(mu, "mu cannot be null");
        Objects.requireNonNull(sigma, "sigma cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (mu.length != sigma.length) {
            throw new IllegalArgumentException("mu has " + mu.length + " draws but sigma has " + sigma.length);
        }
        for (int d = 0; d < mu.length; d++) {
            if (mu[d].length != y.length || sigma[d].length != y.length) {
                throw new IllegalArgumentException("Draw " + d + " does not have " + y.length + " observations");
            }
        }
    }

    public int drawCount() {
        return mu.length;
    }

    public int observationCount() {
        return y.length;
    }
}
