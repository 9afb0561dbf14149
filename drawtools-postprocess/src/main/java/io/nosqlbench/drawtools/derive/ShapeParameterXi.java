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

/// Shape parameter `xi` of the generalized extreme value family.
///
/// The backend samples an unconstrained `tmp_xi` because the admissible
/// range of `xi` depends on the data. For each draw:
///
/// ```text
///   z_n = (y_n - mu_n) / sigma_n
///   a = -1 / min(z),  b = -1 / max(z)
///   lb = min(a, b),   ub = max(a, b)
///   xi = inv_logit(tmp_xi) * (ub - lb) + lb
/// ```
///
/// A draw whose smallest or largest standardized residual is exactly zero
/// has an unbounded side, and its `xi` is `NaN`. Such draws are kept as
/// `NaN` rather than rejected, so callers summarizing `xi` should expect them.
@QuantityName("xi")
public class ShapeParameterXi implements DerivedQuantity {

    @Override
    public String sourceClass() {
        return "tmp_xi";
    }

    @Override
    public String targetClass() {
        return "xi";
    }

    @Override
    public double[] compute(double[] unconstrained, ResponsePredictions predictions) {
        if (unconstrained.length != predictions.drawCount()) {
            throw new IllegalArgumentException("Got " + unconstrained.length + " draws of " + sourceClass()
                + " but predictions for " + predictions.drawCount() + " draws");
        }
        if (predictions.observationCount() == 0) {
            throw new IllegalArgumentException("No observations to bound " + targetClass());
        }
        double[] y = predictions.y();
        double[] xi = new double[unconstrained.length];
        for (int d = 0; d < xi.length; d++) {
            double[] mu = predictions.mu()[d];
            double[] sigma = predictions.sigma()[d];
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int n = 0; n < y.length; n++) {
                double z = (y[n] - mu[n]) / sigma[n];
                min = Math.min(min, z);
                max = Math.max(max, z);
            }
            double a = -1.0 / min;
            double b = -1.0 / max;
            double lb = Math.min(a, b);
            double ub = Math.max(a, b);
            xi[d] = invLogit(unconstrained[d]) * (ub - lb) + lb;
        }
        return xi;
    }

    static double invLogit(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
