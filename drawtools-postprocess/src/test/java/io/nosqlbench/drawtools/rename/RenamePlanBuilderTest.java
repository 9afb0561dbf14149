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

import io.nosqlbench.drawtools.model.Autocorrelation;
import io.nosqlbench.drawtools.model.CategorySpecificEffects;
import io.nosqlbench.drawtools.model.FamilyCorrelation;
import io.nosqlbench.drawtools.model.FixedEffects;
import io.nosqlbench.drawtools.model.GaussianProcesses;
import io.nosqlbench.drawtools.model.GroupLevelEffects;
import io.nosqlbench.drawtools.model.HazardBaseline;
import io.nosqlbench.drawtools.model.MeasurementError;
import io.nosqlbench.drawtools.model.MissingValues;
import io.nosqlbench.drawtools.model.ModelDescription;
import io.nosqlbench.drawtools.model.PredictorNode;
import io.nosqlbench.drawtools.model.ResidualCorrelation;
import io.nosqlbench.drawtools.model.ResponseNode;
import io.nosqlbench.drawtools.model.Smooths;
import io.nosqlbench.drawtools.model.SpecialEffects;
import io.nosqlbench.drawtools.model.Thresholds;
import io.nosqlbench.drawtools.store.Chain;
import io.nosqlbench.drawtools.store.SampleStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class RenamePlanBuilderTest {

    /// One chain with one draw per column; column `i` holds the value `i`.
    private static SampleStore store(String... names) {
        Chain.Builder chain = Chain.builder();
        for (int i = 0; i < names.length; i++) {
            chain.column(names[i], i);
        }
        return SampleStore.of(chain.build());
    }

    /// Builds and applies the plan in strict mode, so any count mismatch fails the test.
    private static SampleStore rename(ModelDescription description, String... names) {
        SampleStore store = store(names);
        RenamePlan plan = new RenamePlanBuilder().build(description, store.flatNames());
        return new RenameExecutor(true, false).apply(store, plan);
    }

    private static List<String> renamed(ModelDescription description, String... names) {
        return rename(description, names).flatNames();
    }

    private static ModelDescription.Builder model() {
        return ModelDescription.builder();
    }

    @Test
    void fixedEffectsAndPriorTwins() {
        ModelDescription description = model()
            .predictor("mu", new FixedEffects(List.of("Intercept", "x1")))
            .build();
        assertEquals(
            List.of("b_Intercept", "b_x1", "bs[1]", "prior_b", "prior_b_x1", "lp__"),
            renamed(description, "b[1]", "b[2]", "bs[1]", "prior_b", "prior_b__2", "lp__"));
    }

    @Test
    void componentIndexedCoefficients() {
        ModelDescription description = model()
            .predictor("mu", new FixedEffects(List.of("x1", "x2"), true))
            .build();
        assertEquals(
            List.of("b_x1", "b_x2", "bs_1[1]", "sdb_x1", "sdb_x2"),
            renamed(description, "b_1[1]", "b_1[2]", "bs_1[1]", "sdb_1[1]", "sdb_1[2]"));
    }

    @Test
    void fixedEffectsOfOtherDistributionalParameter() {
        ModelDescription description = model()
            .distributionalParameters("mu", "sigma")
            .predictor("mu", new FixedEffects(List.of("Intercept")))
            .predictor("sigma", new FixedEffects(List.of("Intercept", "x1")))
            .build();
        assertEquals(
            List.of("b_Intercept", "b_sigma_Intercept", "b_sigma_x1"),
            renamed(description, "b[1]", "b_sigma[1]", "b_sigma[2]"));
    }

    @Test
    void specialPriorShadowClass() {
        ModelDescription description = model()
            .predictor("mu", new FixedEffects(List.of("x1", "x2"), true))
            .build();
        assertEquals(
            List.of("b_x1", "b_x2", "sdb_x1", "sdb_x2"),
            renamed(description, "b[1]", "b[2]", "sdb[1]", "sdb[2]"));
    }

    @Test
    void monotonicEffectsAndSimplexes() {
        ModelDescription description = model()
            .predictor("mu", new SpecialEffects(List.of(new SpecialEffects.Effect("moincome", 1))))
            .build();
        assertEquals(
            List.of("bsp_moincome", "simo_moincome1[1]", "simo_moincome1[2]",
                "prior_simo_moincome1[1]", "prior_simo_moincome1[2]"),
            renamed(description, "bsp[1]", "simo_1[1]", "simo_1[2]", "prior_simo_1[1]", "prior_simo_1[2]"));
    }

    @Test
    void categorySpecificEffectsAreRelabeledCoefficientMajor() {
        ModelDescription description = model()
            .predictor("mu", new CategorySpecificEffects(List.of("x", "z"), 2))
            .build();
        SampleStore result = rename(description, "bcs[1]", "bcs[2]", "bcs[3]", "bcs[4]");

        assertEquals(List.of("bcs_x[1]", "bcs_x[2]", "bcs_z[1]", "bcs_z[2]"), result.flatNames());
        // backend layout is threshold-major: (t1,x) (t1,z) (t2,x) (t2,z)
        Chain chain = result.chains().get(0);
        assertEquals(0.0, chain.column(0).get(0));
        assertEquals(2.0, chain.column(1).get(0));
        assertEquals(1.0, chain.column(2).get(0));
        assertEquals(3.0, chain.column(3).get(0));
    }

    @Test
    void categorySpecificThresholdCountFallsBackToIntercepts() {
        ModelDescription description = model()
            .predictor("mu", new CategorySpecificEffects(List.of("x"), 0))
            .build();
        assertEquals(
            List.of("b_Intercept[1]", "b_Intercept[2]", "bcs_x[1]", "bcs_x[2]"),
            renamed(description, "b_Intercept[1]", "b_Intercept[2]", "bcs[1]", "bcs[2]"));
    }

    @Test
    void smoothTerms() {
        ModelDescription description = model()
            .predictor("mu", new Smooths(List.of("sage_1"), List.of(new Smooths.Term("sage", 2)), false))
            .build();
        assertEquals(
            List.of("bs_sage_1", "sds_sage_1", "sds_sage_2", "s_sage_1[1]", "s_sage_1[2]", "s_sage_2[1]",
                "prior_sds_sage"),
            renamed(description, "bs[1]", "sds_1[1]", "sds_1[2]", "s_1_1[1]", "s_1_1[2]", "s_1_2[1]",
                "prior_sds_1"));
    }

    @Test
    void gaussianProcessWithSingleLabel() {
        ModelDescription description = model()
            .predictor("mu", new GaussianProcesses(List.of(
                new GaussianProcesses.Term(List.of("gpx"), List.of("gpx")))))
            .build();
        assertEquals(
            List.of("sdgp_gpx", "lscale_gpx", "zgp_gpx[1]", "zgp_gpx[2]", "prior_sdgp"),
            renamed(description, "sdgp_1[1]", "lscale_1[1]", "zgp_1[1]", "zgp_1[2]", "prior_sdgp_1"));
    }

    @Test
    void gaussianProcessWithByLevels() {
        ModelDescription description = model()
            .predictor("mu", new GaussianProcesses(List.of(
                new GaussianProcesses.Term(List.of("gpxa", "gpxb"), List.of("gpxa", "gpxb")))))
            .build();
        assertEquals(
            List.of("sdgp_gpxa", "sdgp_gpxb", "lscale_gpxa", "lscale_gpxb", "zgp_gpxa[1]", "zgp_gpxb[1]"),
            renamed(description, "sdgp_1[1]", "sdgp_1[2]", "lscale_1[1]", "lscale_1[2]",
                "zgp_1_1[1]", "zgp_1_2[1]"));
    }

    @Test
    void unstructuredAutocorrelation() {
        ModelDescription description = model()
            .predictor("mu", new Autocorrelation(List.of("t1", "t2", "t3")))
            .build();
        assertEquals(
            List.of("cortime__t1__t2", "cortime__t1__t3", "cortime__t2__t3"),
            renamed(description, "cortime[1]", "cortime[2]", "cortime[3]"));
    }

    @Test
    void groupLevelInterceptPerSite() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(
                List.of(new GroupLevelEffects.Term(1, "site", "Intercept", 1)),
                Map.of("site", List.of("A", "B", "C"))))
            .build();
        assertEquals(
            List.of("sd_site__Intercept", "r_site[A,Intercept]", "r_site[B,Intercept]", "r_site[C,Intercept]"),
            renamed(description, "sd_1[1]", "r_1_1[1]", "r_1_1[2]", "r_1_1[3]"));
    }

    @Test
    void correlatedGroupLevelEffects() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(List.of(
                new GroupLevelEffects.Term(1, "site", "Intercept", 1, "", "mu", "", true, "", List.of(), "gaussian", 1),
                new GroupLevelEffects.Term(1, "site", "x1", 2, "", "mu", "", true, "", List.of(), "gaussian", 1)),
                Map.of("site", List.of("North Hill", "South"))))
            .build();
        assertEquals(
            List.of("sd_site__Intercept", "sd_site__x1", "cor_site__Intercept__x1",
                "r_site[North.Hill,Intercept]", "r_site[South,Intercept]",
                "r_site[North.Hill,x1]", "r_site[South,x1]",
                "prior_sd_site", "prior_sd_site__x1", "prior_cor_site"),
            renamed(description, "sd_1[1]", "sd_1[2]", "cor_1[1]",
                "r_1_1[1]", "r_1_1[2]", "r_1_2[1]", "r_1_2[2]",
                "prior_sd_1", "prior_sd_1__2", "prior_cor_1"));
    }

    @Test
    void uncorrelatedBlockHasNoCorrelationRename() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(List.of(
                new GroupLevelEffects.Term(1, "g", "Intercept", 1),
                new GroupLevelEffects.Term(1, "g", "x", 2)), Map.of()))
            .build();
        RenamePlan plan = new RenamePlanBuilder().build(description, List.of("sd_1[1]", "sd_1[2]", "cor_1[1]"));
        assertThat(plan.effective()).hasSize(1);
    }

    @Test
    void nestedGroupLevelEffects() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(List.of(
                new GroupLevelEffects.Term(1, "g", "Intercept", 1, "", "mu", "", true, "trt", List.of("a", "b"), "gaussian", 1),
                new GroupLevelEffects.Term(1, "g", "x", 2, "", "mu", "", true, "trt", List.of("a", "b"), "gaussian", 1)),
                Map.of()))
            .build();
        assertEquals(
            List.of("sd_g__Intercept:trta", "sd_g__x:trta", "sd_g__Intercept:trtb", "sd_g__x:trtb",
                "cor_g__Intercept:trta__x:trta", "cor_g__Intercept:trtb__x:trtb"),
            renamed(description, "sd_1[1]", "sd_1[2]", "sd_1[3]", "sd_1[4]", "cor_1_1[1]", "cor_1_2[1]"));
    }

    @Test
    void groupLevelEffectsOfOtherParameterAndStudentDegreesOfFreedom() {
        ModelDescription description = model()
            .distributionalParameters("mu", "sigma")
            .model(new GroupLevelEffects(List.of(
                new GroupLevelEffects.Term(2, "g", "Intercept", 1, "", "sigma", "", false, "", List.of(), "student", 1)),
                Map.of("g", List.of("A", "B"))))
            .build();
        assertEquals(
            List.of("sd_g__sigma_Intercept", "r_g__sigma[A,Intercept]", "r_g__sigma[B,Intercept]", "df_g"),
            renamed(description, "sd_2[1]", "r_2_sigma_1[1]", "r_2_sigma_1[2]", "df_1"));
    }

    @Test
    void missingLevelsFallBackToIndices() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(List.of(new GroupLevelEffects.Term(1, "g", "Intercept", 1)), Map.of()))
            .build();
        assertEquals(
            List.of("sd_g__Intercept", "r_g[1,Intercept]", "r_g[2,Intercept]"),
            renamed(description, "sd_1[1]", "r_1_1[1]", "r_1_1[2]"));
    }

    @Test
    void groupedThresholds() {
        ModelDescription description = model()
            .responseTerm(new Thresholds(List.of(
                new Thresholds.Group("g1", List.of("1", "2")),
                new Thresholds.Group("g2", List.of("1")))))
            .build();
        assertEquals(
            List.of("b_Intercept[g1,1]", "b_Intercept[g1,2]", "b_Intercept[g2,1]"),
            renamed(description, "b_Intercept_1[1]", "b_Intercept_1[2]", "b_Intercept_2[1]"));
    }

    @Test
    void ungroupedThresholdsAreLeftAlone() {
        ModelDescription description = model()
            .responseTerm(new Thresholds(List.of(new Thresholds.Group("", List.of("1", "2")))))
            .build();
        assertEquals(List.of("b_Intercept[1]", "b_Intercept[2]"),
            renamed(description, "b_Intercept[1]", "b_Intercept[2]"));
    }

    @Test
    void groupedHazardBaseline() {
        ModelDescription description = model()
            .responseTerm(new HazardBaseline(List.of("a", "b")))
            .build();
        assertEquals(
            List.of("sbhaz[a,1]", "sbhaz[a,2]", "sbhaz[b,1]", "sbhaz[b,2]"),
            renamed(description, "sbhaz[1,1]", "sbhaz[1,2]", "sbhaz[2,1]", "sbhaz[2,2]"));
    }

    @Test
    void correlatedLatentVariables() {
        ModelDescription description = model()
            .model(new MeasurementError(List.of(
                new MeasurementError.Term("mexa", "", true),
                new MeasurementError.Term("mexb", "", true)), Map.of()))
            .build();
        assertEquals(
            List.of("meanme_mexa", "meanme_mexb", "sdme_mexa", "sdme_mexb",
                "Xme_mexa[1]", "Xme_mexa[2]", "Xme_mexb[1]", "Xme_mexb[2]",
                "corme__mexa__mexb", "prior_meanme", "prior_meanme_mexb"),
            renamed(description, "meanme_1[1]", "meanme_1[2]", "sdme_1[1]", "sdme_1[2]",
                "Xme_1[1]", "Xme_1[2]", "Xme_2[1]", "Xme_2[2]",
                "corme_1[1]", "prior_meanme_1", "prior_meanme_1__2"));
    }

    @Test
    void groupedLatentVariablesUseSanitizedLevels() {
        ModelDescription description = model()
            .model(new MeasurementError(List.of(new MeasurementError.Term("mex", "id", false)),
                Map.of("id", List.of("p 1", "p2"))))
            .build();
        assertEquals(
            List.of("meanme_mex", "sdme_mex", "Xme_mex[p.1]", "Xme_mex[p2]"),
            renamed(description, "meanme_1[1]", "sdme_1[1]", "Xme_1[1]", "Xme_1[2]"));
    }

    @Test
    void missingValueRows() {
        ModelDescription description = model()
            .responseTerm(new MissingValues(List.of(3, 7)))
            .build();
        assertEquals(List.of("Ymi[3]", "Ymi[7]"), renamed(description, "Ymi[1]", "Ymi[2]"));
    }

    @Test
    void logisticNormalCorrelation() {
        ModelDescription description = model()
            .responseTerm(new FamilyCorrelation(List.of("mub", "muc")))
            .build();
        assertEquals(List.of("lncor__mub__muc"), renamed(description, "lncor[1]"));
    }

    @Test
    void multivariateResponses() {
        ResponseNode y1 = new ResponseNode("y1", List.of("mu"),
            List.of(new PredictorNode("mu", List.of(new FixedEffects(List.of("Intercept"))))), List.of());
        ResponseNode y2 = new ResponseNode("y2", List.of("mu", "sigma"),
            List.of(new PredictorNode("mu", List.of(new FixedEffects(List.of("Intercept", "x"))))), List.of());
        ModelDescription description = new ModelDescription(List.of(y1, y2),
            List.of(new ResidualCorrelation(List.of("y1", "y2"))));

        assertTrue(description.isMultivariate());
        assertEquals(
            List.of("b_y1_Intercept", "b_y2_Intercept", "b_y2_x", "rescor__y1__y2"),
            renamed(description, "b_y1[1]", "b_y2[1]", "b_y2[2]", "rescor[1]"));
    }

    @Test
    void absentFeaturesYieldNoOps() {
        ModelDescription description = model()
            .predictor("mu", new FixedEffects(List.of("Intercept")),
                new Smooths(List.of(), List.of(new Smooths.Term("sx", 1)), false))
            .model(new GroupLevelEffects(List.of(new GroupLevelEffects.Term(1, "g", "Intercept", 1)), Map.of()))
            .build();
        List<String> names = List.of("sigma", "lp__");
        RenamePlan plan = new RenamePlanBuilder().build(description, names);

        assertThat(plan.operations()).isNotEmpty().allMatch(RenameOperation::isNoOp);
        assertThat(plan.effective()).isEmpty();
    }

    @Test
    void planFollowsTermKindOrder() {
        // group-level terms are declared at model scope but are visited after fixed effects,
        // thresholds after group-level terms
        ModelDescription description = model()
            .responseTerm(new MissingValues(List.of(5)))
            .predictor("mu", new FixedEffects(List.of("Intercept")))
            .model(new GroupLevelEffects(List.of(new GroupLevelEffects.Term(1, "g", "Intercept", 1)), Map.of()))
            .build();
        List<String> names = List.of("Ymi[1]", "sd_1[1]", "b[1]");
        List<RenameOperation> effective = new RenamePlanBuilder().build(description, names).effective();

        assertEquals(List.of("b_Intercept"), effective.get(0).names());
        assertEquals(List.of("sd_g__Intercept"), effective.get(1).names());
        assertEquals(List.of("Ymi[5]"), effective.get(2).names());
    }

    @Test
    void customWhitespaceFiller() {
        ModelDescription description = model()
            .model(new GroupLevelEffects(List.of(new GroupLevelEffects.Term(1, "g", "Intercept", 1)),
                Map.of("g", List.of("a b"))))
            .build();
        SampleStore store = store("sd_1[1]", "r_1_1[1]");
        RenamePlan plan = new RenamePlanBuilder("_").build(description, store.flatNames());
        assertEquals(List.of("sd_g__Intercept", "r_g[a_b,Intercept]"),
            new RenameExecutor().apply(store, plan).flatNames());
    }
}
