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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ModelDescriptionsTest {

    private static String fixture(String name) throws IOException {
        try (InputStream in = ModelDescriptionsTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parsesPolymorphicTermGroups() throws Exception {
        ModelDescription description = ModelDescriptions.parse(fixture("site-model.json"));

        assertFalse(description.isMultivariate());
        ResponseNode response = description.responses().get(0);
        assertEquals(2, response.predictors().size());

        PredictorNode mu = response.predictors().get(0);
        assertEquals("mu", mu.dpar());
        assertEquals("", mu.nlpar());
        assertThat(mu.terms()).hasSize(2);
        FixedEffects fixed = assertInstanceOf(FixedEffects.class, mu.terms().get(0));
        assertEquals(List.of("Intercept", "x1"), fixed.coefficients());
        assertFalse(fixed.specialPrior());
        Smooths smooths = assertInstanceOf(Smooths.class, mu.terms().get(1));
        assertEquals(new Smooths.Term("sx", 2), smooths.terms().get(0));

        GroupLevelEffects re = assertInstanceOf(GroupLevelEffects.class, description.terms().get(0));
        GroupLevelEffects.Term term = re.terms().get(1);
        assertEquals("x1", term.coefficient());
        assertEquals(2, term.coefficientIndex());
        assertEquals("mu", term.dpar());
        assertEquals("gaussian", term.distribution());
        assertTrue(term.correlated());
        assertEquals(List.of("North Hill", "South"), re.levels().get("site"));
    }

    @Test
    void distributionalParametersAreCollected() throws Exception {
        ModelDescription description = ModelDescriptions.parse(fixture("site-model.json"));
        assertEquals(List.of("mu", "sigma"), description.distributionalParameters());
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path tempDir) throws Exception {
        ModelDescription original = ModelDescription.builder()
            .distributionalParameters("mu", "sigma")
            .predictor("mu", new FixedEffects(List.of("Intercept", "x1")),
                new CategorySpecificEffects(List.of("x2"), 3))
            .responseTerm(new Thresholds(List.of(new Thresholds.Group("g1", List.of("1", "2")))))
            .model(new GroupLevelEffects(
                List.of(new GroupLevelEffects.Term(1, "site", "Intercept", 1)),
                Map.of("site", List.of("A", "B"))))
            .build();

        Path path = tempDir.resolve("model.json");
        ModelDescriptions.save(path, original);
        ModelDescription restored = ModelDescriptions.load(path);

        assertEquals(original, restored);
        assertThat(ModelDescriptions.toJson(original)).contains("\"kind\": \"category_specific\"");
    }

    @Test
    void missingKindIsRejected() {
        String json = """
            {"responses": [{"response": "", "predictors": [{"dpar": "mu", "terms": [{"coefficients": ["a"]}]}]}]}
            """;
        ModelDescriptionException e = assertThrows(ModelDescriptionException.class,
            () -> ModelDescriptions.parse(json));
        assertThat(e.getMessage()).contains("kind");
    }

    @Test
    void unknownKindIsRejected() {
        String json = """
            {"responses": [{"response": "", "predictors": [{"dpar": "mu", "terms": [{"kind": "splines"}]}]}]}
            """;
        assertThrows(ModelDescriptionException.class, () -> ModelDescriptions.parse(json));
    }

    @Test
    void termGroupAtWrongLevelIsRejected() {
        String json = """
            {"responses": [], "terms": [{"kind": "fixed", "coefficients": ["a"]}]}
            """;
        assertThrows(ModelDescriptionException.class, () -> ModelDescriptions.parse(json));
    }

    @Test
    void missingFileIsReported(@TempDir Path tempDir) {
        assertThrows(ModelDescriptionException.class,
            () -> ModelDescriptions.load(tempDir.resolve("absent.json")));
    }

    @Test
    void namePrefixDropsMainParameter() {
        assertEquals("", NamePrefix.combine("", "mu", ""));
        assertEquals("sigma", NamePrefix.combine("", "sigma", ""));
        assertEquals("y1_sigma", NamePrefix.combine("y1", "sigma", ""));
        assertEquals("y1_eta", NamePrefix.combine("y1", "mu", "eta"));
        assertEquals("", NamePrefix.underscored(""));
        assertEquals("_y1", NamePrefix.underscored("y1"));
    }
}
