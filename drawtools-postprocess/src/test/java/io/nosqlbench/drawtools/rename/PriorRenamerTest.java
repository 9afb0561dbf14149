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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PriorRenamerTest {

    @Test
    void scalarFormSubstitutesDisambiguatedLabel() {
        List<String> names = List.of("b[1]", "prior_b", "prior_b__2", "prior_b__3", "lp__");
        List<RenameOperation> ops = PriorRenamer.scalar(names, "b", List.of("Intercept", "x1", "x2"));

        assertEquals(1, ops.size());
        RenameOperation op = ops.get(0);
        // prior_b resolves to itself and is skipped
        assertArrayEquals(new int[]{2, 3}, op.positions());
        assertEquals(List.of("prior_b_x1", "prior_b_x2"), op.names());
    }

    @Test
    void scalarFormReplacesClass() {
        List<String> names = List.of("prior_sd_1", "prior_sd_1__2");
        List<RenameOperation> ops = PriorRenamer.scalar(names, "sd_1", "sd_site", List.of("_Intercept", "_x1"));

        assertEquals(List.of("prior_sd_site", "prior_sd_site__x1"), ops.get(0).names());
    }

    @Test
    void scalarFormWithoutLabelsOnlyReplacesClass() {
        List<String> names = List.of("prior_cor_1");
        assertEquals(List.of("prior_cor_site"), PriorRenamer.scalar(names, "cor_1", "cor_site", null).get(0).names());
    }

    @Test
    void noTwinsNoOperation() {
        assertThat(PriorRenamer.scalar(List.of("b[1]"), "b", List.of("Intercept"))).isEmpty();
        assertThat(PriorRenamer.vector(List.of("b[1]"), "simo_1", "simo_x1", null)).isEmpty();
    }

    @Test
    void vectorFormReplacesTrailingIndex() {
        List<String> names = List.of("prior_simo_1[1]", "prior_simo_1[2]", "simo_1[1]");
        RenameOperation op = PriorRenamer.vector(names, "simo_1", "simo", List.of("a", "b")).get(0);

        BitSet expected = new BitSet();
        expected.set(0, 2);
        assertEquals(expected, op.mask());
        assertEquals(List.of("prior_simo_a", "prior_simo_b"), op.names());
    }

    @Test
    void vectorFormWithoutLabelsKeepsIndex() {
        List<String> names = List.of("prior_simo_1[1]", "prior_simo_1[2]");
        RenameOperation op = PriorRenamer.vector(names, "simo_1", "simo_mo1", null).get(0);
        assertEquals(List.of("prior_simo_mo1[1]", "prior_simo_mo1[2]"), op.names());
    }
}
