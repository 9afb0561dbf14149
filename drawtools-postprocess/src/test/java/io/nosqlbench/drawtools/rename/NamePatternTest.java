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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class NamePatternTest {

    private static final List<String> NAMES = List.of(
        "b[1]", "b[2]", "bs[1]", "bsp[1]", "b_Intercept", "sd_1[1]", "sd_10[1]",
        "cor_1[1]", "cor_1_2[1]", "cor_1_x", "lp__", "sbhaz[1,1]", "sbhaz[2,1]", "sbhaz[2,2]");

    private static BitSet bits(int... positions) {
        BitSet bits = new BitSet();
        for (int p : positions) {
            bits.set(p);
        }
        return bits;
    }

    @Test
    void indexedDoesNotMatchLongerClasses() {
        assertEquals(bits(0, 1), NamePattern.indexed("b").mask(NAMES));
        assertEquals(bits(2), NamePattern.indexed("bs").mask(NAMES));
    }

    @Test
    void numericSuffixIsNotAPrefixMatch() {
        assertEquals(bits(5), NamePattern.scalarOrIndexed("sd_1").mask(NAMES));
        assertEquals(bits(6), NamePattern.scalarOrIndexed("sd_10").mask(NAMES));
    }

    @Test
    void exactMatchesOnlyScalars() {
        assertEquals(bits(10), NamePattern.exact("lp__").mask(NAMES));
        assertFalse(NamePattern.exact("lp").any(NAMES));
    }

    @Test
    void disambiguatedAcceptsDigitSuffixOnly() {
        assertEquals(bits(7, 8), NamePattern.disambiguated("cor_1").mask(NAMES));
    }

    @Test
    void underscoreOrEnd() {
        assertTrue(NamePattern.of("cor_1", NamePattern.Boundary.UNDERSCORE_OR_END).matches("cor_1_x"));
        assertTrue(NamePattern.of("tmp_xi", NamePattern.Boundary.UNDERSCORE_OR_END).matches("tmp_xi"));
        assertFalse(NamePattern.of("tmp_xi", NamePattern.Boundary.UNDERSCORE_OR_END).matches("tmp_xiy"));
    }

    @Test
    void firstIndexSelectsOneRow() {
        assertEquals(bits(12, 13), NamePattern.firstIndex("sbhaz", 2).mask(NAMES));
    }

    @Test
    void priorTwins() {
        NamePattern twin = NamePattern.priorTwin("sd_1");
        assertTrue(twin.matches("prior_sd_1"));
        assertTrue(twin.matches("prior_sd_1__2"));
        assertTrue(twin.matches("prior_sd_1[3]"));
        assertFalse(twin.matches("prior_sd_10"));
        assertFalse(twin.matches("prior_sd_1_2"));
    }

    @Test
    void functionalFormAgreesWithPattern() {
        assertEquals(NamePattern.indexed("b").mask(NAMES), NamePattern.match(NAMES, "b", NamePattern.Boundary.BRACKET));
        assertEquals(2, NamePattern.indexed("b").count(NAMES));
        assertTrue(NamePattern.indexed("zgp").mask(NAMES).isEmpty());
    }
}
