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

import io.nosqlbench.drawtools.store.Chain;
import io.nosqlbench.drawtools.store.DrawColumn;
import io.nosqlbench.drawtools.store.SampleStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class RenameExecutorTest {

    private static BitSet bits(int... positions) {
        BitSet bits = new BitSet();
        for (int p : positions) {
            bits.set(p);
        }
        return bits;
    }

    private static Chain chain(double offset) {
        return Chain.builder()
            .warmup(1)
            .column("b[1]", offset + 1, offset + 2)
            .column("b[2]", offset + 3, offset + 4)
            .column("b[3]", offset + 5, offset + 6)
            .column("lp__", offset + 7, offset + 8)
            .attribute("chain_id", Double.toString(offset))
            .build();
    }

    private static SampleStore store() {
        return SampleStore.of(chain(0), chain(100));
    }

    @Test
    void renamesMatchedPositionsInEveryChain() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(bits(0, 1, 2), List.of("b_Intercept", "b_x1", "b_x2"))));
        SampleStore result = new RenameExecutor().apply(store(), plan);

        List<String> expected = List.of("b_Intercept", "b_x1", "b_x2", "lp__");
        assertEquals(expected, result.flatNames());
        for (Chain chain : result.chains()) {
            assertEquals(expected, chain.names());
        }
        // values and chain attributes are untouched
        assertArrayEquals(new double[]{101, 102}, result.chains().get(1).column(0).values());
        assertEquals("100.0", result.chains().get(1).attributes().get("chain_id"));
    }

    @Test
    void masksReferToOriginalPositions() {
        // the second operation was computed on backend names, not on the output of the first
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(bits(0), List.of("b_Intercept")),
            RenameOperation.of(bits(1, 2), List.of("b_x1", "b_x2"))));
        assertEquals(List.of("b_Intercept", "b_x1", "b_x2", "lp__"),
            new RenameExecutor().apply(store(), plan).flatNames());
    }

    @Test
    void sortPermutesValuesOnlyWithinMask() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.sorted(bits(0, 2), List.of("a", "c"), new int[]{1, 0})));
        SampleStore result = new RenameExecutor().apply(store(), plan);

        assertEquals(List.of("a", "b[2]", "c", "lp__"), result.flatNames());
        for (int c = 0; c < 2; c++) {
            double offset = c * 100;
            Chain chain = result.chains().get(c);
            assertArrayEquals(new double[]{offset + 5, offset + 6}, chain.column(0).values());
            assertArrayEquals(new double[]{offset + 3, offset + 4}, chain.column(1).values());
            assertArrayEquals(new double[]{offset + 1, offset + 2}, chain.column(2).values());
        }
    }

    @Test
    void invalidSortIsIgnored() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.sorted(bits(0, 1), List.of("a", "b"), new int[]{0, 0})));
        SampleStore result = new RenameExecutor().apply(store(), plan);
        assertArrayEquals(new double[]{1, 2}, result.chains().get(0).column(0).values());
        assertArrayEquals(new double[]{3, 4}, result.chains().get(0).column(1).values());
    }

    @Test
    void columnAttributesFollowTheirColumn() {
        Chain chain = Chain.builder()
            .column(new DrawColumn("b[1]", new double[]{1}, Map.of("constrained", "false")))
            .build();
        RenamePlan plan = RenamePlan.of(List.of(RenameOperation.single(0, "b_Intercept")));
        SampleStore result = new RenameExecutor().apply(SampleStore.of(chain), plan);
        assertEquals("false", result.chains().get(0).column(0).attributes().get("constrained"));
    }

    @Test
    void noOpOperationsAreCounted() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(new BitSet(), List.of()),
            RenameOperation.of(bits(3), List.of("lp"))));
        RenameExecutor.Outcome outcome = new RenameExecutor().execute(store(), plan);

        assertEquals(1, outcome.report().applied());
        assertEquals(1, outcome.report().noOps());
        assertFalse(outcome.report().hasMismatches());
    }

    @Test
    void emptyPlanReturnsSameStore() {
        SampleStore store = store();
        assertSame(store, new RenameExecutor().apply(store, RenamePlan.empty()));
    }

    /// Legacy behaviour: too few names rename only the leading matched columns.
    @Test
    void shortReplacementListTruncates() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(bits(0, 1, 2), List.of("b_Intercept", "b_x1"))));
        RenameExecutor.Outcome outcome = new RenameExecutor().execute(store(), plan);

        assertEquals(List.of("b_Intercept", "b_x1", "b[3]", "lp__"), outcome.store().flatNames());
        assertThat(outcome.report().mismatches())
            .containsExactly(new RenameReport.Mismatch(0, 3, 2));
    }

    @Test
    void longReplacementListTruncates() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(bits(0), List.of("b_Intercept", "b_x1"))));
        RenameExecutor.Outcome outcome = new RenameExecutor().execute(store(), plan);

        assertEquals(List.of("b_Intercept", "b[2]", "b[3]", "lp__"), outcome.store().flatNames());
        assertTrue(outcome.report().hasMismatches());
    }

    @Test
    void strictModeThrowsOnMismatch() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.of(bits(3), List.of("lp")),
            RenameOperation.of(bits(0, 1, 2), List.of("b_Intercept"))));
        RenameMismatchException e = assertThrows(RenameMismatchException.class,
            () -> new RenameExecutor(true, false).apply(store(), plan));
        assertEquals(1, e.getOperationIndex());
        assertEquals(3, e.getMatched());
        assertEquals(1, e.getProvided());
    }

    @Test
    void positionsBeyondTheTableAreRejected() {
        RenamePlan plan = RenamePlan.of(List.of(RenameOperation.single(9, "x")));
        assertThrows(IllegalArgumentException.class, () -> new RenameExecutor().apply(store(), plan));
    }

    @Test
    void parallelFanOutMatchesSequential() {
        RenamePlan plan = RenamePlan.of(List.of(
            RenameOperation.sorted(bits(0, 1, 2), List.of("x", "y", "z"), new int[]{2, 0, 1})));
        SampleStore sequential = new RenameExecutor(false, false).apply(store(), plan);
        SampleStore parallel = new RenameExecutor(false, true).apply(store(), plan);
        assertEquals(sequential, parallel);
    }
}
