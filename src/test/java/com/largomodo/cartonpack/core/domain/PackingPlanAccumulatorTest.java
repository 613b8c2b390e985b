package com.largomodo.cartonpack.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PackingPlanAccumulatorTest {

    private static final CartonType SMALL = new CartonType(11, 11, 11, 100, 5);
    private static final CartonType LARGE = new CartonType(21, 21, 21, 100, 5);

    @Test
    void emptyAccumulatorProducesEmptyPlan() {
        PackingPlanAccumulator accumulator = new PackingPlanAccumulator();

        PackingResult result = accumulator.toResult(4, 4);
        assertTrue(result.entries().isEmpty());
        assertEquals(4, result.remainingDemand());
    }

    @Test
    void entriesKeepOrderOfFirstCommit() {
        PackingPlanAccumulator accumulator = new PackingPlanAccumulator();

        accumulator.commit(fit(1, Orientation.LBH, 2), LARGE, 8);
        accumulator.commit(fit(0, Orientation.LBH, 1), SMALL, 1);
        accumulator.commit(fit(1, Orientation.LBH, 2), LARGE, 8);

        PackingResult result = accumulator.toResult(0, 17);
        assertEquals(2, result.entries().size());
        assertEquals(1, result.entries().get(0).cartonIndex());
        assertEquals(0, result.entries().get(1).cartonIndex());
    }

    @Test
    void repeatedCommitsAccumulateCountsButKeepFirstOrientation() {
        PackingPlanAccumulator accumulator = new PackingPlanAccumulator();

        accumulator.commit(fit(0, Orientation.BHL, 2), LARGE, 8);
        accumulator.commit(fit(0, Orientation.LBH, 3), LARGE, 2);

        PackingPlanEntry entry = accumulator.toResult(0, 10).entries().get(0);
        assertEquals(Orientation.BHL, entry.orientation());
        assertEquals(2, entry.fitLengthwise());
        assertEquals(2, entry.cartonsUsed());
        assertEquals(10, entry.totalItems());
        assertSame(LARGE, entry.cartonType());
    }

    private static FitRecord fit(int cartonIndex, Orientation orientation, long perAxis) {
        long volumetric = perAxis * perAxis * perAxis;
        return new FitRecord(cartonIndex, orientation, perAxis, perAxis, perAxis, volumetric, 100);
    }
}
