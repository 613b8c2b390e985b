package com.largomodo.cartonpack.core.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects committed cartons per carton type and converts them into a {@link PackingResult}.
 * <p>
 * Entries keep the order in which each carton type was first committed. Orientation and fit
 * counts are fixed by that first commit and never overwritten.
 */
public final class PackingPlanAccumulator {

    private final Map<Integer, PackingPlanEntry> entriesByCarton = new LinkedHashMap<>();

    /**
     * Records one committed carton holding the given number of units.
     *
     * @param fit   fit chosen for this carton
     * @param carton carton type the fit refers to
     * @param units units placed in the carton (must be > 0)
     */
    public void commit(FitRecord fit, CartonType carton, int units) {
        entriesByCarton.merge(fit.cartonIndex(),
                new PackingPlanEntry(fit.cartonIndex(), carton, fit.orientation(),
                        fit.fitLengthwise(), fit.fitBreadthwise(), fit.fitHeightwise(), 1, units),
                (existing, added) -> new PackingPlanEntry(existing.cartonIndex(), existing.cartonType(),
                        existing.orientation(), existing.fitLengthwise(), existing.fitBreadthwise(),
                        existing.fitHeightwise(), existing.cartonsUsed() + 1, existing.totalItems() + units));
    }

    public PackingResult toResult(int remainingDemand, int requestedQuantity) {
        return new PackingResult(List.copyOf(entriesByCarton.values()), remainingDemand, requestedQuantity);
    }
}
