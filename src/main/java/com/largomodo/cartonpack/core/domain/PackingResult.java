package com.largomodo.cartonpack.core.domain;

import java.util.List;

/**
 * Outcome of one allocation: plan entries in order of first commitment plus leftover demand.
 *
 * @param entries           Plan entries, one per carton type used (unmodifiable)
 * @param remainingDemand   Units that could not be placed (0 when fully packed)
 * @param requestedQuantity Product quantity the allocation started with
 */
public record PackingResult(List<PackingPlanEntry> entries, int remainingDemand, int requestedQuantity) {

    public PackingResult {
        entries = List.copyOf(entries);
        if (remainingDemand < 0 || remainingDemand > requestedQuantity) {
            throw new IllegalArgumentException("remainingDemand must be between 0 and "
                    + requestedQuantity + ", got: " + remainingDemand);
        }
    }

    public int packedQuantity() {
        return requestedQuantity - remainingDemand;
    }

    public boolean isComplete() {
        return remainingDemand == 0;
    }

    public int totalCartonsUsed() {
        return entries.stream().mapToInt(PackingPlanEntry::cartonsUsed).sum();
    }
}
