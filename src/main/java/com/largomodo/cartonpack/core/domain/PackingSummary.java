package com.largomodo.cartonpack.core.domain;

import java.util.List;

/**
 * Derived statistics for a packing result: utilisation per carton type and overall totals.
 * <p>
 * Volume utilisation compares the packed product volume with the stated (exterior) volume of
 * the cartons used; weight utilisation compares the packed weight with the combined load limit
 * of those cartons. Nothing here feeds back into allocation.
 *
 * @param entries                 Per carton type statistics, in plan order
 * @param totalItemsPacked        Units placed in cartons
 * @param totalCartonsUsed        Physical cartons committed
 * @param averageVolumeUtilisation Mean of the entries' volume utilisation, 0 when nothing was packed
 * @param packingRate             Share of the requested quantity that was packed, in [0, 1]
 * @param packingSuccess          True when no demand is left over
 */
public record PackingSummary(List<EntryStatistics> entries, int totalItemsPacked, int totalCartonsUsed,
                             double averageVolumeUtilisation, double packingRate, boolean packingSuccess) {

    public PackingSummary {
        entries = List.copyOf(entries);
    }

    /**
     * Computes the summary for a result produced for the given product.
     */
    public static PackingSummary of(Product product, PackingResult result) {
        if (product == null || result == null) {
            throw new IllegalArgumentException("product and result must not be null");
        }
        List<EntryStatistics> stats = result.entries().stream()
                .map(entry -> EntryStatistics.of(product, entry))
                .toList();
        double average = stats.stream()
                .mapToDouble(EntryStatistics::volumeUtilisation)
                .average()
                .orElse(0.0);
        double packingRate = (double) result.packedQuantity() / result.requestedQuantity();
        return new PackingSummary(stats, result.packedQuantity(), result.totalCartonsUsed(),
                average, packingRate, result.isComplete());
    }

    /**
     * Statistics for one plan entry.
     *
     * @param cartonIndex       Position of the carton type in the input list
     * @param volumeUtilisation Packed product volume over stated carton volume, in [0, 1] for sane inputs
     * @param weightCarried     Total product weight placed in cartons of this type
     * @param weightUtilisation Weight carried over the combined load limit, in [0, 1]
     */
    public record EntryStatistics(int cartonIndex, double volumeUtilisation, double weightCarried,
                                  double weightUtilisation) {

        static EntryStatistics of(Product product, PackingPlanEntry entry) {
            double packedVolume = entry.totalItems() * product.volume();
            double cartonVolume = entry.cartonsUsed() * entry.cartonType().volume();
            double weightCarried = entry.totalItems() * product.weight();
            double loadLimit = entry.cartonsUsed() * entry.cartonType().maxWeight();
            return new EntryStatistics(entry.cartonIndex(), packedVolume / cartonVolume,
                    weightCarried, weightCarried / loadLimit);
        }
    }
}
