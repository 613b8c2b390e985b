package com.largomodo.cartonpack.core.domain;

/**
 * Result of evaluating one orientation of the product inside one carton type.
 *
 * @param cartonIndex        Position of the carton type in the input list
 * @param orientation        Orientation evaluated
 * @param fitLengthwise      Units along the carton's interior length
 * @param fitBreadthwise     Units along the carton's interior breadth
 * @param fitHeightwise      Units along the carton's interior height
 * @param volumetricCapacity Product of the three per-axis counts
 * @param weightCapacity     Units one carton can carry before exceeding its weight limit
 */
public record FitRecord(int cartonIndex, Orientation orientation,
                        long fitLengthwise, long fitBreadthwise, long fitHeightwise,
                        long volumetricCapacity, long weightCapacity) {

    /**
     * Units a single carton holds in this orientation: the lesser of volumetric and weight capacity.
     */
    public long effectiveCapacity() {
        return Math.min(volumetricCapacity, weightCapacity);
    }

    public boolean isFeasible() {
        return effectiveCapacity() > 0;
    }

    /**
     * Effective capacity limited to the demand still outstanding.
     */
    public int cappedCapacity(int remainingDemand) {
        return (int) Math.min(effectiveCapacity(), Math.max(remainingDemand, 0));
    }
}
