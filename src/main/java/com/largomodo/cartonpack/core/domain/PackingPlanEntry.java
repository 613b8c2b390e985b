package com.largomodo.cartonpack.core.domain;

/**
 * Aggregated packing outcome for one carton type.
 * <p>
 * Orientation and fit counts come from the first committed carton of this type;
 * cartonsUsed and totalItems accumulate over every committed carton.
 * </p>
 *
 * @param cartonIndex     Position of the carton type in the input list
 * @param cartonType      The carton type used
 * @param orientation     Orientation of the first committed carton
 * @param fitLengthwise   Units along the interior length in that orientation
 * @param fitBreadthwise  Units along the interior breadth in that orientation
 * @param fitHeightwise   Units along the interior height in that orientation
 * @param cartonsUsed     Physical cartons of this type committed
 * @param totalItems      Product units placed in cartons of this type
 */
public record PackingPlanEntry(int cartonIndex, CartonType cartonType, Orientation orientation,
                               long fitLengthwise, long fitBreadthwise, long fitHeightwise,
                               int cartonsUsed, int totalItems) {

    public PackingPlanEntry {
        if (cartonType == null || orientation == null) {
            throw new IllegalArgumentException("cartonType and orientation must not be null");
        }
        if (cartonsUsed <= 0) {
            throw new IllegalArgumentException("cartonsUsed must be positive, got: " + cartonsUsed);
        }
        if (totalItems <= 0) {
            throw new IllegalArgumentException("totalItems must be positive, got: " + totalItems);
        }
    }

    /**
     * Units a single carton holds by geometry in the recorded orientation, saturating at
     * {@link Long#MAX_VALUE}.
     */
    public long unitsPerCartonByVolume() {
        return OrientationEvaluator.saturatedMultiply(
                OrientationEvaluator.saturatedMultiply(fitLengthwise, fitBreadthwise), fitHeightwise);
    }
}
