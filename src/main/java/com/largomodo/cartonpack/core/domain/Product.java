package com.largomodo.cartonpack.core.domain;

import com.largomodo.cartonpack.util.DimensionFormat;

/**
 * Immutable description of the single product type being packed.
 * <p>
 * Dimensions and weight share whatever unit system the carton types use; the allocator only
 * ever divides one by the other.
 * </p>
 *
 * @param length   Product length (must be > 0)
 * @param breadth  Product breadth (must be > 0)
 * @param height   Product height (must be > 0)
 * @param weight   Weight of one unit (must be > 0)
 * @param quantity Total number of units to pack (must be > 0)
 */
public record Product(double length, double breadth, double height, double weight, int quantity) {

    /**
     * Compact constructor that validates every field is strictly positive.
     *
     * @throws ValidationException naming the first offending field
     */
    public Product {
        ValidationException.requirePositive("Product", "length", length);
        ValidationException.requirePositive("Product", "breadth", breadth);
        ValidationException.requirePositive("Product", "height", height);
        ValidationException.requirePositive("Product", "weight", weight);
        ValidationException.requirePositive("Product", "quantity", quantity);
    }

    /**
     * Returns the dimension at the given axis index (0 = length, 1 = breadth, 2 = height).
     */
    public double dimension(int axis) {
        return switch (axis) {
            case 0 -> length;
            case 1 -> breadth;
            case 2 -> height;
            default -> throw new IllegalArgumentException("Axis index must be 0, 1 or 2, got: " + axis);
        };
    }

    public double volume() {
        return length * breadth * height;
    }

    @Override
    public String toString() {
        return DimensionFormat.format(length) + "x" + DimensionFormat.format(breadth) + "x"
                + DimensionFormat.format(height) + ":" + DimensionFormat.format(weight) + ":" + quantity;
    }
}
