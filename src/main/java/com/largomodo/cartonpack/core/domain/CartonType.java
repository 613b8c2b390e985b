package com.largomodo.cartonpack.core.domain;

import com.largomodo.cartonpack.util.DimensionFormat;

/**
 * Immutable availability record for one carton type.
 * <p>
 * Stated dimensions are exterior measurements. The usable interior on each axis is the stated
 * dimension minus the clearance buffer. The quantity is the number of physical cartons of this
 * type on hand; the allocator never mutates it and tracks consumption in a {@link CartonInventory}
 * private to each call.
 * </p>
 *
 * @param length    Stated exterior length (must be > 0)
 * @param breadth   Stated exterior breadth (must be > 0)
 * @param height    Stated exterior height (must be > 0)
 * @param maxWeight Maximum total product weight one carton may carry (must be > 0)
 * @param quantity  Number of physical cartons available (must be > 0)
 * @param buffer    Clearance subtracted from each stated dimension (must be >= 0)
 */
public record CartonType(double length, double breadth, double height,
                         double maxWeight, int quantity, double buffer) {

    public static final double DEFAULT_BUFFER = 1.0;

    /**
     * Compact constructor that validates dimensions, weight limit, quantity and buffer.
     *
     * @throws ValidationException naming the first offending field
     */
    public CartonType {
        ValidationException.requirePositive("Carton", "length", length);
        ValidationException.requirePositive("Carton", "breadth", breadth);
        ValidationException.requirePositive("Carton", "height", height);
        ValidationException.requirePositive("Carton", "maxWeight", maxWeight);
        ValidationException.requirePositive("Carton", "quantity", quantity);
        if (!Double.isFinite(buffer) || buffer < 0) {
            throw new ValidationException("buffer",
                    "Carton buffer must be zero or a positive number, got: " + buffer);
        }
    }

    /**
     * Creates a carton type with the default clearance buffer of one unit.
     */
    public CartonType(double length, double breadth, double height, double maxWeight, int quantity) {
        this(length, breadth, height, maxWeight, quantity, DEFAULT_BUFFER);
    }

    /**
     * Usable interior dimension on the given axis (0 = length, 1 = breadth, 2 = height).
     * May be zero or negative when the buffer consumes the whole stated dimension.
     */
    public double interior(int axis) {
        return switch (axis) {
            case 0 -> length - buffer;
            case 1 -> breadth - buffer;
            case 2 -> height - buffer;
            default -> throw new IllegalArgumentException("Axis index must be 0, 1 or 2, got: " + axis);
        };
    }

    /**
     * Volume of the stated exterior dimensions.
     */
    public double volume() {
        return length * breadth * height;
    }

    @Override
    public String toString() {
        return DimensionFormat.format(length) + "x" + DimensionFormat.format(breadth) + "x"
                + DimensionFormat.format(height) + ":" + DimensionFormat.format(maxWeight) + ":" + quantity;
    }
}
