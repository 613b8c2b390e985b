package com.largomodo.cartonpack.util;

import java.util.List;
import java.util.Locale;

/**
 * Product shapes and the axis-aligned bounding box each one occupies.
 * <p>
 * Round shapes are packed by their bounding box: a cylinder of diameter d and height h takes
 * d x d x h, a sphere of diameter d takes d x d x d.
 */
public enum ProductShape {
    CUBOID("LENGTHxBREADTHxHEIGHT", 3),
    CUBE("SIDE", 1),
    CYLINDER("DIAMETERxHEIGHT", 2),
    SPHERE("DIAMETER", 1);

    private final String dimensionLabel;
    private final int dimensionCount;

    ProductShape(String dimensionLabel, int dimensionCount) {
        this.dimensionLabel = dimensionLabel;
        this.dimensionCount = dimensionCount;
    }

    public String dimensionLabel() {
        return dimensionLabel;
    }

    /**
     * Computes length, breadth and height of the bounding box.
     *
     * @param dimensions the shape's dimensions, in the order of {@link #dimensionLabel()}
     * @return three-element array: length, breadth, height
     * @throws IllegalArgumentException if the number of dimensions does not match the shape
     */
    public double[] boundingBox(List<Double> dimensions) {
        if (dimensions == null || dimensions.size() != dimensionCount) {
            throw new IllegalArgumentException(name().toLowerCase(Locale.ROOT) + " expects " + dimensionLabel
                    + ", got " + (dimensions == null ? 0 : dimensions.size()) + " dimension(s)");
        }
        return switch (this) {
            case CUBOID -> new double[]{dimensions.get(0), dimensions.get(1), dimensions.get(2)};
            case CUBE, SPHERE -> new double[]{dimensions.get(0), dimensions.get(0), dimensions.get(0)};
            case CYLINDER -> new double[]{dimensions.get(0), dimensions.get(0), dimensions.get(1)};
        };
    }
}
