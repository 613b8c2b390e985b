package com.largomodo.cartonpack.util;

/**
 * Length units accepted for product dimensions. Inches are the canonical unit; carton
 * descriptors are always stated in inches.
 */
public enum LengthUnit {
    IN(1.0),
    CM(0.393701),
    M(39.3701),
    FT(12.0);

    private final double inches;

    LengthUnit(double inches) {
        this.inches = inches;
    }

    /**
     * Converts a length in this unit to inches.
     */
    public double toInches(double value) {
        return value * inches;
    }
}
