package com.largomodo.cartonpack.util;

/**
 * Weight units accepted for the product's unit weight. Kilograms are the canonical unit;
 * carton load limits are always stated in kilograms.
 */
public enum WeightUnit {
    KG(1.0),
    G(0.001),
    LB(0.453592),
    OZ(0.0283495);

    private final double kilograms;

    WeightUnit(double kilograms) {
        this.kilograms = kilograms;
    }

    /**
     * Converts a weight in this unit to kilograms.
     */
    public double toKilograms(double value) {
        return value * kilograms;
    }
}
