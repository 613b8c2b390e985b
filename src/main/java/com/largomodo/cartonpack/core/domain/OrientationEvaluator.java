package com.largomodo.cartonpack.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every axis-aligned orientation of a product inside a carton type.
 * <p>
 * Stateless; a single instance may be shared between threads.
 */
public class OrientationEvaluator {

    /**
     * Evaluates one orientation. The returned record may be infeasible.
     *
     * @param product     product being packed
     * @param carton      carton type to evaluate
     * @param cartonIndex position of the carton type in the caller's list
     * @param orientation orientation to evaluate
     * @return fit counts and capacities for this pair
     */
    public FitRecord evaluate(Product product, CartonType carton, int cartonIndex, Orientation orientation) {
        long fitL = axisFit(carton.interior(0), product.dimension(orientation.productAxisFor(0)));
        long fitB = axisFit(carton.interior(1), product.dimension(orientation.productAxisFor(1)));
        long fitH = axisFit(carton.interior(2), product.dimension(orientation.productAxisFor(2)));
        long volumetric = saturatedMultiply(saturatedMultiply(fitL, fitB), fitH);
        long byWeight = weightCapacity(product, carton);
        return new FitRecord(cartonIndex, orientation, fitL, fitB, fitH, volumetric, byWeight);
    }

    /**
     * Evaluates all six orientations and keeps the feasible ones, in orientation order.
     *
     * @return feasible fits, empty if the product cannot be placed in this carton type at all
     */
    public List<FitRecord> feasibleFits(Product product, CartonType carton, int cartonIndex) {
        List<FitRecord> fits = new ArrayList<>(Orientation.values().length);
        for (Orientation orientation : Orientation.values()) {
            FitRecord fit = evaluate(product, carton, cartonIndex, orientation);
            if (fit.isFeasible()) {
                fits.add(fit);
            }
        }
        return fits;
    }

    /**
     * Units one carton can carry by weight alone: floor(maxWeight / product weight).
     */
    public static long weightCapacity(Product product, CartonType carton) {
        return floorDiv(carton.maxWeight(), product.weight());
    }

    private static long axisFit(double interior, double productDimension) {
        // Buffer may exceed the stated dimension; a negative interior holds nothing
        if (interior <= 0) {
            return 0;
        }
        return floorDiv(interior, productDimension);
    }

    private static long floorDiv(double dividend, double divisor) {
        // Narrowing cast saturates at Long.MAX_VALUE for absurdly large ratios
        return (long) Math.floor(dividend / divisor);
    }

    static long saturatedMultiply(long a, long b) {
        // Both operands are non-negative
        if (a != 0 && b > Long.MAX_VALUE / a) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }
}
