package com.largomodo.cartonpack.util;

import java.math.BigDecimal;

/**
 * Renders dimension and weight values for reports and descriptors.
 * Whole numbers print without a fractional part ("21", not "21.0").
 */
public final class DimensionFormat {

    private DimensionFormat() {
    }

    public static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
