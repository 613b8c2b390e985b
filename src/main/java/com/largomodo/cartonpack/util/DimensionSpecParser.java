package com.largomodo.cartonpack.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact command-line descriptors of the form {@code DIMENSIONS:WEIGHT:QTY}, where
 * {@code DIMENSIONS} is one to three numbers joined by {@code x}.
 * <p>
 * Examples: {@code 10x10x10:1:8}, {@code 20.5 x 15 x 8 : 2.5 : 100}, {@code 6x12:0.4:20}.
 * Whitespace around separators is ignored and {@code X} or {@code *} are accepted in place of
 * {@code x}. Only the shape of the text is checked here; how many dimensions a caller needs and
 * range checks belong to the caller and the domain constructors.
 */
public final class DimensionSpecParser {

    private static final String NUMBER = "([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)";
    private static final String TIMES = "\\s*[xX*]\\s*";
    private static final Pattern SPEC = Pattern.compile(
            "\\s*" + NUMBER + "(?:" + TIMES + NUMBER + ")?(?:" + TIMES + NUMBER + ")?"
                    + "\\s*:\\s*" + NUMBER + "\\s*:\\s*([+-]?\\d+)\\s*");

    private DimensionSpecParser() {
    }

    /**
     * Parses a descriptor into its dimensions, weight and quantity.
     *
     * @param spec descriptor text
     * @return parsed values, not yet range-checked
     * @throws IllegalArgumentException if the text does not match {@code DIMENSIONS:WEIGHT:QTY}
     */
    public static DimensionSpec parse(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Descriptor cannot be null");
        }
        Matcher m = SPEC.matcher(spec);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid descriptor '" + spec
                    + "': expected LENGTHxBREADTHxHEIGHT:WEIGHT:QUANTITY, e.g. 10x10x10:1:8");
        }
        int quantity;
        try {
            quantity = Integer.parseInt(m.group(5));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid descriptor '" + spec + "': quantity out of range", e);
        }
        List<Double> dimensions = new ArrayList<>(3);
        for (int group = 1; group <= 3; group++) {
            if (m.group(group) != null) {
                dimensions.add(Double.parseDouble(m.group(group)));
            }
        }
        return new DimensionSpec(dimensions, Double.parseDouble(m.group(4)), quantity);
    }

    /**
     * Parsed descriptor values.
     *
     * @param dimensions one to three dimensions, in the order given
     * @param weight     unit weight (products) or maximum load (cartons)
     * @param quantity   unit count (products) or cartons on hand (cartons)
     */
    public record DimensionSpec(List<Double> dimensions, double weight, int quantity) {

        public DimensionSpec {
            dimensions = List.copyOf(dimensions);
        }
    }
}
