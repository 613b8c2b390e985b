package com.largomodo.cartonpack.core.domain;

/**
 * The six axis-aligned ways to place a product inside a carton.
 * <p>
 * Each constant maps carton interior axes (length, breadth, height) to the index of the product
 * dimension laid along them (0 = length, 1 = breadth, 2 = height). Declaration order is the
 * tie-break order used by the allocator and must not change; {@link #id()} is the ordinal
 * reported to consumers.
 */
public enum Orientation {
    // L<-l, B<-b, H<-h
    LBH(0, 1, 2),
    // L<-b, B<-h, H<-l
    BHL(1, 2, 0),
    // L<-h, B<-l, H<-b
    HLB(2, 0, 1),
    // L<-l, B<-h, H<-b
    LHB(0, 2, 1),
    // L<-h, B<-b, H<-l
    HBL(2, 1, 0),
    // L<-b, B<-l, H<-h
    BLH(1, 0, 2);

    private final int alongLength;
    private final int alongBreadth;
    private final int alongHeight;

    Orientation(int alongLength, int alongBreadth, int alongHeight) {
        this.alongLength = alongLength;
        this.alongBreadth = alongBreadth;
        this.alongHeight = alongHeight;
    }

    /**
     * Looks up an orientation by its reported id (0-5).
     *
     * @throws IllegalArgumentException if id is out of range
     */
    public static Orientation fromId(int id) {
        Orientation[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Orientation id must be between 0 and 5, got: " + id);
        }
        return all[id];
    }

    public int id() {
        return ordinal();
    }

    /**
     * Index of the product dimension laid along the given carton axis.
     */
    public int productAxisFor(int cartonAxis) {
        return switch (cartonAxis) {
            case 0 -> alongLength;
            case 1 -> alongBreadth;
            case 2 -> alongHeight;
            default -> throw new IllegalArgumentException("Axis index must be 0, 1 or 2, got: " + cartonAxis);
        };
    }
}
