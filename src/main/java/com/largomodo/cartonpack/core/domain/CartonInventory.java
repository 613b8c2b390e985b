package com.largomodo.cartonpack.core.domain;

import java.util.List;

/**
 * Mutable remaining-quantity counters for one allocation call.
 * <p>
 * Created from an immutable list of carton types and owned by exactly one allocation;
 * never share an instance between calls or threads. The source list is not modified.
 */
public final class CartonInventory {

    private final List<CartonType> cartonTypes;
    private final int[] remaining;

    private CartonInventory(List<CartonType> cartonTypes) {
        this.cartonTypes = List.copyOf(cartonTypes);
        this.remaining = new int[this.cartonTypes.size()];
        for (int i = 0; i < remaining.length; i++) {
            remaining[i] = this.cartonTypes.get(i).quantity();
        }
    }

    /**
     * Snapshots the given carton types into a fresh inventory.
     *
     * @param cartonTypes carton types in caller order, must not be null or contain nulls
     */
    public static CartonInventory of(List<CartonType> cartonTypes) {
        if (cartonTypes == null) {
            throw new IllegalArgumentException("Carton type list cannot be null");
        }
        return new CartonInventory(cartonTypes);
    }

    public int size() {
        return cartonTypes.size();
    }

    public CartonType cartonType(int index) {
        return cartonTypes.get(index);
    }

    public int remaining(int index) {
        return remaining[index];
    }

    public boolean isAvailable(int index) {
        return remaining[index] > 0;
    }

    /**
     * Commits one physical carton of the given type.
     *
     * @throws IllegalStateException if no carton of that type is left
     */
    public void consumeOne(int index) {
        if (remaining[index] <= 0) {
            throw new IllegalStateException("No cartons left of type " + index + " (" + cartonTypes.get(index) + ")");
        }
        remaining[index]--;
    }
}
