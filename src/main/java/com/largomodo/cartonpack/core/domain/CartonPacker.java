package com.largomodo.cartonpack.core.domain;

import java.util.List;

/**
 * Strategy interface for allocating units of one product to an inventory of carton types.
 * <p>
 * Implementations must not modify the caller's carton list; every call works on its own
 * inventory snapshot, so a packer may be shared between threads.
 */
public interface CartonPacker {
    /**
     * Packs as many product units as possible into the fewest cartons.
     * <p>
     * Running out of suitable cartons is not an error: the result then reports a non-zero
     * remaining demand alongside whatever was packed.
     *
     * @param product  product to pack, must not be null
     * @param cartons  available carton types in priority order, must not be null
     * @return plan entries grouped by carton type plus the leftover quantity
     * @throws IllegalArgumentException if product or cartons is null
     */
    PackingResult allocate(Product product, List<CartonType> cartons);
}
