package com.largomodo.cartonpack.core;

import com.largomodo.cartonpack.core.domain.FitRecord;
import com.largomodo.cartonpack.core.domain.PackingResult;

/**
 * Observer interface for allocation loop events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only the
 * events they care about. Callbacks run synchronously on the allocating thread.
 * </p>
 * <pre>{@code
 * AllocationObserver observer = new AllocationObserver() {
 *     @Override
 *     public void onCommit(FitRecord fit, int units, int remainingDemand) {
 *         System.out.println("Carton " + fit.cartonIndex() + " takes " + units);
 *     }
 * };
 * }</pre>
 *
 * @see com.largomodo.cartonpack.core.domain.GreedyCartonPacker
 */
public interface AllocationObserver {

    /**
     * Called after one physical carton has been committed.
     *
     * @param fit             the carton type and orientation chosen
     * @param units           units placed in this carton
     * @param remainingDemand units still to place after this commit
     */
    default void onCommit(FitRecord fit, int units, int remainingDemand) {}

    /**
     * Called when the loop stops because no carton in stock can take another unit.
     *
     * @param remainingDemand units left unpacked (always > 0)
     */
    default void onInfeasible(int remainingDemand) {}

    /**
     * Called once per allocation with the final result.
     *
     * @param result the aggregated packing result
     */
    default void onComplete(PackingResult result) {}
}
