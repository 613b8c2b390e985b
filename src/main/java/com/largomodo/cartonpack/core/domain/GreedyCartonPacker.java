package com.largomodo.cartonpack.core.domain;

import com.largomodo.cartonpack.core.AllocationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy carton allocator committing one physical carton per round.
 * <p>
 * Each round picks the (carton type, orientation) pair that places the most units, capped by
 * the remaining demand, among carton types still in stock. Ties go to the earliest carton type
 * in input order, then the earliest orientation in {@link Orientation} order. The loop ends when
 * demand reaches zero or no carton in stock can take another unit.
 * <p>
 * Each round either retires a carton instance or ends the loop, so the round count is bounded by
 * the product quantity plus the number of carton types. Per-round cost is O(types x 6).
 */
public class GreedyCartonPacker implements CartonPacker {

    private static final Logger log = LoggerFactory.getLogger(GreedyCartonPacker.class);

    private final OrientationEvaluator evaluator;
    private final AllocationObserver observer;

    public GreedyCartonPacker() {
        this(new OrientationEvaluator(), new AllocationObserver() {});
    }

    public GreedyCartonPacker(AllocationObserver observer) {
        this(new OrientationEvaluator(), observer);
    }

    public GreedyCartonPacker(OrientationEvaluator evaluator, AllocationObserver observer) {
        if (evaluator == null || observer == null) {
            throw new IllegalArgumentException("evaluator and observer must not be null");
        }
        this.evaluator = evaluator;
        this.observer = observer;
    }

    @Override
    public PackingResult allocate(Product product, List<CartonType> cartons) {
        if (product == null) {
            throw new IllegalArgumentException("Product cannot be null");
        }
        if (cartons == null) {
            throw new IllegalArgumentException("Carton list cannot be null");
        }

        CartonInventory inventory = CartonInventory.of(cartons);

        // Geometry is static for the whole call; only stock and demand change between rounds
        List<List<FitRecord>> fitsByCarton = new ArrayList<>(inventory.size());
        for (int i = 0; i < inventory.size(); i++) {
            List<FitRecord> fits = evaluator.feasibleFits(product, inventory.cartonType(i), i);
            if (fits.isEmpty()) {
                log.debug("Carton {} ({}) cannot hold product {} in any orientation",
                        i, inventory.cartonType(i), product);
            }
            fitsByCarton.add(fits);
        }

        PackingPlanAccumulator plan = new PackingPlanAccumulator();
        int remainingDemand = product.quantity();
        int round = 0;

        while (remainingDemand > 0) {
            round++;
            FitRecord best = null;
            int bestUnits = 0;

            for (int i = 0; i < inventory.size(); i++) {
                if (!inventory.isAvailable(i)) {
                    continue;
                }
                for (FitRecord fit : fitsByCarton.get(i)) {
                    int units = fit.cappedCapacity(remainingDemand);
                    // Strictly greater keeps the first-encountered pair on ties
                    if (units > bestUnits) {
                        best = fit;
                        bestUnits = units;
                    }
                }
            }

            if (best == null) {
                log.debug("Round {}: no carton in stock can take more units, {} left unpacked",
                        round, remainingDemand);
                observer.onInfeasible(remainingDemand);
                break;
            }

            CartonType chosen = inventory.cartonType(best.cartonIndex());
            inventory.consumeOne(best.cartonIndex());
            remainingDemand -= bestUnits;
            plan.commit(best, chosen, bestUnits);

            log.debug("Round {}: carton {} orientation {} takes {} units ({} left, {} cartons of this type left)",
                    round, best.cartonIndex(), best.orientation().id(), bestUnits,
                    remainingDemand, inventory.remaining(best.cartonIndex()));
            observer.onCommit(best, bestUnits, remainingDemand);
        }

        PackingResult result = plan.toResult(remainingDemand, product.quantity());
        observer.onComplete(result);
        return result;
    }
}
