package com.largomodo.cartonpack.format;

import com.largomodo.cartonpack.core.domain.PackingResult;
import com.largomodo.cartonpack.core.domain.PackingSummary;

import java.io.PrintWriter;

/**
 * Strategy interface for rendering a packing result.
 * <p>
 * Every format reports, per plan entry: carton index, orientation id (0-5), the three per-axis
 * fit counts, cartons used and total items, followed by the remaining demand.
 */
public interface ReportFormatter {

    /**
     * Writes the plan and remaining demand.
     *
     * @param result result to render
     * @param out    destination, not closed by this method
     */
    void writePlan(PackingResult result, PrintWriter out);

    /**
     * Writes utilisation statistics after the plan.
     *
     * @param summary summary computed for the same result
     * @param out     destination, not closed by this method
     */
    void writeSummary(PackingSummary summary, PrintWriter out);
}
