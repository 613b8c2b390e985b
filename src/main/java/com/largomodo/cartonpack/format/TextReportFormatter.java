package com.largomodo.cartonpack.format;

import com.largomodo.cartonpack.core.domain.PackingPlanEntry;
import com.largomodo.cartonpack.core.domain.PackingResult;
import com.largomodo.cartonpack.core.domain.PackingSummary;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Renders a packing result as an aligned plain-text table.
 */
public class TextReportFormatter implements ReportFormatter {

    private static final String ROW = "%-7s %-14s %-12s %-11s %-7s %-7s %-12s %s%n";

    @Override
    public void writePlan(PackingResult result, PrintWriter out) {
        if (result.entries().isEmpty()) {
            out.println("No carton can hold the product.");
        } else {
            out.printf(Locale.ROOT, ROW, "CARTON", "SIZE", "ORIENTATION", "LENGTHWISE", "BREADTH", "HEIGHT",
                    "CARTONS", "ITEMS");
            for (PackingPlanEntry entry : result.entries()) {
                out.printf(Locale.ROOT, ROW,
                        entry.cartonIndex(),
                        entry.cartonType().toString(),
                        entry.orientation().id(),
                        entry.fitLengthwise(),
                        entry.fitBreadthwise(),
                        entry.fitHeightwise(),
                        entry.cartonsUsed(),
                        entry.totalItems());
            }
        }
        out.printf(Locale.ROOT, "Packed %d of %d units in %d cartons, remaining demand: %d%n",
                result.packedQuantity(), result.requestedQuantity(), result.totalCartonsUsed(),
                result.remainingDemand());
    }

    @Override
    public void writeSummary(PackingSummary summary, PrintWriter out) {
        out.println();
        out.println("Summary:");
        for (PackingSummary.EntryStatistics stats : summary.entries()) {
            out.printf(Locale.ROOT, "  carton %d: volume utilisation %.1f%%, weight carried %.2f, weight utilisation %.1f%%%n",
                    stats.cartonIndex(), stats.volumeUtilisation() * 100, stats.weightCarried(),
                    stats.weightUtilisation() * 100);
        }
        out.printf(Locale.ROOT, "  average volume utilisation: %.1f%%%n", summary.averageVolumeUtilisation() * 100);
        out.printf(Locale.ROOT, "  packing rate: %.1f%%%n", summary.packingRate() * 100);
        out.printf(Locale.ROOT, "  packing success: %s%n", summary.packingSuccess() ? "yes" : "no");
    }
}
