package com.largomodo.cartonpack.format;

import com.largomodo.cartonpack.core.domain.PackingPlanEntry;
import com.largomodo.cartonpack.core.domain.PackingResult;
import com.largomodo.cartonpack.core.domain.PackingSummary;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Renders a packing result as comma-separated values.
 * <p>
 * Plan rows follow a header line; the remaining demand is written as a trailing
 * {@code remaining_demand,<n>} row so a single file carries the whole result.
 */
public class CsvReportFormatter implements ReportFormatter {

    static final String PLAN_HEADER =
            "carton_index,orientation,fit_lengthwise,fit_breadthwise,fit_heightwise,cartons_used,total_items";
    static final String SUMMARY_HEADER = "carton_index,volume_utilisation,weight_carried,weight_utilisation";

    @Override
    public void writePlan(PackingResult result, PrintWriter out) {
        out.println(PLAN_HEADER);
        for (PackingPlanEntry entry : result.entries()) {
            out.println(entry.cartonIndex() + "," + entry.orientation().id() + ","
                    + entry.fitLengthwise() + "," + entry.fitBreadthwise() + "," + entry.fitHeightwise() + ","
                    + entry.cartonsUsed() + "," + entry.totalItems());
        }
        out.println("remaining_demand," + result.remainingDemand());
    }

    @Override
    public void writeSummary(PackingSummary summary, PrintWriter out) {
        out.println(SUMMARY_HEADER);
        for (PackingSummary.EntryStatistics stats : summary.entries()) {
            out.printf(Locale.ROOT, "%d,%.4f,%.4f,%.4f%n", stats.cartonIndex(), stats.volumeUtilisation(),
                    stats.weightCarried(), stats.weightUtilisation());
        }
        out.printf(Locale.ROOT, "average_volume_utilisation,%.4f%n", summary.averageVolumeUtilisation());
        out.printf(Locale.ROOT, "packing_rate,%.4f%n", summary.packingRate());
        out.println("packing_success," + summary.packingSuccess());
    }
}
