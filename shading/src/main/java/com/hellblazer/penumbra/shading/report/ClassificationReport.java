/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Penumbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.penumbra.shading.report;

import com.hellblazer.penumbra.shading.Classification;
import com.hellblazer.penumbra.shading.ClassificationResult;
import com.hellblazer.penumbra.shading.batch.BatchResult;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Fixed width text table of a batch: input summary and methodology header, one row per window, then the class
 * distribution and angle and Fsh statistics.
 *
 * @author hal.hildebrand
 */
public final class ClassificationReport {

    private static final int    WIDTH        = 80;
    private static final String RULE         = "=".repeat(WIDTH);
    private static final String THIN_RULE    = "-".repeat(WIDTH);
    private static final String ROW_FORMAT   = "%5s %7s %7s %8s %8s %14s %8s %7s";
    private static final int    DOMINANT_MAX = 14;

    private ClassificationReport() {
    }

    public static String render(BatchResult batch, double significanceThreshold) {
        var lines = new ArrayList<String>();
        lines.addAll(header(batch.size(), batch.shadingCount(), batch.contextItemCount(), batch.month(),
                            significanceThreshold));
        for (int i = 0; i < batch.size(); i++) {
            lines.add(row(i, batch.get(i)));
        }
        lines.addAll(summary(batch.results()));
        return String.join(System.lineSeparator(), lines);
    }

    public static List<String> header(int windows, int shadings, int contextItems, Month month,
                                      double significanceThreshold) {
        var lines = new ArrayList<String>();
        lines.add(RULE);
        lines.add("NEN 5060 WINDOW SHADING CLASSIFICATION");
        lines.add(RULE);
        lines.add("");
        lines.add("INPUT SUMMARY:");
        lines.add("  Windows: " + windows);
        lines.add("  Shading devices: " + shadings);
        lines.add("  Context buildings: " + contextItems);
        lines.add(String.format(Locale.ROOT, "  Analysis month: %d (%s)", month.getValue(),
                                month.getDisplayName(TextStyle.FULL, Locale.ENGLISH)));
        lines.add("");
        lines.add("METHODOLOGY:");
        lines.add("  - Context obstruction: blocks sky from 0deg up to context_angle");
        lines.add("  - Shading obstruction: blocks sky from shading_angle up to 90deg");
        lines.add("  - Comparison: context_blocked vs shading_blocked (= 90 - shading_angle)");
        lines.add(String.format(Locale.ROOT, "  - Threshold for 'significant': %.1fdeg", significanceThreshold));
        lines.add("");
        lines.add(THIN_RULE);
        lines.add(String.format(Locale.ROOT, ROW_FORMAT, "Win", "Ctx", "Shd", "Ctx_blk", "Shd_blk", "Dominant",
                                "Class", "Fsh"));
        lines.add(THIN_RULE);
        return lines;
    }

    public static String row(int index, ClassificationResult result) {
        var dominant = result.dominant().label();
        if (dominant.length() > DOMINANT_MAX) {
            dominant = dominant.substring(0, DOMINANT_MAX);
        }
        return String.format(Locale.ROOT, "%5d %7.1f %7.1f %8.1f %8.1f %14s %8s %7.3f", index, result.contextAngle(),
                             result.shadingAngle(), result.contextBlocked(), result.shadingBlocked(), dominant,
                             result.classification().abbreviation(), result.fsh());
    }

    public static List<String> summary(List<ClassificationResult> results) {
        int total = Math.max(1, results.size());
        var lines = new ArrayList<String>();
        lines.add("");
        lines.add(RULE);
        lines.add("SUMMARY");
        lines.add(RULE);
        lines.add("");
        lines.add("CLASSIFICATION DISTRIBUTION:");
        for (var classification : List.of(Classification.MINIMAL_OBSTRUCTION, Classification.OVERHANG,
                                          Classification.CONTEXT_OBSTRUCTION)) {
            long count = count(results, classification);
            lines.add(String.format(Locale.ROOT, "  %-20s %4d windows (%.1f%%)", classification.label() + ":", count,
                                    100.0 * count / total));
        }
        long errors = count(results, Classification.ERROR);
        if (errors > 0) {
            lines.add(String.format(Locale.ROOT, "  %-20s %4d windows", "Errors:", errors));
        }

        if (!results.isEmpty()) {
            lines.add("");
            lines.add("CONTEXT OBSTRUCTION:");
            lines.add(angleStatistics(results, ClassificationResult::contextAngle));
            lines.add("");
            lines.add("SHADING OBSTRUCTION:");
            lines.add(angleStatistics(results, ClassificationResult::shadingAngle));

            var fsh = results.stream().mapToDouble(ClassificationResult::fsh).summaryStatistics();
            lines.add("");
            lines.add("FSH FACTORS:");
            lines.add(String.format(Locale.ROOT, "  Range: %.3f to %.3f", fsh.getMin(), fsh.getMax()));
            lines.add(String.format(Locale.ROOT, "  Average: %.3f", fsh.getAverage()));
        }
        lines.add("");
        lines.add(RULE);
        return lines;
    }

    private static long count(List<ClassificationResult> results, Classification classification) {
        return results.stream().filter(r -> r.classification() == classification).count();
    }

    private static String angleStatistics(List<ClassificationResult> results,
                                          ToDoubleFunction<ClassificationResult> angle) {
        var stats = results.stream().mapToDouble(angle).summaryStatistics();
        return String.format(Locale.ROOT, "  Raw angles:  min=%.1fdeg  max=%.1fdeg  avg=%.1fdeg", stats.getMin(),
                             stats.getMax(), stats.getAverage());
    }
}
