/* (C)2026 */
package com.ammann.clinicalkpi.calculation;

import com.ammann.clinicalkpi.domain.SummaryStatistics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Summary statistics over duration samples.
 *
 * <p>Every method tolerates empty input and returns zero instead of throwing or producing
 * {@code NaN}.
 */
public final class StatisticsAggregator {

    private static final int STATS_PRECISION = 2;

    private StatisticsAggregator() {}

    /**
     * Mean, median and 90th percentile of {@code samples}, each rounded to two decimals.
     *
     * @param samples sample values; {@code null} entries are ignored
     * @return statistics, {@link SummaryStatistics#ZERO} for an empty sample
     */
    public static SummaryStatistics summarize(Collection<Double> samples) {
        List<Double> sorted = sortedValues(samples);
        if (sorted.isEmpty()) {
            return SummaryStatistics.ZERO;
        }

        double mean = sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        return new SummaryStatistics(
                round(mean, STATS_PRECISION),
                round(median(sorted), STATS_PRECISION),
                round(percentile90(sorted), STATS_PRECISION));
    }

    /**
     * 90th percentile with linear interpolation between ranks.
     *
     * <p>For the sorted sample {@code s} of size {@code n}, the rank is {@code k = 0.9 * (n - 1)}.
     * An integral rank returns {@code s[k]}; otherwise the value is interpolated between
     * {@code s[floor(k)]} and {@code s[ceil(k)]} by the fractional part of {@code k}.
     *
     * @param samples sample values
     * @return unrounded percentile, 0 for an empty sample
     */
    public static double percentile90(Collection<Double> samples) {
        List<Double> sorted = sortedValues(samples);
        if (sorted.isEmpty()) {
            return 0.0;
        }
        double rank = 0.9 * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted.get(lower);
        }
        double low = sorted.get(lower);
        double high = sorted.get(upper);
        return low + (rank - lower) * (high - low);
    }

    /**
     * {@code numerator / denominator} rounded to {@code precision} decimals, or 0 when the
     * denominator is 0.
     */
    public static double safeRatio(double numerator, double denominator, int precision) {
        if (denominator == 0.0) {
            return 0.0;
        }
        return round(numerator / denominator, precision);
    }

    public static double round(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    private static double median(List<Double> sorted) {
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return sorted.get(size / 2);
    }

    private static List<Double> sortedValues(Collection<Double> samples) {
        if (samples == null) {
            return List.of();
        }
        return samples.stream().filter(Objects::nonNull).sorted().toList();
    }
}
