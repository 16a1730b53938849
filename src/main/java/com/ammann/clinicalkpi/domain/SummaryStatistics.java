/* (C)2026 */
package com.ammann.clinicalkpi.domain;

/**
 * Mean, median and interpolated 90th percentile of a sample, rounded to two decimals.
 */
public record SummaryStatistics(double mean, double median, double p90) {

    public static final SummaryStatistics ZERO = new SummaryStatistics(0.0, 0.0, 0.0);
}
