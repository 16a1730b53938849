/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.ammann.clinicalkpi.calculation.StatisticsAggregator;
import com.ammann.clinicalkpi.domain.SummaryStatistics;
import java.util.Collection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Mean, median and P90 of a sample together with its size.
 *
 * @param mean   arithmetic mean, two decimals
 * @param median median, two decimals
 * @param p90    interpolated 90th percentile, two decimals
 * @param count  number of samples
 */
@Schema(description = "Summary statistics of a sample")
public record DistributionDTO(
        @Schema(description = "Mean") double mean,
        @Schema(description = "Median") double median,
        @Schema(description = "Interpolated 90th percentile") double p90,
        @Schema(description = "Number of samples") long count) {

    public static DistributionDTO fromSamples(Collection<Double> samples) {
        SummaryStatistics stats = StatisticsAggregator.summarize(samples);
        return new DistributionDTO(
                stats.mean(), stats.median(), stats.p90(), samples == null ? 0 : samples.size());
    }
}
