/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Most recent result of one laboratory test")
public record LatestLabDTO(
        Double value,
        String unit,
        @Schema(description = "Out-of-range flag, empty when within reference") String flag,
        Instant takenAt) {}
