/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Share of discharges going to one destination")
public record DestinationShareDTO(
        @Schema(description = "Normalized destination label") String label,
        @Schema(description = "Discharges with this destination") long count,
        @Schema(description = "count / all discharges, four decimals") double fraction) {}
