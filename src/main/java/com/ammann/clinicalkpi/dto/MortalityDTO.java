/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Deaths among admissions discharged in the period")
public record MortalityDTO(
        @Schema(description = "Deaths") long deaths,
        @Schema(description = "Discharges of any outcome") long discharges,
        @Schema(description = "deaths / discharges, four decimals") double rate) {}
