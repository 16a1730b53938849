/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Threshold-based event count against its opportunity base")
public record EventRateDTO(
        @Schema(description = "Matched events") long count,
        @Schema(description = "Opportunities considered") long base,
        @Schema(description = "count / base, four decimals") double rate) {}
