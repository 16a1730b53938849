/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.ammann.clinicalkpi.domain.QueryWindow;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Reporting period, start inclusive and end exclusive")
public record PeriodDTO(
        @Schema(description = "Period start (inclusive)") Instant start,
        @Schema(description = "Period end (exclusive)") Instant end) {

    public static PeriodDTO of(QueryWindow window) {
        return new PeriodDTO(window.start(), window.end());
    }
}
