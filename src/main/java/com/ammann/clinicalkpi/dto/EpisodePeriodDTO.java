/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Episode interval, end absent while still running")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodePeriodDTO(
        @Schema(description = "Episode kind, e.g. ventilation or the raw device type") String type,
        @Schema(description = "Start") Instant start,
        @Schema(description = "End, absent when open") Instant end,
        @Schema(description = "How the end was recorded") String endSource) {}
