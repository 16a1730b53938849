/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Mechanical ventilation of one admission")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatientVentilationDTO(
        @Schema(description = "Total ventilated days, open periods counted up to now") double totalDays,
        @Schema(description = "Hours from admission to first intubation, absent if never intubated")
                Double timeToFirstIntubationHours,
        List<EpisodePeriodDTO> periods,
        List<Instant> extubations,
        @Schema(description = "True if any extubation was followed by intubation within 48h")
                boolean reintubated48h) {}
