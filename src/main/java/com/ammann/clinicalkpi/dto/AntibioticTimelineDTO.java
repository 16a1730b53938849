/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Dosing periods of one prescribed antibiotic, as UTC dates")
public record AntibioticTimelineDTO(String name, List<DatePeriodDTO> periods) {}
