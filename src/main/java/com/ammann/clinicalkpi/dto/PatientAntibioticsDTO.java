/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;

public record PatientAntibioticsDTO(
        List<DrugTherapyDaysDTO> dotByDrug, List<AntibioticTimelineDTO> timelines) {}
