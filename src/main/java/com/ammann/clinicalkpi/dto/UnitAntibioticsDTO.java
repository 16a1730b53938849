/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Antibiotic use of the presence cohort")
public record UnitAntibioticsDTO(
        @Schema(description = "Antibiotics ordered by days of therapy, highest first")
                List<AntibioticRankingDTO> ranking,
        @Schema(description = "Days of therapy per antibiotic, same order as ranking")
                List<DrugTherapyDaysDTO> dotByDrug) {

    public static UnitAntibioticsDTO fromRanking(List<AntibioticRankingDTO> ranking) {
        List<DrugTherapyDaysDTO> dot =
                ranking.stream().map(r -> new DrugTherapyDaysDTO(r.name(), r.dotDays())).toList();
        return new UnitAntibioticsDTO(ranking, dot);
    }
}
