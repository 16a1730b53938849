/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Unit-level KPI document for one sector and reporting period.
 *
 * <p>Presence-based figures ({@code cohort}, {@code los}, {@code devices},
 * {@code antibiotics}, {@code reintubation48h}) and discharge-based figures
 * ({@code mortality}, {@code readmission48h}, {@code destinationDistribution}) come from
 * two different cohorts and do not share denominators.
 */
@Schema(description = "Unit-level KPI report")
public record UnitKpiReportDTO(
        PeriodDTO period,
        String sectorId,
        CohortDTO cohort,
        LengthOfStayDTO los,
        MortalityDTO mortality,
        EventRateDTO readmission48h,
        EventRateDTO reintubation48h,
        List<DestinationShareDTO> destinationDistribution,
        UnitAntibioticsDTO antibiotics,
        UnitDevicesDTO devices) {}
