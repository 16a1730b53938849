/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.util.List;

/**
 * One antibiotic prescribed during an admission, with its closed dosing periods.
 */
public record AntibioticUsagePeriod(
        String antibioticUsageId,
        String admissionId,
        String antibioticName,
        List<TimePeriod> dosingPeriods) {

    public AntibioticUsagePeriod {
        dosingPeriods = dosingPeriods == null ? List.of() : List.copyOf(dosingPeriods);
    }
}
