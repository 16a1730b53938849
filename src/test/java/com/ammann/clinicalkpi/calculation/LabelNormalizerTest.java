/* (C)2026 */
package com.ammann.clinicalkpi.calculation;

import static com.ammann.clinicalkpi.support.TimeTestUtils.T0;
import static com.ammann.clinicalkpi.support.TimeTestUtils.days;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LabelNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "DISCHARGED_ALIVE, ward",
        "DECEASED, deceased",
        "TRANSFERRED, other-hospital",
        "UNKNOWN, ward"
    })
    void fallsBackToOutcomeWhenNoDestinationRecorded(AdmissionOutcome outcome, String expected) {
        assertThat(LabelNormalizer.normalizeDestination(admission(outcome, null))).isEqualTo(expected);
        assertThat(LabelNormalizer.normalizeDestination(admission(outcome, "   "))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "'  Home Care ', home care",
        "WARD, ward",
        "Hospice, hospice"
    })
    void recordedDestinationWinsAndIsNormalized(String destination, String expected) {
        assertThat(LabelNormalizer.normalizeDestination(admission(AdmissionOutcome.DECEASED, destination)))
                .isEqualTo(expected);
    }

    private static Admission admission(AdmissionOutcome outcome, String destination) {
        return new Admission("a1", "p1", T0, days(3), outcome, destination);
    }
}
