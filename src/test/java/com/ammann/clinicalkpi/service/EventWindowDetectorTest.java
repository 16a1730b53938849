/* (C)2026 */
package com.ammann.clinicalkpi.service;

import static com.ammann.clinicalkpi.support.TestDataFactory.ICU;
import static com.ammann.clinicalkpi.support.TestDataFactory.WARD;
import static com.ammann.clinicalkpi.support.TestDataFactory.discharged;
import static com.ammann.clinicalkpi.support.TestDataFactory.ongoing;
import static com.ammann.clinicalkpi.support.TestDataFactory.stay;
import static com.ammann.clinicalkpi.support.TestDataFactory.ventilation;
import static com.ammann.clinicalkpi.support.TimeTestUtils.T0;
import static com.ammann.clinicalkpi.support.TimeTestUtils.hours;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import com.ammann.clinicalkpi.service.CohortResolver.DischargeCohort;
import com.ammann.clinicalkpi.service.EventWindowDetector.EventMatchCount;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EventWindowDetectorTest {

    private EventWindowDetector detector;

    @BeforeEach
    void setUp() {
        detector = EngineFixtures.eventWindowDetector();
    }

    @Test
    void defaultThresholdIsFortyEightHours() {
        assertThat(detector.threshold()).isEqualTo(Duration.ofHours(48));
    }

    @Test
    void gapEqualToThresholdMatches() {
        assertThat(detector.matchesWithin(T0, List.of(hours(48)), Duration.ofHours(48))).isTrue();
        assertThat(detector.matchesWithin(T0, List.of(hours(48.01)), Duration.ofHours(48))).isFalse();
    }

    @Test
    void candidateAtTriggerInstantIsNotAfterIt() {
        assertThat(detector.firstCandidateAfter(T0, List.of(T0, hours(3)))).contains(hours(3));
        assertThat(detector.firstCandidateAfter(hours(5), List.of(T0, hours(3)))).isEmpty();
    }

    @Test
    void onlyTheEarliestCandidateAfterTheTriggerIsConsidered() {
        EventMatchCount count =
                detector.countMatches(List.of(T0), List.of(hours(60), hours(10)), Duration.ofHours(48));

        assertThat(count).isEqualTo(new EventMatchCount(1, 1));
    }

    @Test
    void noTriggersMeansNoOpportunities() {
        assertThat(detector.countMatches(List.of(), List.of(hours(1)), Duration.ofHours(48)))
                .isEqualTo(EventMatchCount.NONE);
        assertThat(EventMatchCount.NONE.toRate().rate()).isZero();
    }

    @Nested
    @DisplayName("reintubation")
    class Reintubation {

        @Test
        void intubationBetweenTwoExtubationsMatchesOnlyTheFirst() {
            VentilationRecord record = ventilation("a1", List.of(T0.minusSeconds(3600), hours(5)), List.of(T0, hours(10)));

            EventMatchCount count = detector.detectReintubations(List.of(record));

            assertThat(count).isEqualTo(new EventMatchCount(1, 2));
            assertThat(count.toRate().rate()).isEqualTo(0.5);
            assertThat(detector.hasReintubation(record)).isTrue();
        }

        @Test
        void oneIntubationMayAnswerSeveralExtubations() {
            VentilationRecord record = ventilation("a1", List.of(hours(20)), List.of(T0, hours(10)));

            assertThat(detector.detectReintubations(List.of(record))).isEqualTo(new EventMatchCount(2, 2));
        }

        @Test
        void countsAcrossRecords() {
            VentilationRecord reintubated = ventilation("a1", List.of(hours(1)), List.of(T0));
            VentilationRecord extubatedOnce = ventilation("a2", List.of(), List.of(T0));
            VentilationRecord neverExtubated = ventilation("a3", List.of(T0), List.of());

            EventMatchCount count =
                    detector.detectReintubations(List.of(reintubated, extubatedOnce, neverExtubated));

            assertThat(count).isEqualTo(new EventMatchCount(1, 2));
            assertThat(detector.hasReintubation(extubatedOnce)).isFalse();
            assertThat(detector.hasReintubation(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("readmission")
    class Readmission {

        private final Admission index =
                discharged("a1", "p1", T0.minus(Duration.ofDays(5)), T0, AdmissionOutcome.DISCHARGED_ALIVE);

        @ParameterizedTest(name = "readmitted after {0}h -> {1}")
        @CsvSource({"47, 1", "48, 1", "49, 0"})
        void countsSameSectorReadmissionWithinThreshold(double gapHours, long expected) {
            Admission next = ongoing("a2", "p1", hours(gapHours));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU,
                            new DischargeCohort(List.of(index)),
                            List.of(index, next),
                            List.of(stay("a1", ICU, index.admittedAt(), T0), stay("a2", ICU, hours(gapHours), null)));

            assertThat(count).isEqualTo(new EventMatchCount(expected, 1));
        }

        @Test
        void admissionIntoAnotherSectorDoesNotCount() {
            Admission elsewhere = ongoing("a2", "p1", hours(10));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU,
                            new DischargeCohort(List.of(index)),
                            List.of(index, elsewhere),
                            List.of(stay("a1", ICU, index.admittedAt(), T0), stay("a2", WARD, hours(10), null)));

            assertThat(count).isEqualTo(new EventMatchCount(0, 1));
        }

        @Test
        void wardAdmissionInBetweenDoesNotHideSectorReadmission() {
            Admission ward = discharged("a2", "p1", hours(4), hours(20), AdmissionOutcome.DISCHARGED_ALIVE);
            Admission back = ongoing("a3", "p1", hours(30));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU,
                            new DischargeCohort(List.of(index)),
                            List.of(index, ward, back),
                            List.of(
                                    stay("a1", ICU, index.admittedAt(), T0),
                                    stay("a2", WARD, hours(4), hours(20)),
                                    stay("a3", ICU, hours(30), null)));

            assertThat(count).isEqualTo(new EventMatchCount(1, 1));
        }

        @Test
        void otherPatientsAdmissionsDoNotCount() {
            Admission stranger = ongoing("b1", "p2", hours(2));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU,
                            new DischargeCohort(List.of(index)),
                            List.of(index, stranger),
                            List.of(stay("a1", ICU, index.admittedAt(), T0), stay("b1", ICU, hours(2), null)));

            assertThat(count.matches()).isZero();
        }

        @Test
        void onlyDischargesAliveAreOpportunities() {
            Admission death = discharged("a3", "p3", T0.minus(Duration.ofDays(2)), T0, AdmissionOutcome.DECEASED);
            Admission transfer =
                    discharged("a4", "p4", T0.minus(Duration.ofDays(2)), T0, AdmissionOutcome.TRANSFERRED);
            List<SectorStay> stays = List.of(stay("a1", ICU, index.admittedAt(), T0));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU, new DischargeCohort(List.of(index, death, transfer)), List.of(index), stays);

            assertThat(count.opportunities()).isEqualTo(1);
        }

        @Test
        void candidateWithoutAdmissionIdIsSkipped() {
            Admission unidentified = ongoing(null, "p1", hours(5));
            Admission next = ongoing("a2", "p1", hours(20));

            EventMatchCount count =
                    detector.detectReadmissions(
                            ICU,
                            new DischargeCohort(List.of(index)),
                            List.of(index, unidentified, next),
                            List.of(stay("a1", ICU, index.admittedAt(), T0), stay("a2", ICU, hours(20), null)));

            assertThat(count).isEqualTo(new EventMatchCount(1, 1));
        }

        @Test
        void emptyCohortHasNoOpportunities() {
            assertThat(detector.detectReadmissions(ICU, DischargeCohort.EMPTY, List.of(), List.of()))
                    .isEqualTo(EventMatchCount.NONE);
        }
    }
}
