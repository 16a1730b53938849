/* (C)2026 */
package com.ammann.clinicalkpi.service;

import static com.ammann.clinicalkpi.support.TestDataFactory.ICU;
import static com.ammann.clinicalkpi.support.TestDataFactory.WARD;
import static com.ammann.clinicalkpi.support.TestDataFactory.discharged;
import static com.ammann.clinicalkpi.support.TestDataFactory.stay;
import static com.ammann.clinicalkpi.support.TestDataFactory.window;
import static com.ammann.clinicalkpi.support.TimeTestUtils.T0;
import static com.ammann.clinicalkpi.support.TimeTestUtils.days;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import com.ammann.clinicalkpi.service.CohortResolver.DischargeCohort;
import com.ammann.clinicalkpi.service.CohortResolver.PresenceCohort;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CohortResolverTest {

    private final CohortResolver resolver = new CohortResolver();
    private final QueryWindow week = window(T0, days(7));
    private final Instant now = days(30);

    @Nested
    @DisplayName("presence cohort")
    class Presence {

        @Test
        void sumsOverlapOfAllQualifyingStaysOfAnAdmission() {
            PresenceCohort cohort =
                    resolver.resolvePresence(
                            ICU,
                            List.of(stay("a1", ICU, days(-2), days(1)), stay("a1", ICU, days(3), days(4.5))),
                            week,
                            now);

            assertThat(cohort.admissionIds()).containsExactly("a1");
            assertThat(cohort.lengthOfStayDays()).singleElement().satisfies(d -> assertThat(d).isCloseTo(2.5, within(1e-9)));
        }

        @Test
        void openStayIsClippedAtWindowEnd() {
            PresenceCohort cohort =
                    resolver.resolvePresence(ICU, List.of(stay("a1", ICU, days(-10), null)), week, now);

            assertThat(cohort.lengthOfStayDays()).containsExactly(7.0);
            assertThat(cohort.size()).isEqualTo(1);
        }

        @Test
        void ignoresOtherSectorsAndStaysOutsideTheWindow() {
            PresenceCohort cohort =
                    resolver.resolvePresence(
                            ICU,
                            List.of(
                                    stay("a1", WARD, days(1), days(2)),
                                    stay("a2", ICU, days(8), days(9)),
                                    stay("a3", ICU, days(-5), days(-1)),
                                    stay("a4", ICU, null, days(2))),
                            week,
                            now);

            assertThat(cohort.admissionIds()).isEmpty();
            assertThat(cohort.size()).isZero();
        }

        @Test
        void stayEndingAtWindowStartQualifiesWithoutContributingTime() {
            PresenceCohort cohort =
                    resolver.resolvePresence(ICU, List.of(stay("a1", ICU, days(-3), T0)), week, now);

            assertThat(cohort.contains("a1")).isTrue();
            assertThat(cohort.size()).isZero();
            assertThat(cohort.lengthOfStayDays()).isEmpty();
        }

        @Test
        void emptyInputGivesEmptyCohort() {
            assertThat(resolver.resolvePresence(ICU, List.of(), week, now)).isEqualTo(PresenceCohort.EMPTY);
            assertThat(resolver.resolvePresence(ICU, null, week, now)).isEqualTo(PresenceCohort.EMPTY);
        }

        @Test
        void nullIdIsNeverAMember() {
            PresenceCohort cohort =
                    resolver.resolvePresence(ICU, List.of(stay("a1", ICU, days(1), days(2))), week, now);

            assertThat(cohort.contains("a1")).isTrue();
            assertThat(cohort.contains(null)).isFalse();
            assertThat(PresenceCohort.EMPTY.contains(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("discharge cohort")
    class Discharges {

        @Test
        void keepsAdmissionsDischargedInWindowThatPassedThroughTheSector() {
            Admission inIcu = discharged("a1", "p1", days(-20), days(2), AdmissionOutcome.DECEASED);
            Admission wardOnly = discharged("a2", "p2", days(-3), days(3), AdmissionOutcome.DISCHARGED_ALIVE);
            Admission tooLate = discharged("a3", "p3", days(1), days(7), AdmissionOutcome.DISCHARGED_ALIVE);
            Admission alive = discharged("a4", "p4", days(-1), days(5), AdmissionOutcome.DISCHARGED_ALIVE);

            DischargeCohort cohort =
                    resolver.resolveDischarges(
                            ICU,
                            List.of(inIcu, wardOnly, tooLate, alive),
                            List.of(
                                    stay("a1", ICU, days(-20), days(-15)),
                                    stay("a2", WARD, days(-3), days(3)),
                                    stay("a3", ICU, days(1), days(6)),
                                    stay("a4", ICU, days(-1), days(4))),
                            week);

            assertThat(cohort.admissions()).containsExactly(inIcu, alive);
            assertThat(cohort.deaths()).isEqualTo(1);
            assertThat(cohort.dischargedAlive()).containsExactly(alive);
        }

        @Test
        void admissionWithoutIdIsLeftOut() {
            Admission unidentified = discharged(null, "p9", days(-2), days(1), AdmissionOutcome.DECEASED);
            Admission inIcu = discharged("a1", "p1", days(-2), days(2), AdmissionOutcome.DISCHARGED_ALIVE);

            DischargeCohort cohort =
                    resolver.resolveDischarges(
                            ICU,
                            List.of(unidentified, inIcu),
                            List.of(stay("a1", ICU, days(-2), days(2))),
                            week);

            assertThat(cohort.admissions()).containsExactly(inIcu);
        }

        @Test
        void emptyInputGivesEmptyCohort() {
            assertThat(resolver.resolveDischarges(ICU, List.of(), List.of(), week).size()).isZero();
        }
    }
}
