/* (C)2026 */
package com.ammann.clinicalkpi.model;

import static com.ammann.clinicalkpi.support.TestDataFactory.ICU;
import static com.ammann.clinicalkpi.support.TestDataFactory.WARD;
import static com.ammann.clinicalkpi.support.TestDataFactory.createAdmission;
import static com.ammann.clinicalkpi.support.TestDataFactory.createDeviceDay;
import static com.ammann.clinicalkpi.support.TestDataFactory.createLabResult;
import static com.ammann.clinicalkpi.support.TestDataFactory.createStay;
import static com.ammann.clinicalkpi.support.TimeTestUtils.days;
import static com.ammann.clinicalkpi.support.TimeTestUtils.hours;
import static org.assertj.core.api.Assertions.assertThat;

import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ClinicalEntityIntegrationTest {

    @Test
    @TestTransaction
    void findOverlappingKeepsStayEndingAtWindowStart() {
        SectorStayEntity.deleteAll();

        SectorStayEntity.persist(
                createStay("a1", ICU, days(-3), days(0)), // ends exactly at the window start
                createStay("a2", ICU, days(-1), days(-0.5)),
                createStay("a3", ICU, days(2), null),
                createStay("a4", ICU, days(7), days(8)), // starts at the window end
                createStay("a5", WARD, days(1), days(2)));

        List<String> ids = SectorStayEntity.findOverlapping(ICU, days(0), days(7)).stream()
                .map(s -> s.admissionId)
                .toList();

        assertThat(ids).containsExactly("a1", "a3");
    }

    @Test
    @TestTransaction
    void findBySectorAndAdmissionsFiltersBoth() {
        SectorStayEntity.deleteAll();

        SectorStayEntity.persist(
                createStay("a1", ICU, days(3), days(4)),
                createStay("a1", ICU, days(1), days(2)),
                createStay("a1", WARD, days(2), days(3)),
                createStay("a2", ICU, days(1), null));

        List<SectorStayEntity> stays = SectorStayEntity.findBySectorAndAdmissions(ICU, List.of("a1"));

        assertThat(stays).extracting(s -> s.startAt).containsExactly(days(1), days(3));
        assertThat(stays).allSatisfy(s -> assertThat(s.sectorId).isEqualTo(ICU));
    }

    @Test
    @TestTransaction
    void findDischargedBetweenIsHalfOpen() {
        AdmissionEntity.deleteAll();

        AdmissionEntity.persist(
                createAdmission("a1", "p1", days(-5), days(0)),
                createAdmission("a2", "p2", days(-2), days(3)),
                createAdmission("a3", "p3", days(-1), days(7)),
                createAdmission("a4", "p4", days(-9), days(-1)),
                createAdmission("a5", "p5", days(1), null));

        List<String> ids = AdmissionEntity.findDischargedBetween(days(0), days(7)).stream()
                .map(a -> a.admissionId)
                .toList();

        assertThat(ids).containsExactly("a1", "a2");
    }

    @Test
    @TestTransaction
    void findForAdmissionMatchesTestNameIgnoringCase() {
        LabResultEntity.deleteAll();

        LabResultEntity.persist(
                createLabResult("a1", "Creatinina", hours(2), 1.4),
                createLabResult("a1", "creatinina", hours(1), 1.1),
                createLabResult("a1", "LACTATO", hours(3), 3.0),
                createLabResult("a1", "sodio", hours(4), 140.0),
                createLabResult("a2", "creatinina", hours(1), 0.9));

        List<LabResultEntity> results =
                LabResultEntity.findForAdmission("a1", List.of("creatinina", "lactato"));

        assertThat(results).extracting(r -> r.value).containsExactly(1.1, 1.4, 3.0);
    }

    @Test
    @TestTransaction
    void findInSectorExcludesUpperDay() {
        DeviceDayEntity.deleteAll();
        LocalDate first = LocalDate.of(2024, 1, 2);

        DeviceDayEntity.persist(
                createDeviceDay("a1", ICU, first.minusDays(1), true),
                createDeviceDay("a1", ICU, first, true),
                createDeviceDay("a2", ICU, first.plusDays(1), false),
                createDeviceDay("a1", ICU, first.plusDays(2), true),
                createDeviceDay("a3", WARD, first, true));

        List<DeviceDayEntity> rows = DeviceDayEntity.findInSector(ICU, first, first.plusDays(2));

        assertThat(rows).extracting(r -> r.day).containsExactly(first, first.plusDays(1));
        assertThat(rows).extracting(r -> r.admissionId).containsExactly("a1", "a2");
    }
}
