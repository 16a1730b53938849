/* (C)2026 */
package com.ammann.clinicalkpi.persistence;

import static com.ammann.clinicalkpi.support.TestDataFactory.ICU;
import static com.ammann.clinicalkpi.support.TestDataFactory.createDeviceDay;
import static com.ammann.clinicalkpi.support.TestDataFactory.createLabResult;
import static com.ammann.clinicalkpi.support.TestDataFactory.window;
import static com.ammann.clinicalkpi.support.TimeTestUtils.days;
import static com.ammann.clinicalkpi.support.TimeTestUtils.hours;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.clinicalkpi.domain.DeviceDayAggregate;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.enumeration.DeviceType;
import com.ammann.clinicalkpi.enumeration.LabTest;
import com.ammann.clinicalkpi.model.DeviceDayEntity;
import com.ammann.clinicalkpi.model.KpiSnapshotEntity;
import com.ammann.clinicalkpi.model.LabResultEntity;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PanacheClinicalRecordStoreIntegrationTest {

    @Inject
    PanacheClinicalRecordStore store;

    @Test
    @TestTransaction
    void upsertSnapshotReplacesRowWithSameKey() {
        KpiSnapshotEntity.deleteAll();
        QueryWindow week = window(days(0), days(7));

        boolean first = store.upsertSnapshot(ICU, week, days(7), "{\"run\": \"first\"}");
        boolean second = store.upsertSnapshot(ICU, week, days(8), "{\"run\": \"second\"}");

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(KpiSnapshotEntity.count()).isEqualTo(1);
        KpiSnapshotEntity row = KpiSnapshotEntity.findByKey(ICU, days(0), days(7)).orElseThrow();
        assertThat(row.computedAt).isEqualTo(days(8));
        assertThat(row.document).contains("second").doesNotContain("first");
    }

    @Test
    @TestTransaction
    void upsertSnapshotKeepsOtherWindowsApart() {
        KpiSnapshotEntity.deleteAll();

        assertThat(store.upsertSnapshot(ICU, window(days(0), days(7)), days(7), "{}")).isTrue();
        assertThat(store.upsertSnapshot(ICU, window(days(0), days(14)), days(14), "{}")).isTrue();

        assertThat(KpiSnapshotEntity.count()).isEqualTo(2);
    }

    @Test
    @TestTransaction
    void fetchLabResultsMatchesCodesAndEnglishNames() {
        LabResultEntity.deleteAll();

        LabResultEntity.persist(
                createLabResult("a1", "Creatinina", hours(1), 1.2),
                createLabResult("a1", "Lactate", hours(2), 2.5),
                createLabResult("a1", "glicemia", hours(3), 110.0));

        List<LabResult> results = store.fetchLabResults("a1", List.of("CREATININA", "lactate"));

        assertThat(results).extracting(LabResult::testName).containsExactly("Creatinina", "Lactate");
        assertThat(store.fetchLabResults("a1", LabTest.lookupNames()))
                .extracting(LabResult::testName)
                .contains("Creatinina", "Lactate");
    }

    @Test
    @TestTransaction
    void fetchDeviceDayAggregateUsesWholeDaysInsideWindow() {
        DeviceDayEntity.deleteAll();
        LocalDate day1 = LocalDate.of(2024, 1, 1);

        DeviceDayEntity.persist(
                createDeviceDay("a1", ICU, day1, true),
                createDeviceDay("a1", ICU, day1.plusDays(1), true),
                createDeviceDay("a2", ICU, day1.plusDays(2), false),
                createDeviceDay("a2", ICU, day1.plusDays(3), true));

        // midday start skips day 1, the end midnight of day 4 is exclusive
        DeviceDayAggregate aggregate = store.fetchDeviceDayAggregate(ICU, window(hours(12), days(3)));

        assertThat(aggregate.patientDays()).isEqualTo(2);
        assertThat(aggregate.deviceDays(DeviceType.CENTRAL_LINE)).isEqualTo(1);
        assertThat(aggregate.allAdmissionIds()).containsExactlyInAnyOrder("a1", "a2");
    }
}
