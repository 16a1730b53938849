/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import static com.ammann.clinicalkpi.support.TestDataFactory.deviceDay;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.clinicalkpi.enumeration.DeviceType;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeviceDayAggregateTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);

    @Test
    void countsDaysAndDistinctAdmissionsPerDevice() {
        DeviceDayAggregate aggregate =
                DeviceDayAggregate.of(
                        List.of(
                                deviceDay("a1", DAY_1, true, true, false, true),
                                deviceDay("a1", DAY_2, true, false, false, false),
                                deviceDay("a2", DAY_1, false, true, false, false),
                                deviceDay("a3", DAY_1, false, false, false, false)));

        assertThat(aggregate.patientDays()).isEqualTo(4);
        assertThat(aggregate.allAdmissionIds()).containsExactlyInAnyOrder("a1", "a2", "a3");

        assertThat(aggregate.deviceDays(DeviceType.CENTRAL_LINE)).isEqualTo(2);
        assertThat(aggregate.admissionIds(DeviceType.CENTRAL_LINE)).containsExactly("a1");

        assertThat(aggregate.deviceDays(DeviceType.URINARY_CATHETER)).isEqualTo(2);
        assertThat(aggregate.admissionIds(DeviceType.URINARY_CATHETER))
                .containsExactlyInAnyOrder("a1", "a2");

        assertThat(aggregate.deviceDays(DeviceType.VENTILATION)).isEqualTo(1);
        assertThat(aggregate.deviceDays(DeviceType.ARTERIAL_LINE)).isZero();
        assertThat(aggregate.admissionIds(DeviceType.ARTERIAL_LINE)).isEmpty();
    }

    @Test
    void emptyAggregateHasZeroCounts() {
        assertThat(DeviceDayAggregate.EMPTY.patientDays()).isZero();
        assertThat(DeviceDayAggregate.EMPTY.deviceDays(DeviceType.VENTILATION)).isZero();
        assertThat(DeviceDayAggregate.EMPTY.deviceDays(DeviceType.OTHER)).isZero();
        assertThat(DeviceDayAggregate.EMPTY.allAdmissionIds()).isEmpty();
    }

    @Test
    void aggregateIsImmutable() {
        DeviceDayAggregate aggregate =
                DeviceDayAggregate.of(List.of(deviceDay("a1", DAY_1, true, false, false, false)));

        assertThatThrownBy(() -> aggregate.admissionIds(DeviceType.CENTRAL_LINE).add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> aggregate.allAdmissionIds().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
