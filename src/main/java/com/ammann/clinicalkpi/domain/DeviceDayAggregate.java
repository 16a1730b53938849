/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import com.ammann.clinicalkpi.enumeration.DeviceType;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Device-day rollup for one sector and window.
 *
 * @param patientDays        number of admission-day rows
 * @param deviceDaysByType   rows with the device flag set, per device type
 * @param admissionIdsByType distinct admissions with at least one flagged row, per type
 * @param allAdmissionIds    distinct admissions with any row
 */
public record DeviceDayAggregate(
        long patientDays,
        Map<DeviceType, Long> deviceDaysByType,
        Map<DeviceType, Set<String>> admissionIdsByType,
        Set<String> allAdmissionIds) {

    public static final DeviceDayAggregate EMPTY = of(Set.of());

    public long deviceDays(DeviceType type) {
        return deviceDaysByType.getOrDefault(type, 0L);
    }

    public Set<String> admissionIds(DeviceType type) {
        return admissionIdsByType.getOrDefault(type, Set.of());
    }

    /**
     * Rolls device-day rows up into counts and distinct admission sets.
     *
     * @param rows rows already scoped to the sector and window
     * @return aggregate, all zeros for no rows
     */
    public static DeviceDayAggregate of(Collection<DeviceDayRecord> rows) {
        Map<DeviceType, Long> days = new EnumMap<>(DeviceType.class);
        Map<DeviceType, Set<String>> ids = new EnumMap<>(DeviceType.class);
        Set<String> all = new TreeSet<>();

        for (DeviceType type : DeviceType.values()) {
            if (type == DeviceType.OTHER) {
                continue;
            }
            days.put(type, 0L);
            ids.put(type, new TreeSet<>());
        }

        for (DeviceDayRecord row : rows) {
            if (row.admissionId() != null) {
                all.add(row.admissionId());
            }
            for (Map.Entry<DeviceType, Long> entry : days.entrySet()) {
                DeviceType type = entry.getKey();
                if (row.has(type)) {
                    entry.setValue(entry.getValue() + 1);
                    if (row.admissionId() != null) {
                        ids.get(type).add(row.admissionId());
                    }
                }
            }
        }

        Map<DeviceType, Set<String>> frozenIds = new EnumMap<>(DeviceType.class);
        ids.forEach((type, set) -> frozenIds.put(type, Set.copyOf(set)));

        return new DeviceDayAggregate(
                rows.size(), Map.copyOf(days), Map.copyOf(frozenIds), Set.copyOf(all));
    }
}
