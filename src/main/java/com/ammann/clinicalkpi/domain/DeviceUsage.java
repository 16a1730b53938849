/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import com.ammann.clinicalkpi.enumeration.DeviceType;
import java.time.Instant;

/**
 * Interval during which a device was in place for an admission.
 */
public record DeviceUsage(
        String admissionId, String rawType, Instant start, Instant end, String endSource) {

    public DeviceType type() {
        return DeviceType.fromRaw(rawType);
    }
}
