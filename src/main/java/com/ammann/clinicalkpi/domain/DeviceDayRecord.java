/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import com.ammann.clinicalkpi.enumeration.DeviceType;
import java.time.LocalDate;

/**
 * One row per admission, calendar day and sector with the devices in place that day.
 */
public record DeviceDayRecord(
        String admissionId,
        String sectorId,
        LocalDate day,
        boolean centralLine,
        boolean urinaryCatheter,
        boolean arterialLine,
        boolean ventilated) {

    public boolean has(DeviceType type) {
        return switch (type) {
            case CENTRAL_LINE -> centralLine;
            case URINARY_CATHETER -> urinaryCatheter;
            case ARTERIAL_LINE -> arterialLine;
            case VENTILATION -> ventilated;
            case OTHER -> false;
        };
    }
}
