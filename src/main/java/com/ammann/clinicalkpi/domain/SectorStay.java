/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.time.Instant;

/**
 * One contiguous presence of an admission in a sector. A {@code null} end means the
 * admission is still in the sector.
 */
public record SectorStay(String admissionId, String sectorId, Instant start, Instant end) {

    public boolean isOpen() {
        return end == null;
    }
}
