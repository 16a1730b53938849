/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.time.Instant;

public record LabResult(
        String admissionId, String testName, Instant takenAt, Double value, String unit) {}
