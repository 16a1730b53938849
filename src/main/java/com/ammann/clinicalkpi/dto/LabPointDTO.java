/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.time.Instant;

public record LabPointDTO(Instant takenAt, Double value) {}
