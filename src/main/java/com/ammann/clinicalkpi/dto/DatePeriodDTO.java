/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.time.LocalDate;

public record DatePeriodDTO(LocalDate start, LocalDate end) {}
