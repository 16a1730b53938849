/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;

public record AdmittedPatientsDTO(String sectorId, List<AdmittedPatientDTO> patients) {}
