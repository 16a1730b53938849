/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;

public record PatientDevicesDTO(List<DeviceGroupDTO> byType) {}
