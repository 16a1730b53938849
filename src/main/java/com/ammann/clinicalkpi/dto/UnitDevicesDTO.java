/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Invasive device utilization in the sector")
public record UnitDevicesDTO(
        VentilationUtilizationDTO ventilation,
        DeviceUtilizationDTO catheter,
        DeviceUtilizationDTO urinaryCatheter,
        DeviceUtilizationDTO arterialLine) {}
