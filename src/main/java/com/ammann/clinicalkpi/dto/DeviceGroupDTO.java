/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Device usage intervals of one device category")
public record DeviceGroupDTO(
        @Schema(description = "Device category key") String type,
        List<EpisodePeriodDTO> usages) {}
