/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Sectors with recorded stays")
public record SectorListDTO(List<String> sectors) {}
