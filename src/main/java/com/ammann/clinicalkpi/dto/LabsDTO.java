/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Laboratory summary of one admission.
 *
 * @param latestByTest most recent result per test key
 * @param seriesByTest ascending series per test key; hemogram and blood gas tests are nested
 *                     under their panel key
 */
@Schema(description = "Laboratory results")
public record LabsDTO(Map<String, LatestLabDTO> latestByTest, Map<String, Object> seriesByTest) {}
