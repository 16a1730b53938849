/* (C)2026 */
package com.ammann.clinicalkpi.resource;

import com.ammann.clinicalkpi.dto.AdmittedPatientsDTO;
import com.ammann.clinicalkpi.dto.SectorListDTO;
import com.ammann.clinicalkpi.properties.ApiProperties;
import com.ammann.clinicalkpi.service.SectorDirectoryService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Sectors API", description = "Known sectors and current occupancy")
@Produces(MediaType.APPLICATION_JSON)
public class SectorResource {

    @Inject SectorDirectoryService sectorDirectoryService;

    @GET
    @Path(ApiProperties.Sectors.BASE)
    @Operation(summary = "List Sectors", description = "Sector identifiers that have recorded stays.")
    @APIResponse(
            responseCode = "200",
            description = "Sectors listed",
            content = @Content(schema = @Schema(implementation = SectorListDTO.class)))
    public Response listSectors() {
        return Response.ok(sectorDirectoryService.listSectors()).build();
    }

    @GET
    @Path(ApiProperties.Sectors.ADMITTED)
    @Operation(
            summary = "List Admitted Patients",
            description = "Admissions with an open stay in the sector that are not yet discharged.")
    @APIResponse(
            responseCode = "200",
            description = "Admitted patients listed",
            content = @Content(schema = @Schema(implementation = AdmittedPatientsDTO.class)))
    public Response listAdmitted(@PathParam("sectorId") String sectorId) {
        return Response.ok(sectorDirectoryService.listAdmitted(sectorId)).build();
    }
}
