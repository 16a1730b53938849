/* (C)2026 */
package com.ammann.clinicalkpi.resource;

import com.ammann.clinicalkpi.dto.PatientKpiReportDTO;
import com.ammann.clinicalkpi.properties.ApiProperties;
import com.ammann.clinicalkpi.service.PatientKpiService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for the KPI report of a single admission.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Patient KPI API", description = "KPIs of a single admission")
@Produces(MediaType.APPLICATION_JSON)
public class PatientKpiResource {

    @Inject PatientKpiService patientKpiService;

    @GET
    @Path(ApiProperties.Kpi.PATIENT)
    @Operation(
            summary = "Get Patient KPIs",
            description =
                    "Returns stay length, ventilation, devices, antibiotics and laboratory summaries"
                            + " of one admission.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Patient report computed successfully",
                content = @Content(schema = @Schema(implementation = PatientKpiReportDTO.class))),
        @APIResponse(responseCode = "404", description = "Admission not found"),
        @APIResponse(responseCode = "503", description = "Clinical record store unavailable")
    })
    public Response getPatientReport(
            @Parameter(description = "Admission identifier") @PathParam("admissionId") String admissionId,
            @Parameter(description = "Sector context, echoed when the admission passed through it")
                    @QueryParam("sector")
                    String sector) {

        return Response.ok(patientKpiService.computePatientReport(admissionId, sector)).build();
    }
}
