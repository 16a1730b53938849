/* (C)2026 */
package com.ammann.clinicalkpi.resource;

import com.ammann.clinicalkpi.calculation.IntervalMath;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.dto.UnitKpiReportDTO;
import com.ammann.clinicalkpi.exception.ValidationException;
import com.ammann.clinicalkpi.properties.ApiProperties;
import com.ammann.clinicalkpi.service.UnitKpiService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for unit-level (sector) KPI reports.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Unit KPI API", description = "Sector KPIs over a reporting window")
@Produces(MediaType.APPLICATION_JSON)
public class UnitKpiResource {

    private static final Logger LOG = Logger.getLogger(UnitKpiResource.class);
    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final String BOUNDARY_FORMAT = "YYYY-MM-DD or ISO-8601 timestamp with offset";

    @Inject UnitKpiService unitKpiService;

    @GET
    @Path(ApiProperties.Kpi.UNIT)
    @Operation(
            summary = "Get Unit KPIs",
            description =
                    "Computes length of stay, mortality, 48h readmission and reintubation, device"
                            + " utilization and antibiotic days of therapy for a sector over"
                            + " [from, to). Dates without a time are read as UTC midnight.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Unit report computed successfully",
                content = @Content(schema = @Schema(implementation = UnitKpiReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing or invalid parameters"),
        @APIResponse(responseCode = "503", description = "Clinical record store unavailable")
    })
    public Response getUnitReport(
            @Parameter(description = "Sector identifier", required = true) @QueryParam("sector")
                    String sector,
            @Parameter(description = "Window start (inclusive)", required = true)
                    @QueryParam("from")
                    String from,
            @Parameter(description = "Window end (exclusive)", required = true) @QueryParam("to")
                    String to,
            @Parameter(description = "Store the report as a snapshot")
                    @QueryParam("persist")
                    @DefaultValue("false")
                    boolean persist) {

        LOG.debugf("Unit KPI request: sector=%s, from=%s, to=%s, persist=%s", sector, from, to, persist);

        if (sector == null || sector.isBlank()) {
            throw ValidationException.missingParameter("sector");
        }
        Instant start = parseBoundary("from", from);
        Instant end = parseBoundary("to", to);
        if (start.isAfter(end)) {
            throw ValidationException.invalidParameter("from", from, "a value not after 'to'");
        }

        UnitKpiReportDTO report =
                unitKpiService.computeUnitReport(sector.trim(), new QueryWindow(start, end), persist);
        return Response.ok(report).build();
    }

    static Instant parseBoundary(String name, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter(name);
        }
        String text = value.trim();
        if (DATE_ONLY.matcher(text).matches()) {
            try {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e) {
                throw ValidationException.invalidParameter(name, value, BOUNDARY_FORMAT);
            }
        }
        Instant instant = IntervalMath.parseOffsetInstant(text);
        if (instant == null) {
            throw ValidationException.invalidParameter(name, value, BOUNDARY_FORMAT);
        }
        return instant;
    }
}
