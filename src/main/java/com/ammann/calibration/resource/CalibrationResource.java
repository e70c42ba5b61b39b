/* (C)2026 */
package com.ammann.calibration.resource;

import com.ammann.calibration.dto.BoundedProductRequestDTO;
import com.ammann.calibration.dto.CalibrationLayerDTO;
import com.ammann.calibration.dto.CalibrationSummaryDTO;
import com.ammann.calibration.dto.ClampResultDTO;
import com.ammann.calibration.dto.DriftReportDTO;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.model.ClampResult;
import com.ammann.calibration.properties.ApiProperties;
import com.ammann.calibration.service.DriftDetectionService;
import com.ammann.calibration.service.InteractionGovernor;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the loaded calibration, layer drift and the governor's
 * bounded multiplicative product.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Calibration.BASE)
@Tag(name = "Calibration API", description = "Calibration state, drift audits and governor operations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CalibrationResource {

    private static final Logger LOG = Logger.getLogger(CalibrationResource.class);

    @Inject CalibrationContext context;

    @Inject DriftDetectionService driftDetectionService;

    @Inject InteractionGovernor governor;

    @GET
    @Path(ApiProperties.Calibration.SUMMARY)
    @Operation(
            summary = "Calibration summary",
            description = "Cohort, version, fingerprint, weight sets and dependency graph order")
    public Response getSummary() {
        return Response.ok(CalibrationSummaryDTO.from(context)).build();
    }

    @GET
    @Path(ApiProperties.Calibration.LAYERS)
    @Operation(summary = "Calibration layers", description = "Current version of every calibration layer")
    public Response getLayers() {
        List<CalibrationLayerDTO> layers = context.currentLayers().values().stream()
                .map(layer -> CalibrationLayerDTO.from(layer, context.layerHistory(layer.layerId())))
                .toList();
        return Response.ok(layers).build();
    }

    @GET
    @Path(ApiProperties.Calibration.LAYER_DRIFT)
    @Operation(
            summary = "Layer drift",
            description = "Compares two versions of a layer; defaults to the current version and its predecessor")
    public Response getDrift(
            @PathParam("layerId") String layerId,
            @QueryParam("from") String fromVersion,
            @QueryParam("to") String toVersion) {
        return Response.ok(DriftReportDTO.from(
                        driftDetectionService.detect(context, layerId, fromVersion, toVersion)))
                .build();
    }

    @POST
    @Path(ApiProperties.Calibration.BOUNDED_PRODUCT)
    @Operation(
            summary = "Bounded multiplicative product",
            description = "Multiplies the factors and clamps the product into the calibration's product bounds")
    public Response boundedProduct(BoundedProductRequestDTO request) {
        if (request == null) {
            throw ValidationException.missingField("factors");
        }
        ClampResult result = governor.boundedProduct(context.multiplicativeBounds(), request.toFactors());
        if (result.clamped()) {
            LOG.debugf("Bounded product request clamped %s to %s", result.rawProduct(), result.value());
        }
        return Response.ok(ClampResultDTO.from(result)).build();
    }
}
