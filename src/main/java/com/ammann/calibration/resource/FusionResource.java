/* (C)2026 */
package com.ammann.calibration.resource;

import com.ammann.calibration.dto.EvaluationRequestDTO;
import com.ammann.calibration.dto.EvaluationResponseDTO;
import com.ammann.calibration.model.FusionDecision;
import com.ammann.calibration.properties.ApiProperties;
import com.ammann.calibration.service.FusionDecisionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for evaluating units against the loaded calibration.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Fusion.BASE)
@Tag(name = "Fusion API", description = "Choquet fusion with veto cascade and audit recording")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FusionResource {

    @Inject FusionDecisionService decisionService;

    @POST
    @Path(ApiProperties.Fusion.EVALUATE)
    @Operation(
            summary = "Evaluate one unit",
            description = "Validates the eight layer scores and veto results, applies the veto cascade, "
                    + "fuses the scores with the role's weight set and records the decision in the manifest")
    public Response evaluate(EvaluationRequestDTO request) {
        FusionDecision decision = decisionService.evaluate(request);
        return Response.ok(EvaluationResponseDTO.from(decision)).build();
    }
}
