/* (C)2026 */
package com.ammann.calibration.resource;

import com.ammann.calibration.dto.ChainVerificationDTO;
import com.ammann.calibration.dto.ManifestEntryDTO;
import com.ammann.calibration.dto.ManifestVerificationDTO;
import com.ammann.calibration.properties.ApiProperties;
import com.ammann.calibration.service.CalibrationManifestService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
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

/**
 * REST resource giving auditors read and verification access to the calibration
 * manifest. There is no write endpoint: entries are only created by evaluations.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Manifest.BASE)
@Tag(name = "Manifest API", description = "Append-only audit trail of fusion decisions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ManifestResource {

    @Inject CalibrationManifestService manifest;

    @GET
    @Path(ApiProperties.Manifest.ENTRIES)
    @Operation(summary = "Recent manifest entries", description = "Newest entries first, 1 to 100")
    public Response getEntries(@QueryParam("limit") @DefaultValue("20") int limit) {
        List<ManifestEntryDTO> entries =
                manifest.latest(limit).stream().map(ManifestEntryDTO::from).toList();
        return Response.ok(entries).build();
    }

    @GET
    @Path(ApiProperties.Manifest.ENTRY)
    @Operation(summary = "Manifest entry", description = "One entry by sequence number")
    public Response getEntry(@PathParam("sequence") long sequence) {
        return Response.ok(ManifestEntryDTO.from(manifest.entry(sequence))).build();
    }

    @POST
    @Path(ApiProperties.Manifest.ENTRY_VERIFY)
    @Operation(
            summary = "Verify manifest entry",
            description = "Recomputes the inputs hash and chain hash and checks the signature")
    public Response verifyEntry(@PathParam("sequence") long sequence) {
        return Response.ok(ManifestVerificationDTO.from(manifest.verify(sequence))).build();
    }

    @GET
    @Path(ApiProperties.Manifest.VERIFY)
    @Operation(summary = "Verify manifest chain", description = "Walks the whole trail from the genesis hash")
    public Response verifyChain() {
        return Response.ok(ChainVerificationDTO.from(manifest.verifyChain())).build();
    }
}
