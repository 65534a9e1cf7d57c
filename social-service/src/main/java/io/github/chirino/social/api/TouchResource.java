package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.CreateTouchRequest;
import io.github.chirino.social.api.dto.DecisionRequest;
import io.github.chirino.social.api.dto.TouchListDto;
import io.github.chirino.social.api.dto.TouchOrderRequest;
import io.github.chirino.social.api.dto.TouchResultDto;
import io.github.chirino.social.service.SocialOperations;
import io.github.chirino.social.service.TouchService;
import io.github.chirino.social.service.ValidationException;
import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Path("/v1/touch")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TouchResource {

    @Inject TouchService touchService;

    @Inject SocialOperations operations;

    @Inject SecurityIdentity identity;

    private UUID currentUserId() {
        return Ids.actor(identity);
    }

    @GET
    public TouchListDto list() {
        UUID actor = currentUserId();
        return operations.run("touch.list", actor, null, () -> touchService.list(actor));
    }

    @POST
    @Path("/requests")
    public TouchResultDto request(@Valid CreateTouchRequest request) {
        UUID actor = currentUserId();
        String username = request == null ? null : request.getTargetUsername();
        return operations.run(
                "touch.request", actor, username, () -> touchService.request(actor, username));
    }

    @POST
    @Path("/requests/{requestId}/response")
    public TouchResultDto respond(
            @PathParam("requestId") String requestId, @Valid DecisionRequest decision) {
        UUID actor = currentUserId();
        Long id = Ids.number("requestId", requestId);
        boolean accept = requireDecision(decision).isAccept();
        return operations.run(
                "touch.respond", actor, id, () -> touchService.respond(actor, id, accept));
    }

    @DELETE
    @Path("/{userId}")
    public Response remove(@PathParam("userId") String userId) {
        UUID actor = currentUserId();
        UUID target = Ids.uuid("userId", userId);
        operations.execute("touch.remove", actor, target, () -> touchService.remove(actor, target));
        return Response.noContent().build();
    }

    @PUT
    @Path("/order")
    public Map<String, List<UUID>> order(@Valid TouchOrderRequest request) {
        UUID actor = currentUserId();
        List<UUID> ids =
                Ids.uuids("orderedUserIds", request == null ? null : request.getOrderedUserIds());
        List<UUID> kept =
                operations.run("touch.order", actor, null, () -> touchService.setOrder(actor, ids));
        return Map.of("orderedUserIds", kept);
    }

    static DecisionRequest requireDecision(DecisionRequest decision) {
        if (decision == null) {
            throw new ValidationException("decision", "decision is required");
        }
        return decision;
    }
}
