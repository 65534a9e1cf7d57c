package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.DirectChannelDto;
import io.github.chirino.social.api.dto.DirectChatOrderRequest;
import io.github.chirino.social.api.dto.DirectMessageDto;
import io.github.chirino.social.api.dto.SendMessageRequest;
import io.github.chirino.social.api.dto.TargetUserRequest;
import io.github.chirino.social.service.DirectChannelService;
import io.github.chirino.social.service.SocialOperations;
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
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Path("/v1/direct-chats")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DirectChatsResource {

    @Inject DirectChannelService directChannelService;

    @Inject SocialOperations operations;

    @Inject SecurityIdentity identity;

    private UUID currentUserId() {
        return Ids.actor(identity);
    }

    @GET
    public List<DirectChannelDto> list() {
        UUID actor = currentUserId();
        return operations.run(
                "dm.list", actor, null, () -> directChannelService.listChannels(actor));
    }

    @POST
    public DirectChannelDto open(@Valid TargetUserRequest request) {
        UUID actor = currentUserId();
        UUID target = Ids.uuid("targetUserId", request == null ? null : request.getTargetUserId());
        return operations.run(
                "dm.open", actor, target, () -> directChannelService.openChannel(actor, target));
    }

    @GET
    @Path("/{chatId}/messages")
    public List<DirectMessageDto> listMessages(
            @PathParam("chatId") String chatId, @QueryParam("limit") Integer limit) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        return operations.run(
                "dm.messages",
                actor,
                chat,
                () -> directChannelService.listMessages(actor, chat, limit));
    }

    @POST
    @Path("/{chatId}/messages")
    public Response sendMessage(
            @PathParam("chatId") String chatId, @Valid SendMessageRequest request) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        String content = request == null ? null : request.getContent();
        DirectMessageDto message =
                operations.run(
                        "dm.send",
                        actor,
                        chat,
                        () -> directChannelService.sendMessage(actor, chat, content));
        return Response.status(Response.Status.CREATED).entity(message).build();
    }

    @DELETE
    @Path("/{chatId}")
    public Response remove(@PathParam("chatId") String chatId) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        operations.execute(
                "dm.remove", actor, chat, () -> directChannelService.remove(actor, chat));
        return Response.noContent().build();
    }

    @PUT
    @Path("/order")
    public Map<String, List<UUID>> order(@Valid DirectChatOrderRequest request) {
        UUID actor = currentUserId();
        List<UUID> ids =
                Ids.uuids("orderedChatIds", request == null ? null : request.getOrderedChatIds());
        List<UUID> kept =
                operations.run(
                        "dm.order", actor, null, () -> directChannelService.setOrder(actor, ids));
        return Map.of("orderedChatIds", kept);
    }
}
