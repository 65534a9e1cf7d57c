package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.DecisionRequest;
import io.github.chirino.social.api.dto.HushChatDto;
import io.github.chirino.social.api.dto.HushListDto;
import io.github.chirino.social.api.dto.HushMembershipDto;
import io.github.chirino.social.api.dto.HushMessageDto;
import io.github.chirino.social.api.dto.SendMessageRequest;
import io.github.chirino.social.api.dto.TargetUserRequest;
import io.github.chirino.social.service.HushChatService;
import io.github.chirino.social.service.SocialOperations;
import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.UUID;

@Path("/v1/hush-chats")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class HushChatsResource {

    @Inject HushChatService hushChatService;

    @Inject SocialOperations operations;

    @Inject SecurityIdentity identity;

    private UUID currentUserId() {
        return Ids.actor(identity);
    }

    @GET
    public HushListDto list() {
        UUID actor = currentUserId();
        return operations.run("hush.list", actor, null, () -> hushChatService.list(actor));
    }

    @POST
    public Response createWith(@Valid TargetUserRequest request) {
        UUID actor = currentUserId();
        UUID target = Ids.uuid("targetUserId", request == null ? null : request.getTargetUserId());
        HushChatDto chat =
                operations.run(
                        "hush.create_with",
                        actor,
                        target,
                        () -> hushChatService.createWith(actor, target));
        return Response.status(Response.Status.CREATED).entity(chat).build();
    }

    @POST
    @Path("/{chatId}/invitations")
    public HushMembershipDto invite(
            @PathParam("chatId") String chatId, @Valid TargetUserRequest request) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        UUID target = Ids.uuid("targetUserId", request == null ? null : request.getTargetUserId());
        return operations.run(
                "hush.invite", actor, target, () -> hushChatService.invite(actor, chat, target));
    }

    @POST
    @Path("/{chatId}/join-requests")
    public HushMembershipDto requestJoin(@PathParam("chatId") String chatId) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        return operations.run(
                "hush.request_join", actor, chat, () -> hushChatService.requestJoin(actor, chat));
    }

    @POST
    @Path("/{chatId}/join-requests/{userId}/response")
    public HushMembershipDto resolveRequest(
            @PathParam("chatId") String chatId,
            @PathParam("userId") String userId,
            @Valid DecisionRequest decision) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        UUID member = Ids.uuid("userId", userId);
        boolean accept = TouchResource.requireDecision(decision).isAccept();
        return operations.run(
                accept ? "hush.accept_request" : "hush.decline_request",
                actor,
                member,
                () -> hushChatService.resolveRequest(actor, chat, member, accept));
    }

    @POST
    @Path("/{chatId}/invitation/response")
    public HushMembershipDto respondInvite(
            @PathParam("chatId") String chatId, @Valid DecisionRequest decision) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        boolean accept = TouchResource.requireDecision(decision).isAccept();
        return operations.run(
                accept ? "hush.accept_invite" : "hush.decline_invite",
                actor,
                chat,
                () -> hushChatService.respondInvite(actor, chat, accept));
    }

    @POST
    @Path("/{chatId}/leave")
    public HushMembershipDto leave(@PathParam("chatId") String chatId) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        return operations.run("hush.leave", actor, chat, () -> hushChatService.leave(actor, chat));
    }

    @DELETE
    @Path("/{chatId}/members/{userId}")
    public Response removeMember(
            @PathParam("chatId") String chatId, @PathParam("userId") String userId) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        UUID member = Ids.uuid("userId", userId);
        operations.execute(
                "hush.remove_member",
                actor,
                member,
                () -> hushChatService.removeMember(actor, chat, member));
        return Response.noContent().build();
    }

    @GET
    @Path("/{chatId}/messages")
    public List<HushMessageDto> listMessages(
            @PathParam("chatId") String chatId, @QueryParam("limit") Integer limit) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        return operations.run(
                "hush.messages",
                actor,
                chat,
                () -> hushChatService.listMessages(actor, chat, limit));
    }

    @POST
    @Path("/{chatId}/messages")
    public Response sendMessage(
            @PathParam("chatId") String chatId, @Valid SendMessageRequest request) {
        UUID actor = currentUserId();
        UUID chat = Ids.uuid("chatId", chatId);
        String content = request == null ? null : request.getContent();
        HushMessageDto message =
                operations.run(
                        "hush.send",
                        actor,
                        chat,
                        () -> hushChatService.sendMessage(actor, chat, content));
        return Response.status(Response.Status.CREATED).entity(message).build();
    }
}
