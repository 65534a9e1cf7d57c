package io.github.chirino.social.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.social.api.dto.ChatInvitePayload;
import io.github.chirino.social.api.dto.ChatMemberPayload;
import io.github.chirino.social.api.dto.ChatMessagesPayload;
import io.github.chirino.social.api.dto.ChatRefPayload;
import io.github.chirino.social.api.dto.ChatSendPayload;
import io.github.chirino.social.api.dto.CreateTouchRequest;
import io.github.chirino.social.api.dto.DirectChatOrderRequest;
import io.github.chirino.social.api.dto.OpsRequest;
import io.github.chirino.social.api.dto.OpsResponse;
import io.github.chirino.social.api.dto.SnapshotDto;
import io.github.chirino.social.api.dto.TargetUserRequest;
import io.github.chirino.social.api.dto.TouchDecisionPayload;
import io.github.chirino.social.api.dto.TouchOrderRequest;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.service.DirectChannelService;
import io.github.chirino.social.service.HushChatService;
import io.github.chirino.social.service.IdentityLookup;
import io.github.chirino.social.service.SocialOperations;
import io.github.chirino.social.service.TouchService;
import io.github.chirino.social.service.ValidationException;
import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Single action endpoint used by the gateway: {@code {"action": verb, "payload": {...}}}. Each
 * verb binds its payload to a typed request before reaching an engine.
 */
@Path("/v1/ops")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OpsResource {

    private static final Logger LOG = Logger.getLogger(OpsResource.class);

    @Inject TouchService touchService;

    @Inject HushChatService hushChatService;

    @Inject DirectChannelService directChannelService;

    @Inject IdentityLookup identityLookup;

    @Inject SocialOperations operations;

    @Inject ObjectMapper objectMapper;

    @Inject Validator validator;

    @Inject SecurityIdentity identity;

    @POST
    public OpsResponse perform(OpsRequest request) {
        UUID actor = Ids.actor(identity);
        SocialAction action = SocialAction.fromVerb(request == null ? null : request.getAction());
        JsonNode payload = request.getPayload();
        LOG.debugf("Dispatching %s for %s", action.verb(), actor);
        Object data =
                operations.run(
                        action.verb(), actor, null, () -> dispatch(action, actor, payload));
        OpsResponse response = new OpsResponse();
        response.setOk(true);
        response.setAction(action.verb());
        response.setData(data);
        return response;
    }

    private Object dispatch(SocialAction action, UUID actor, JsonNode payload) {
        return switch (action) {
            case CONTEXT_SNAPSHOT -> snapshot(actor);
            case TOUCH_LIST -> touchService.list(actor);
            case TOUCH_REQUEST ->
                    touchService.request(
                            actor, bind(payload, CreateTouchRequest.class).getTargetUsername());
            case TOUCH_RESPOND -> {
                TouchDecisionPayload decision = bind(payload, TouchDecisionPayload.class);
                yield touchService.respond(actor, decision.getRequestId(), decision.getAccept());
            }
            case TOUCH_REMOVE -> {
                touchService.remove(actor, targetUser(payload));
                yield null;
            }
            case TOUCH_ORDER ->
                    touchService.setOrder(
                            actor,
                            Ids.uuids(
                                    "orderedUserIds",
                                    bind(payload, TouchOrderRequest.class).getOrderedUserIds()));
            case HUSH_LIST -> hushChatService.list(actor);
            case HUSH_CREATE_WITH -> hushChatService.createWith(actor, targetUser(payload));
            case HUSH_INVITE -> {
                ChatInvitePayload invite = bind(payload, ChatInvitePayload.class);
                yield hushChatService.invite(
                        actor,
                        Ids.uuid("chatId", invite.getChatId()),
                        Ids.uuid("targetUserId", invite.getTargetUserId()));
            }
            case HUSH_REQUEST_JOIN -> hushChatService.requestJoin(actor, chatRef(payload));
            case HUSH_ACCEPT_REQUEST, HUSH_DECLINE_REQUEST -> {
                ChatMemberPayload member = bind(payload, ChatMemberPayload.class);
                yield hushChatService.resolveRequest(
                        actor,
                        Ids.uuid("chatId", member.getChatId()),
                        Ids.uuid("memberUserId", member.getMemberUserId()),
                        action == SocialAction.HUSH_ACCEPT_REQUEST);
            }
            case HUSH_ACCEPT_INVITE -> hushChatService.respondInvite(actor, chatRef(payload), true);
            case HUSH_DECLINE_INVITE ->
                    hushChatService.respondInvite(actor, chatRef(payload), false);
            case HUSH_LEAVE -> hushChatService.leave(actor, chatRef(payload));
            case HUSH_REMOVE_MEMBER -> {
                ChatMemberPayload member = bind(payload, ChatMemberPayload.class);
                hushChatService.removeMember(
                        actor,
                        Ids.uuid("chatId", member.getChatId()),
                        Ids.uuid("memberUserId", member.getMemberUserId()));
                yield null;
            }
            case HUSH_MESSAGES -> {
                ChatMessagesPayload page = bind(payload, ChatMessagesPayload.class);
                yield hushChatService.listMessages(
                        actor, Ids.uuid("chatId", page.getChatId()), page.getLimit());
            }
            case HUSH_SEND -> {
                ChatSendPayload send = bind(payload, ChatSendPayload.class);
                yield hushChatService.sendMessage(
                        actor, Ids.uuid("chatId", send.getChatId()), send.getContent());
            }
            case DM_LIST -> directChannelService.listChannels(actor);
            case DM_OPEN -> directChannelService.openChannel(actor, targetUser(payload));
            case DM_MESSAGES -> {
                ChatMessagesPayload page = bind(payload, ChatMessagesPayload.class);
                yield directChannelService.listMessages(
                        actor, Ids.uuid("chatId", page.getChatId()), page.getLimit());
            }
            case DM_SEND -> {
                ChatSendPayload send = bind(payload, ChatSendPayload.class);
                yield directChannelService.sendMessage(
                        actor, Ids.uuid("chatId", send.getChatId()), send.getContent());
            }
            case DM_REMOVE -> {
                directChannelService.remove(actor, chatRef(payload));
                yield null;
            }
            case DM_ORDER ->
                    directChannelService.setOrder(
                            actor,
                            Ids.uuids(
                                    "orderedChatIds",
                                    bind(payload, DirectChatOrderRequest.class)
                                            .getOrderedChatIds()));
        };
    }

    private SnapshotDto snapshot(UUID actor) {
        SnapshotDto snapshot = new SnapshotDto();
        snapshot.setActorId(actor.toString());
        snapshot.setUsername(
                identityLookup.findProfile(actor).map(ProfileEntity::getUsername).orElse(null));
        snapshot.setTouch(touchService.list(actor));
        snapshot.setChats(directChannelService.listChannels(actor));
        snapshot.setHush(hushChatService.list(actor));
        return snapshot;
    }

    private UUID targetUser(JsonNode payload) {
        return Ids.uuid("targetUserId", bind(payload, TargetUserRequest.class).getTargetUserId());
    }

    private UUID chatRef(JsonNode payload) {
        return Ids.uuid("chatId", bind(payload, ChatRefPayload.class).getChatId());
    }

    private <T> T bind(JsonNode payload, Class<T> type) {
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        }
        if (!payload.isObject()) {
            throw new ValidationException("payload", "payload must be an object");
        }
        T bound;
        try {
            bound = objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload", "invalid payload: " + e.getOriginalMessage());
        }
        Set<ConstraintViolation<T>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return bound;
    }
}
