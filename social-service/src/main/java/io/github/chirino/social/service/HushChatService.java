package io.github.chirino.social.service;

import io.github.chirino.social.api.dto.HushChatDto;
import io.github.chirino.social.api.dto.HushInviteDto;
import io.github.chirino.social.api.dto.HushJoinRequestDto;
import io.github.chirino.social.api.dto.HushListDto;
import io.github.chirino.social.api.dto.HushMembershipDto;
import io.github.chirino.social.api.dto.HushMessageDto;
import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;
import io.github.chirino.social.persistence.entity.HushChatEntity;
import io.github.chirino.social.persistence.entity.HushMembershipEntity;
import io.github.chirino.social.persistence.entity.HushMessageEntity;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.persistence.repo.HushChatRepository;
import io.github.chirino.social.persistence.repo.HushMembershipRepository;
import io.github.chirino.social.persistence.repo.HushMessageRepository;
import io.github.chirino.social.security.SocialAuditLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Hush chats: small invite-or-request group chats with a single owner. Membership rows move
 * through the states documented on {@link HushMemberStatus}; a chat closes when its owner leaves
 * and at most two members were still active.
 */
@ApplicationScoped
public class HushChatService {

    private static final Logger LOG = Logger.getLogger(HushChatService.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final String UNKNOWN_NAME = "user";
    private static final String LABEL_SEPARATOR = " + ";

    @Inject HushChatRepository chatRepository;

    @Inject HushMembershipRepository membershipRepository;

    @Inject HushMessageRepository messageRepository;

    @Inject IdentityLookup identityLookup;

    @Inject MessagePolicy messagePolicy;

    @Inject SocialAuditLogger auditLogger;

    @ConfigProperty(name = "social-service.hush.fallback-label", defaultValue = "hush")
    String fallbackLabel = "hush";

    /** Opens a new chat owned by the actor with the target invited. */
    @Transactional
    public HushChatDto createWith(UUID actorId, UUID targetUserId) {
        requireId("targetUserId", targetUserId);
        if (targetUserId.equals(actorId)) {
            throw new ValidationException("targetUserId", "cannot start a hush chat with yourself");
        }
        ProfileEntity actor = requireProfile(actorId);
        ProfileEntity target = requireProfile(targetUserId);

        HushChatEntity chat = chatRepository.createChat(actorId);
        List<HushMembershipEntity> members = new ArrayList<>();
        members.add(
                membershipRepository.createMembership(
                        chat.getId(),
                        actorId,
                        HushRole.OWNER,
                        HushMemberStatus.ACCEPTED,
                        actor.getUsername()));
        members.add(
                membershipRepository.createMembership(
                        chat.getId(),
                        targetUserId,
                        HushRole.MEMBER,
                        HushMemberStatus.INVITED,
                        target.getUsername()));
        auditLogger.logMembership(
                actorId, "create", chat.getId(), targetUserId, HushMemberStatus.INVITED);
        LOG.infof("Hush chat %s created by %s", chat.getId(), actorId);
        return toChatDto(chat, members, resolveNames(members), actorId);
    }

    /**
     * Invites a user into an open chat. Only a user without a row or whose row is declined, left
     * or removed can be invited.
     */
    @Transactional
    public HushMembershipDto invite(UUID actorId, UUID chatId, UUID targetUserId) {
        requireId("chatId", chatId);
        requireId("targetUserId", targetUserId);
        if (targetUserId.equals(actorId)) {
            throw new ValidationException("targetUserId", "cannot invite yourself");
        }
        requireActiveOwner(chatId, actorId);
        HushChatEntity chat = requireChat(chatId);
        requireOpen(chat);
        ProfileEntity target = requireProfile(targetUserId);
        membershipRepository
                .findMembership(chatId, targetUserId)
                .filter(existing -> !existing.getStatus().isReenterable())
                .ifPresent(
                        existing -> {
                            throw new InvalidStateException(
                                    "hush_membership",
                                    existing.getStatus().toValue(),
                                    "user is already " + existing.getStatus().toValue());
                        });
        int written =
                membershipRepository.upsertReentry(
                        chatId,
                        targetUserId,
                        HushRole.MEMBER,
                        HushMemberStatus.INVITED,
                        target.getUsername());
        if (written == 0) {
            throw new InvalidStateException(
                    "hush_membership", "active", "membership changed concurrently");
        }
        auditLogger.logMembership(
                actorId, "invite", chatId, targetUserId, HushMemberStatus.INVITED);
        return toMembershipDto(chatId, targetUserId, HushRole.MEMBER, HushMemberStatus.INVITED);
    }

    @Transactional
    public HushMembershipDto requestJoin(UUID actorId, UUID chatId) {
        requireId("chatId", chatId);
        HushChatEntity chat = requireChat(chatId);
        requireOpen(chat);
        membershipRepository
                .findMembership(chatId, actorId)
                .filter(existing -> !existing.getStatus().isReenterable())
                .ifPresent(
                        existing -> {
                            throw new InvalidStateException(
                                    "hush_membership",
                                    existing.getStatus().toValue(),
                                    "cannot request join");
                        });
        ProfileEntity actor = requireProfile(actorId);
        int written =
                membershipRepository.upsertReentry(
                        chatId,
                        actorId,
                        HushRole.MEMBER,
                        HushMemberStatus.REQUESTED,
                        actor.getUsername());
        if (written == 0) {
            throw new InvalidStateException("hush_membership", "active", "cannot request join");
        }
        auditLogger.logMembership(
                actorId, "request_join", chatId, actorId, HushMemberStatus.REQUESTED);
        return toMembershipDto(chatId, actorId, HushRole.MEMBER, HushMemberStatus.REQUESTED);
    }

    /** Owner decision on a pending join request. */
    @Transactional
    public HushMembershipDto resolveRequest(
            UUID actorId, UUID chatId, UUID memberUserId, boolean accept) {
        requireId("chatId", chatId);
        requireId("memberUserId", memberUserId);
        requireActiveOwner(chatId, actorId);
        HushMembershipEntity request =
                membershipRepository
                        .findMembership(chatId, memberUserId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "join_request", memberUserId.toString()));
        HushMemberStatus next = accept ? HushMemberStatus.ACCEPTED : HushMemberStatus.DECLINED;
        transition(request, HushMemberStatus.REQUESTED, next, "join request");
        auditLogger.logMembership(
                actorId, accept ? "accept_request" : "decline_request", chatId, memberUserId, next);
        return toMembershipDto(chatId, memberUserId, request.getRole(), next);
    }

    @Transactional
    public HushMembershipDto respondInvite(UUID actorId, UUID chatId, boolean accept) {
        requireId("chatId", chatId);
        HushMembershipEntity invite =
                membershipRepository
                        .findMembership(chatId, actorId)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("invite", chatId.toString()));
        HushMemberStatus next = accept ? HushMemberStatus.ACCEPTED : HushMemberStatus.DECLINED;
        transition(invite, HushMemberStatus.INVITED, next, "invite");
        auditLogger.logMembership(
                actorId, accept ? "accept_invite" : "decline_invite", chatId, actorId, next);
        return toMembershipDto(chatId, actorId, invite.getRole(), next);
    }

    /**
     * Marks the actor's row as left. When the owner leaves a chat that had at most two active
     * members before the leave, the chat is closed.
     */
    @Transactional
    public HushMembershipDto leave(UUID actorId, UUID chatId) {
        requireId("chatId", chatId);
        HushMembershipEntity membership =
                membershipRepository
                        .findMembership(chatId, actorId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "hush_membership", chatId.toString()));
        int activeBeforeLeave = 0;
        for (HushMembershipEntity member : membershipRepository.listForChat(chatId)) {
            if (member.getStatus().isActive()) {
                activeBeforeLeave++;
            }
        }
        membershipRepository.updateStatus(chatId, actorId, HushMemberStatus.LEFT);
        auditLogger.logMembership(actorId, "leave", chatId, actorId, HushMemberStatus.LEFT);
        if (membership.getRole() == HushRole.OWNER && activeBeforeLeave <= 2) {
            if (chatRepository.closeChat(chatId) > 0) {
                auditLogger.logChatClosed(actorId, chatId, activeBeforeLeave);
            }
        }
        return toMembershipDto(chatId, actorId, membership.getRole(), HushMemberStatus.LEFT);
    }

    /** Owner removes a member. Removing a user without a row does nothing. */
    @Transactional
    public void removeMember(UUID actorId, UUID chatId, UUID memberUserId) {
        requireId("chatId", chatId);
        requireId("memberUserId", memberUserId);
        if (memberUserId.equals(actorId)) {
            throw new ValidationException("memberUserId", "cannot remove yourself, leave instead");
        }
        requireActiveOwner(chatId, actorId);
        if (membershipRepository.findMembership(chatId, memberUserId).isEmpty()) {
            return;
        }
        membershipRepository.updateStatus(chatId, memberUserId, HushMemberStatus.REMOVED);
        auditLogger.logMembership(
                actorId, "remove_member", chatId, memberUserId, HushMemberStatus.REMOVED);
    }

    @Transactional
    public HushMessageDto sendMessage(UUID actorId, UUID chatId, String content) {
        requireId("chatId", chatId);
        HushMembershipEntity membership = requireAcceptedMember(chatId, actorId);
        String text = messagePolicy.normalizeContent(content);
        HushMessageEntity message = messageRepository.append(chatId, actorId, text);
        String name = membership.getDisplayName();
        if (name == null) {
            name = identityLookup.findProfile(actorId).map(ProfileEntity::getUsername).orElse(null);
        }
        return toMessageDto(message, name == null ? UNKNOWN_NAME : name);
    }

    /** The earliest messages of the chat in ascending creation order. */
    @Transactional
    public List<HushMessageDto> listMessages(UUID actorId, UUID chatId, Integer limit) {
        requireId("chatId", chatId);
        requireAcceptedMember(chatId, actorId);
        List<HushMessageEntity> messages =
                messageRepository.listEarliest(chatId, messagePolicy.clampLimit(limit));
        Map<UUID, String> names = resolveNames(membershipRepository.listForChat(chatId));
        Set<UUID> unknown = new HashSet<>();
        for (HushMessageEntity message : messages) {
            if (!names.containsKey(message.getUserId())) {
                unknown.add(message.getUserId());
            }
        }
        names.putAll(identityLookup.usernamesById(unknown));
        List<HushMessageDto> result = new ArrayList<>();
        for (HushMessageEntity message : messages) {
            String name = names.getOrDefault(message.getUserId(), UNKNOWN_NAME);
            result.add(toMessageDto(message, name));
        }
        return result;
    }

    /** Every open chat from the actor's point of view, plus invites and join requests for them. */
    @Transactional
    public HushListDto list(UUID actorId) {
        List<HushChatEntity> chats = chatRepository.listOpen();
        List<UUID> chatIds = new ArrayList<>();
        for (HushChatEntity chat : chats) {
            chatIds.add(chat.getId());
        }
        List<HushMembershipEntity> memberships = membershipRepository.listForChats(chatIds);
        Map<UUID, List<HushMembershipEntity>> byChat = new HashMap<>();
        for (HushMembershipEntity membership : memberships) {
            byChat.computeIfAbsent(membership.getChatId(), id -> new ArrayList<>()).add(membership);
        }
        Map<UUID, String> names = resolveNames(memberships);

        List<HushChatDto> chatDtos = new ArrayList<>();
        List<HushInviteDto> invites = new ArrayList<>();
        List<HushJoinRequestDto> requests = new ArrayList<>();
        for (HushChatEntity chat : chats) {
            List<HushMembershipEntity> members = byChat.getOrDefault(chat.getId(), List.of());
            HushChatDto dto = toChatDto(chat, members, names, actorId);
            chatDtos.add(dto);
            if (dto.getMembershipStatus() == HushMemberStatus.INVITED) {
                HushInviteDto invite = new HushInviteDto();
                invite.setChatId(dto.getId());
                invite.setFrom(dto.getLabel());
                invites.add(invite);
            }
            if (!actorId.equals(chat.getCreatedBy())) {
                continue;
            }
            for (HushMembershipEntity member : members) {
                if (member.getStatus() == HushMemberStatus.REQUESTED) {
                    HushJoinRequestDto request = new HushJoinRequestDto();
                    request.setChatId(chat.getId().toString());
                    request.setUserId(member.getUserId().toString());
                    request.setUsername(names.getOrDefault(member.getUserId(), UNKNOWN_NAME));
                    requests.add(request);
                }
            }
        }
        HushListDto dto = new HushListDto();
        dto.setChats(chatDtos);
        dto.setInvitesForMe(invites);
        dto.setRequestsForMe(requests);
        return dto;
    }

    private HushChatDto toChatDto(
            HushChatEntity chat,
            List<HushMembershipEntity> members,
            Map<UUID, String> names,
            UUID actorId) {
        List<String> labelNames = new ArrayList<>();
        HushMembershipEntity own = null;
        for (HushMembershipEntity member : members) {
            if (member.getStatus().isLabelVisible()) {
                labelNames.add(names.getOrDefault(member.getUserId(), UNKNOWN_NAME));
            }
            if (member.getUserId().equals(actorId)) {
                own = member;
            }
        }
        HushChatDto dto = new HushChatDto();
        dto.setId(chat.getId().toString());
        dto.setCreatedBy(chat.getCreatedBy().toString());
        dto.setStatus(chat.getStatus());
        dto.setCreatedAt(ISO_FORMATTER.format(chat.getCreatedAt()));
        dto.setLabel(
                labelNames.isEmpty() ? fallbackLabel : String.join(LABEL_SEPARATOR, labelNames));
        if (own != null) {
            dto.setMembershipStatus(own.getStatus());
            dto.setMembershipRole(own.getRole());
        }
        dto.setCanRequestJoin(own == null || own.getStatus().isReenterable());
        return dto;
    }

    /** Cached display name per member, falling back to the profile username. */
    private Map<UUID, String> resolveNames(List<HushMembershipEntity> memberships) {
        Map<UUID, String> names = new HashMap<>();
        Set<UUID> missing = new HashSet<>();
        for (HushMembershipEntity membership : memberships) {
            if (membership.getDisplayName() != null && !membership.getDisplayName().isBlank()) {
                names.put(membership.getUserId(), membership.getDisplayName());
            } else {
                missing.add(membership.getUserId());
            }
        }
        missing.removeAll(names.keySet());
        names.putAll(identityLookup.usernamesById(missing));
        return names;
    }

    private void transition(
            HushMembershipEntity membership,
            HushMemberStatus from,
            HushMemberStatus to,
            String what) {
        if (membership.getStatus() != from) {
            throw new InvalidStateException(
                    "hush_membership",
                    membership.getStatus().toValue(),
                    what + " is not pending (" + membership.getStatus().toValue() + ")");
        }
        int updated =
                membershipRepository.transition(
                        membership.getChatId(), membership.getUserId(), from, to);
        if (updated == 0) {
            throw new InvalidStateException(
                    "hush_membership", "changed", what + " was resolved concurrently");
        }
    }

    private HushChatEntity requireChat(UUID chatId) {
        return chatRepository
                .findChat(chatId)
                .orElseThrow(() -> new ResourceNotFoundException("hush_chat", chatId.toString()));
    }

    private static void requireOpen(HushChatEntity chat) {
        if (!chat.isOpen()) {
            throw new InvalidStateException(
                    "hush_chat", chat.getStatus().toValue(), "hush chat is closed");
        }
    }

    private void requireActiveOwner(UUID chatId, UUID actorId) {
        boolean owner =
                membershipRepository
                        .findMembership(chatId, actorId)
                        .map(HushMembershipEntity::isActiveOwner)
                        .orElse(false);
        if (!owner) {
            throw new AccessDeniedException("only the chat owner can do this");
        }
    }

    private HushMembershipEntity requireAcceptedMember(UUID chatId, UUID actorId) {
        return membershipRepository
                .findMembership(chatId, actorId)
                .filter(membership -> membership.getStatus() == HushMemberStatus.ACCEPTED)
                .orElseThrow(() -> new AccessDeniedException("not a member of this hush chat"));
    }

    private ProfileEntity requireProfile(UUID userId) {
        return identityLookup
                .findProfile(userId)
                .orElseThrow(() -> new ResourceNotFoundException("user", userId.toString()));
    }

    private static void requireId(String field, UUID id) {
        if (id == null) {
            throw new ValidationException(field, field + " is required");
        }
    }

    private static HushMembershipDto toMembershipDto(
            UUID chatId, UUID userId, HushRole role, HushMemberStatus status) {
        HushMembershipDto dto = new HushMembershipDto();
        dto.setChatId(chatId.toString());
        dto.setUserId(userId.toString());
        dto.setRole(role);
        dto.setStatus(status);
        return dto;
    }

    private static HushMessageDto toMessageDto(HushMessageEntity message, String username) {
        HushMessageDto dto = new HushMessageDto();
        dto.setId(message.getId().toString());
        dto.setChatId(message.getChatId().toString());
        dto.setUserId(message.getUserId().toString());
        dto.setUsername(username);
        dto.setContent(message.getContent());
        dto.setCreatedAt(ISO_FORMATTER.format(message.getCreatedAt()));
        return dto;
    }
}
