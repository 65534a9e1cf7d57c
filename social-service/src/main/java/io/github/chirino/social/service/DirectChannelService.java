package io.github.chirino.social.service;

import io.github.chirino.social.api.dto.DirectChannelDto;
import io.github.chirino.social.api.dto.DirectMessageDto;
import io.github.chirino.social.persistence.entity.DirectChannelEntity;
import io.github.chirino.social.persistence.entity.DirectChannelOrderEntity;
import io.github.chirino.social.persistence.entity.DirectMessageEntity;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.persistence.repo.DirectChannelOrderRepository;
import io.github.chirino.social.persistence.repo.DirectChannelRepository;
import io.github.chirino.social.persistence.repo.DirectMessageRepository;
import io.github.chirino.social.persistence.repo.TouchRelationRepository;
import io.github.chirino.social.security.SocialAuditLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * One-to-one channels between users who are in touch. The channel of a pair is keyed on the two
 * participant ids in canonical order, so both sides always open the same channel.
 */
@ApplicationScoped
public class DirectChannelService {

    private static final Logger LOG = Logger.getLogger(DirectChannelService.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Inject DirectChannelRepository channelRepository;

    @Inject DirectMessageRepository messageRepository;

    @Inject DirectChannelOrderRepository orderRepository;

    @Inject TouchRelationRepository relationRepository;

    @Inject IdentityLookup identityLookup;

    @Inject MessagePolicy messagePolicy;

    @Inject SocialAuditLogger auditLogger;

    /**
     * Returns the pair ordered by the string form of the ids. The database check constraint
     * {@code participant_low < participant_high} compares the same way.
     */
    static UUID[] canonicalPair(UUID a, UUID b) {
        if (a.toString().compareTo(b.toString()) <= 0) {
            return new UUID[] {a, b};
        }
        return new UUID[] {b, a};
    }

    @Transactional
    public DirectChannelDto openChannel(UUID actorId, UUID targetUserId) {
        if (targetUserId == null) {
            throw new ValidationException("targetUserId", "targetUserId is required");
        }
        if (targetUserId.equals(actorId)) {
            throw new ValidationException("targetUserId", "cannot open a chat with yourself");
        }
        if (!relationRepository.isAccepted(actorId, targetUserId)) {
            throw new AccessDeniedException("not in touch");
        }
        ProfileEntity other =
                identityLookup
                        .findProfile(targetUserId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "user", targetUserId.toString()));
        UUID[] pair = canonicalPair(actorId, targetUserId);
        DirectChannelEntity channel =
                channelRepository.upsertPair(pair[0], pair[1], OffsetDateTime.now());
        auditLogger.logChannel(actorId, "open", channel.getId());
        return toChannelDto(channel, other);
    }

    /** Channels ordered by the actor's ranks, then by most recent activity. */
    @Transactional
    public List<DirectChannelDto> listChannels(UUID actorId) {
        List<DirectChannelEntity> channels = channelRepository.listForUser(actorId);
        Set<UUID> others = new HashSet<>();
        for (DirectChannelEntity channel : channels) {
            others.add(channel.otherParticipant(actorId));
        }
        Map<UUID, ProfileEntity> profiles = identityLookup.profilesById(others);
        Map<UUID, Integer> ranks = new HashMap<>();
        for (DirectChannelOrderEntity entry : orderRepository.listForOwner(actorId)) {
            ranks.put(entry.getId().getChannelId(), entry.getSortOrder());
        }

        List<DirectChannelEntity> visible = new ArrayList<>();
        for (DirectChannelEntity channel : channels) {
            if (profiles.containsKey(channel.otherParticipant(actorId))) {
                visible.add(channel);
            }
        }
        visible.sort(
                OrderPreferences.byRank(
                        ranks,
                        DirectChannelEntity::getId,
                        Comparator.comparing(DirectChannelEntity::getUpdatedAt).reversed()));
        List<DirectChannelDto> result = new ArrayList<>();
        for (DirectChannelEntity channel : visible) {
            result.add(toChannelDto(channel, profiles.get(channel.otherParticipant(actorId))));
        }
        return result;
    }

    @Transactional
    public DirectMessageDto sendMessage(UUID actorId, UUID chatId, String content) {
        DirectChannelEntity channel = requireParticipant(actorId, chatId);
        String text = messagePolicy.normalizeContent(content);
        DirectMessageEntity message = messageRepository.append(channel.getId(), actorId, text);
        channelRepository.touch(channel.getId(), message.getCreatedAt());
        return toMessageDto(message);
    }

    /** The earliest messages of the channel in ascending creation order. */
    @Transactional
    public List<DirectMessageDto> listMessages(UUID actorId, UUID chatId, Integer limit) {
        DirectChannelEntity channel = requireParticipant(actorId, chatId);
        List<DirectMessageDto> result = new ArrayList<>();
        for (DirectMessageEntity message :
                messageRepository.listEarliest(channel.getId(), messagePolicy.clampLimit(limit))) {
            result.add(toMessageDto(message));
        }
        return result;
    }

    /** Deletes the channel for both participants together with its messages and order entries. */
    @Transactional
    public void remove(UUID actorId, UUID chatId) {
        DirectChannelEntity channel = requireParticipant(actorId, chatId);
        long messages = messageRepository.deleteForChannel(channel.getId());
        orderRepository.deleteForChannel(channel.getId());
        channelRepository.deleteChannel(channel.getId());
        auditLogger.logChannel(actorId, "remove", channel.getId());
        LOG.infof("Removed direct chat %s with %d messages", channel.getId(), messages);
    }

    /**
     * Replaces the actor's channel order. Duplicates and channels the actor is not part of are
     * dropped.
     *
     * @return the ids that were ranked, in rank order
     */
    @Transactional
    public List<UUID> setOrder(UUID actorId, Collection<UUID> orderedChatIds) {
        Set<UUID> own = new HashSet<>();
        for (DirectChannelEntity channel : channelRepository.listForUser(actorId)) {
            own.add(channel.getId());
        }
        List<UUID> kept =
                OrderPreferences.sanitize(orderedChatIds == null ? List.of() : orderedChatIds, own);
        orderRepository.deleteForOwner(actorId);
        OffsetDateTime now = OffsetDateTime.now();
        for (int rank = 0; rank < kept.size(); rank++) {
            orderRepository.upsertRank(actorId, kept.get(rank), rank, now);
        }
        return kept;
    }

    private DirectChannelEntity requireParticipant(UUID actorId, UUID chatId) {
        if (chatId == null) {
            throw new ValidationException("chatId", "chatId is required");
        }
        DirectChannelEntity channel =
                channelRepository
                        .findChannel(chatId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "direct_chat", chatId.toString()));
        if (!channel.hasParticipant(actorId)) {
            throw new AccessDeniedException("not a participant of this chat");
        }
        return channel;
    }

    private static DirectChannelDto toChannelDto(DirectChannelEntity channel, ProfileEntity other) {
        DirectChannelDto dto = new DirectChannelDto();
        dto.setChatId(channel.getId().toString());
        dto.setOtherUserId(other.getId().toString());
        dto.setUsername(other.getUsername());
        dto.setAvatarUrl(other.getAvatarUrl());
        dto.setUpdatedAt(ISO_FORMATTER.format(channel.getUpdatedAt()));
        return dto;
    }

    private static DirectMessageDto toMessageDto(DirectMessageEntity message) {
        DirectMessageDto dto = new DirectMessageDto();
        dto.setId(message.getId());
        dto.setChatId(message.getChannelId().toString());
        dto.setSenderId(message.getSenderId().toString());
        dto.setContent(message.getContent());
        dto.setCreatedAt(ISO_FORMATTER.format(message.getCreatedAt()));
        return dto;
    }
}
