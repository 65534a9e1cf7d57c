package io.github.chirino.social.service;

import io.github.chirino.social.api.dto.IncomingTouchRequestDto;
import io.github.chirino.social.api.dto.ProfileDto;
import io.github.chirino.social.api.dto.TouchListDto;
import io.github.chirino.social.api.dto.TouchResultDto;
import io.github.chirino.social.model.TouchStatus;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.persistence.entity.TouchOrderEntity;
import io.github.chirino.social.persistence.entity.TouchRelationEntity;
import io.github.chirino.social.persistence.repo.TouchOrderRepository;
import io.github.chirino.social.persistence.repo.TouchRelationRepository;
import io.github.chirino.social.security.SocialAuditLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Keep-in-touch relations between two users. At most one row exists per unordered pair; its
 * requester and requested ids record who asked most recently.
 */
@ApplicationScoped
public class TouchService {

    private static final Logger LOG = Logger.getLogger(TouchService.class);

    // A lost race re-reads the winning row; more rounds than this means the pair keeps changing.
    private static final int MAX_ATTEMPTS = 3;

    @Inject TouchRelationRepository relationRepository;

    @Inject TouchOrderRepository orderRepository;

    @Inject IdentityLookup identityLookup;

    @Inject SocialAuditLogger auditLogger;

    @Transactional
    public TouchResultDto request(UUID actorId, String targetUsername) {
        if (targetUsername == null || targetUsername.isBlank()) {
            throw new ValidationException("targetUsername", "targetUsername is required");
        }
        ProfileEntity target =
                identityLookup
                        .resolveUsername(targetUsername)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("user", targetUsername.trim()));
        UUID targetId = target.getId();
        if (targetId.equals(actorId)) {
            throw new ValidationException("targetUsername", "cannot keep in touch with yourself");
        }

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            OffsetDateTime now = OffsetDateTime.now();
            Optional<TouchRelationEntity> existing = relationRepository.findPair(actorId, targetId);
            if (existing.isEmpty()) {
                if (relationRepository.insertPending(actorId, targetId, now)) {
                    auditLogger.logRelation(actorId, "request", targetId, TouchStatus.PENDING);
                    return result(
                            relationRepository.findPair(actorId, targetId), TouchStatus.PENDING);
                }
                continue;
            }
            TouchRelationEntity relation = existing.get();
            switch (relation.getStatus()) {
                case ACCEPTED:
                    return result(relation.getId(), TouchStatus.ACCEPTED);
                case PENDING:
                    if (relation.getRequesterId().equals(actorId)) {
                        return result(relation.getId(), TouchStatus.PENDING);
                    }
                    // the other side already asked: asking back accepts
                    if (relationRepository.resolvePending(
                                    relation.getId(), actorId, TouchStatus.ACCEPTED, now)
                            > 0) {
                        auditLogger.logRelation(actorId, "accept", targetId, TouchStatus.ACCEPTED);
                        return result(relation.getId(), TouchStatus.ACCEPTED);
                    }
                    break;
                case DECLINED:
                    if (relationRepository.reopenDeclined(relation.getId(), actorId, targetId, now)
                            > 0) {
                        auditLogger.logRelation(actorId, "reopen", targetId, TouchStatus.PENDING);
                        return result(relation.getId(), TouchStatus.PENDING);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown touch status " + relation.getStatus());
            }
            // lost a conditional update; the next lookup must see the winner's row
            relationRepository.evict(relation);
        }
        LOG.warnf(
                "Touch relation between %s and %s kept changing; giving up after %d attempts",
                actorId, targetId, MAX_ATTEMPTS);
        throw new InvalidStateException(
                "touch_relation", "contended", "relation changed concurrently, retry the request");
    }

    @Transactional
    public TouchResultDto respond(UUID actorId, Long relationId, boolean accept) {
        if (relationId == null) {
            throw new ValidationException("requestId", "requestId is required");
        }
        TouchRelationEntity relation =
                relationRepository
                        .findRelation(relationId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "touch_request", String.valueOf(relationId)));
        if (!relation.getRequestedId().equals(actorId)) {
            throw new AccessDeniedException("only the requested user can respond");
        }
        if (relation.getStatus() != TouchStatus.PENDING) {
            throw new InvalidStateException(
                    "touch_request",
                    relation.getStatus().toValue(),
                    "request is already " + relation.getStatus().toValue());
        }
        TouchStatus next = accept ? TouchStatus.ACCEPTED : TouchStatus.DECLINED;
        int updated =
                relationRepository.resolvePending(relationId, actorId, next, OffsetDateTime.now());
        if (updated == 0) {
            throw new InvalidStateException(
                    "touch_request", "resolved", "request was resolved concurrently");
        }
        auditLogger.logRelation(
                actorId, accept ? "accept" : "decline", relation.getRequesterId(), next);
        return result(relationId, next);
    }

    /** Deletes the pair's relation in any status together with both sides' order entries. */
    @Transactional
    public void remove(UUID actorId, UUID targetUserId) {
        if (targetUserId == null) {
            throw new ValidationException("targetUserId", "targetUserId is required");
        }
        if (targetUserId.equals(actorId)) {
            throw new ValidationException("targetUserId", "cannot remove yourself");
        }
        long deleted = relationRepository.deletePair(actorId, targetUserId);
        orderRepository.deleteEntry(actorId, targetUserId);
        orderRepository.deleteEntry(targetUserId, actorId);
        if (deleted > 0) {
            auditLogger.logRelation(actorId, "remove", targetUserId, null);
        }
    }

    @Transactional
    public TouchListDto list(UUID actorId) {
        List<TouchRelationEntity> relations = relationRepository.listForUser(actorId);
        List<UUID> acceptedIds = new ArrayList<>();
        List<TouchRelationEntity> incoming = new ArrayList<>();
        Set<UUID> profileIds = new HashSet<>();
        for (TouchRelationEntity relation : relations) {
            if (relation.getStatus() == TouchStatus.ACCEPTED) {
                UUID other = relation.otherParty(actorId);
                acceptedIds.add(other);
                profileIds.add(other);
            } else if (relation.getStatus() == TouchStatus.PENDING
                    && relation.getRequestedId().equals(actorId)) {
                incoming.add(relation);
                profileIds.add(relation.getRequesterId());
            }
        }
        Map<UUID, ProfileEntity> profiles = identityLookup.profilesById(profileIds);

        Map<UUID, Integer> ranks = new HashMap<>();
        for (TouchOrderEntity entry : orderRepository.listForOwner(actorId)) {
            ranks.put(entry.getId().getContactUserId(), entry.getSortOrder());
        }
        List<ProfileEntity> contacts = new ArrayList<>();
        for (UUID id : acceptedIds) {
            ProfileEntity profile = profiles.get(id);
            if (profile != null) {
                contacts.add(profile);
            }
        }
        contacts.sort(
                OrderPreferences.byRank(
                        ranks,
                        ProfileEntity::getId,
                        Comparator.comparing(
                                ProfileEntity::getUsername, String.CASE_INSENSITIVE_ORDER)));
        List<ProfileDto> inTouch = new ArrayList<>();
        for (ProfileEntity profile : contacts) {
            inTouch.add(IdentityLookup.toProfileDto(profile));
        }

        List<IncomingTouchRequestDto> requests = new ArrayList<>();
        for (TouchRelationEntity relation : incoming) {
            ProfileEntity requester = profiles.get(relation.getRequesterId());
            if (requester == null) {
                continue;
            }
            IncomingTouchRequestDto dto = new IncomingTouchRequestDto();
            dto.setId(relation.getId());
            dto.setUserId(requester.getId().toString());
            dto.setUsername(requester.getUsername());
            dto.setAvatarUrl(requester.getAvatarUrl());
            requests.add(dto);
        }
        requests.sort(
                Comparator.comparing(
                        IncomingTouchRequestDto::getUsername, String.CASE_INSENSITIVE_ORDER));

        TouchListDto dto = new TouchListDto();
        dto.setInTouch(inTouch);
        dto.setIncoming(requests);
        return dto;
    }

    /**
     * Replaces the actor's contact order. Duplicates and users no longer in touch are dropped.
     *
     * @return the ids that were ranked, in rank order
     */
    @Transactional
    public List<UUID> setOrder(UUID actorId, Collection<UUID> orderedUserIds) {
        Set<UUID> accepted = new HashSet<>();
        for (TouchRelationEntity relation : relationRepository.listAccepted(actorId)) {
            accepted.add(relation.otherParty(actorId));
        }
        List<UUID> kept =
                OrderPreferences.sanitize(
                        orderedUserIds == null ? List.of() : orderedUserIds, accepted);
        orderRepository.deleteForOwner(actorId);
        OffsetDateTime now = OffsetDateTime.now();
        for (int rank = 0; rank < kept.size(); rank++) {
            orderRepository.upsertRank(actorId, kept.get(rank), rank, now);
        }
        LOG.debugf("Stored touch order of %d contacts for %s", kept.size(), actorId);
        return kept;
    }

    private static TouchResultDto result(Long relationId, TouchStatus status) {
        TouchResultDto dto = new TouchResultDto();
        dto.setRelationId(relationId);
        dto.setStatus(status);
        return dto;
    }

    private static TouchResultDto result(
            Optional<TouchRelationEntity> relation, TouchStatus status) {
        return result(relation.map(TouchRelationEntity::getId).orElse(null), status);
    }
}
