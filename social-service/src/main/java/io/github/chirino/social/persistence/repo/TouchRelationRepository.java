package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.model.TouchStatus;
import io.github.chirino.social.persistence.entity.TouchRelationEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keep-in-touch relation rows. Every lookup by pair matches both directions, and every state
 * transition is a conditional update so that racing requests converge on one row.
 */
@ApplicationScoped
public class TouchRelationRepository implements PanacheRepositoryBase<TouchRelationEntity, Long> {

    private static final String PAIR =
            "((requesterId = ?1 AND requestedId = ?2) OR (requesterId = ?2 AND requestedId = ?1))";

    @Inject EntityManager entityManager;

    public Optional<TouchRelationEntity> findRelation(Long id) {
        return find("id = ?1", id).firstResultOptional();
    }

    public Optional<TouchRelationEntity> findPair(UUID userA, UUID userB) {
        return find(PAIR, userA, userB).firstResultOptional();
    }

    public boolean isAccepted(UUID userA, UUID userB) {
        return count(PAIR + " AND status = ?3", userA, userB, TouchStatus.ACCEPTED) > 0;
    }

    public List<TouchRelationEntity> listForUser(UUID userId) {
        return list(
                "requesterId = ?1 OR requestedId = ?1", Sort.descending("updatedAt"), userId);
    }

    public List<TouchRelationEntity> listAccepted(UUID userId) {
        return list(
                "(requesterId = ?1 OR requestedId = ?1) AND status = ?2",
                userId,
                TouchStatus.ACCEPTED);
    }

    /**
     * Inserts a pending relation unless a row already exists for the unordered pair.
     *
     * @return {@code true} if this call created the row
     */
    public boolean insertPending(UUID requesterId, UUID requestedId, OffsetDateTime now) {
        int inserted =
                entityManager
                        .createNativeQuery(
                                "INSERT INTO touch_relations (requester_id, requested_id, status,"
                                        + " created_at, updated_at) VALUES (:requester,"
                                        + " :requested, 'pending', :now, :now) ON CONFLICT DO"
                                        + " NOTHING")
                        .setParameter("requester", requesterId)
                        .setParameter("requested", requestedId)
                        .setParameter("now", now)
                        .executeUpdate();
        return inserted > 0;
    }

    /** Resolves a pending relation on behalf of its requested party. */
    public int resolvePending(
            Long id, UUID requestedId, TouchStatus nextStatus, OffsetDateTime now) {
        return update(
                "status = ?1, respondedAt = ?2, updatedAt = ?2"
                        + " WHERE id = ?3 AND requestedId = ?4 AND status = ?5",
                nextStatus,
                now,
                id,
                requestedId,
                TouchStatus.PENDING);
    }

    /** Reopens a declined relation with {@code requesterId} as the new requester. */
    public int reopenDeclined(
            Long id, UUID requesterId, UUID requestedId, OffsetDateTime now) {
        return update(
                "requesterId = ?1, requestedId = ?2, status = ?3, respondedAt = NULL,"
                        + " updatedAt = ?4 WHERE id = ?5 AND status = ?6",
                requesterId,
                requestedId,
                TouchStatus.PENDING,
                now,
                id,
                TouchStatus.DECLINED);
    }

    /**
     * Detaches a row from the persistence context. The conditional updates above are bulk
     * statements that leave managed copies untouched, so a caller that lost one must evict its copy
     * before looking the pair up again.
     */
    public void evict(TouchRelationEntity relation) {
        entityManager.detach(relation);
    }

    public long deletePair(UUID userA, UUID userB) {
        return delete(PAIR, userA, userB);
    }
}
