package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;
import io.github.chirino.social.persistence.entity.HushMembershipEntity;
import io.github.chirino.social.persistence.entity.HushMembershipEntity.HushMembershipId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class HushMembershipRepository
        implements PanacheRepositoryBase<HushMembershipEntity, HushMembershipId> {

    @Inject EntityManager entityManager;

    public Optional<HushMembershipEntity> findMembership(UUID chatId, UUID userId) {
        return find("id.chatId = ?1 AND id.userId = ?2", chatId, userId).firstResultOptional();
    }

    public List<HushMembershipEntity> listForChat(UUID chatId) {
        return list("id.chatId = ?1", Sort.ascending("createdAt"), chatId);
    }

    public List<HushMembershipEntity> listForChats(Collection<UUID> chatIds) {
        if (chatIds.isEmpty()) {
            return List.of();
        }
        return list("id.chatId in ?1", Sort.ascending("createdAt"), chatIds);
    }

    public HushMembershipEntity createMembership(
            UUID chatId,
            UUID userId,
            HushRole role,
            HushMemberStatus status,
            String displayName) {
        HushMembershipEntity entity = new HushMembershipEntity();
        entity.setId(new HushMembershipId(chatId, userId));
        entity.setRole(role);
        entity.setStatus(status);
        entity.setDisplayName(displayName);
        entity.setCreatedAt(OffsetDateTime.now());
        persist(entity);
        return entity;
    }

    /**
     * Inserts a member row, or overwrites an existing one only while it sits in a re-enterable
     * status (declined, left, removed).
     *
     * @return number of rows written; {@code 0} means an active row blocked the write
     */
    public int upsertReentry(
            UUID chatId,
            UUID userId,
            HushRole role,
            HushMemberStatus status,
            String displayName) {
        return entityManager
                .createNativeQuery(
                        "INSERT INTO hush_memberships (chat_id, user_id, role, status,"
                                + " display_name, created_at) VALUES (:chat, :user, :role,"
                                + " :status, :displayName, :now) ON CONFLICT (chat_id, user_id)"
                                + " DO UPDATE SET role = excluded.role, status = excluded.status,"
                                + " display_name = excluded.display_name"
                                + " WHERE hush_memberships.status IN ('declined', 'left',"
                                + " 'removed')")
                .setParameter("chat", chatId)
                .setParameter("user", userId)
                .setParameter("role", role.toValue())
                .setParameter("status", status.toValue())
                .setParameter("displayName", displayName)
                .setParameter("now", OffsetDateTime.now())
                .executeUpdate();
    }

    /** Moves a member from {@code from} to {@code to}; 0 means the row was not in {@code from}. */
    public int transition(
            UUID chatId, UUID userId, HushMemberStatus from, HushMemberStatus to) {
        return update(
                "status = ?1 WHERE id.chatId = ?2 AND id.userId = ?3 AND status = ?4",
                to,
                chatId,
                userId,
                from);
    }

    public int updateStatus(UUID chatId, UUID userId, HushMemberStatus status) {
        return update(
                "status = ?1 WHERE id.chatId = ?2 AND id.userId = ?3", status, chatId, userId);
    }
}
