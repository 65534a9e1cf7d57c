package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.TouchOrderEntity;
import io.github.chirino.social.persistence.entity.TouchOrderEntity.TouchOrderId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class TouchOrderRepository implements PanacheRepositoryBase<TouchOrderEntity, TouchOrderId> {

    @Inject EntityManager entityManager;

    public List<TouchOrderEntity> listForOwner(UUID ownerUserId) {
        return list("id.ownerUserId = ?1", Sort.ascending("sortOrder"), ownerUserId);
    }

    public long deleteForOwner(UUID ownerUserId) {
        return delete("id.ownerUserId = ?1", ownerUserId);
    }

    public long deleteEntry(UUID ownerUserId, UUID contactUserId) {
        return delete("id.ownerUserId = ?1 AND id.contactUserId = ?2", ownerUserId, contactUserId);
    }

    public void upsertRank(UUID ownerUserId, UUID contactUserId, int rank, OffsetDateTime now) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO touch_orders (owner_user_id, contact_user_id, sort_order,"
                                + " updated_at) VALUES (:owner, :contact, :rank, :now)"
                                + " ON CONFLICT (owner_user_id, contact_user_id) DO UPDATE SET"
                                + " sort_order = excluded.sort_order,"
                                + " updated_at = excluded.updated_at")
                .setParameter("owner", ownerUserId)
                .setParameter("contact", contactUserId)
                .setParameter("rank", rank)
                .setParameter("now", now)
                .executeUpdate();
    }
}
