package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.DirectChannelOrderEntity;
import io.github.chirino.social.persistence.entity.DirectChannelOrderEntity.DirectChannelOrderId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class DirectChannelOrderRepository
        implements PanacheRepositoryBase<DirectChannelOrderEntity, DirectChannelOrderId> {

    @Inject EntityManager entityManager;

    public List<DirectChannelOrderEntity> listForOwner(UUID ownerUserId) {
        return list("id.ownerUserId = ?1", Sort.ascending("sortOrder"), ownerUserId);
    }

    public long deleteForOwner(UUID ownerUserId) {
        return delete("id.ownerUserId = ?1", ownerUserId);
    }

    public long deleteForChannel(UUID channelId) {
        return delete("id.channelId = ?1", channelId);
    }

    public void upsertRank(UUID ownerUserId, UUID channelId, int rank, OffsetDateTime now) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO direct_channel_orders (owner_user_id, channel_id,"
                                + " sort_order, updated_at) VALUES (:owner, :channel, :rank,"
                                + " :now) ON CONFLICT (owner_user_id, channel_id) DO UPDATE SET"
                                + " sort_order = excluded.sort_order,"
                                + " updated_at = excluded.updated_at")
                .setParameter("owner", ownerUserId)
                .setParameter("channel", channelId)
                .setParameter("rank", rank)
                .setParameter("now", now)
                .executeUpdate();
    }
}
