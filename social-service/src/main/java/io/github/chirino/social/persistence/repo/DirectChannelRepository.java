package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.DirectChannelEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class DirectChannelRepository implements PanacheRepositoryBase<DirectChannelEntity, UUID> {

    @Inject EntityManager entityManager;

    public Optional<DirectChannelEntity> findChannel(UUID id) {
        return find("id = ?1", id).firstResultOptional();
    }

    public Optional<DirectChannelEntity> findByParticipants(UUID low, UUID high) {
        return find("participantLow = ?1 AND participantHigh = ?2", low, high)
                .firstResultOptional();
    }

    public List<DirectChannelEntity> listForUser(UUID userId) {
        return list(
                "participantLow = ?1 OR participantHigh = ?1",
                Sort.descending("updatedAt"),
                userId);
    }

    /**
     * Creates the channel for a canonically ordered pair, or refreshes its activity timestamp if
     * it already exists. Callers must pass {@code low} and {@code high} already ordered.
     */
    public DirectChannelEntity upsertPair(UUID low, UUID high, OffsetDateTime now) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO direct_channels (id, participant_low, participant_high,"
                                + " created_at, updated_at) VALUES (:id, :low, :high, :now, :now)"
                                + " ON CONFLICT (participant_low, participant_high) DO UPDATE SET"
                                + " updated_at = excluded.updated_at")
                .setParameter("id", UUID.randomUUID())
                .setParameter("low", low)
                .setParameter("high", high)
                .setParameter("now", now)
                .executeUpdate();
        DirectChannelEntity channel =
                findByParticipants(low, high)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Direct channel missing after upsert"));
        entityManager.refresh(channel);
        return channel;
    }

    public int touch(UUID id, OffsetDateTime now) {
        return update("updatedAt = ?1 WHERE id = ?2", now, id);
    }

    public long deleteChannel(UUID id) {
        return delete("id = ?1", id);
    }
}
