package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.TouchStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A keep-in-touch relation. One row exists per unordered pair of users, enforced by a unique
 * index over {@code (least(requester_id, requested_id), greatest(requester_id, requested_id))}.
 */
@Entity
@Table(name = "touch_relations")
public class TouchRelationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "requester_id", nullable = false)
    private UUID requesterId;

    @Column(name = "requested_id", nullable = false)
    private UUID requestedId;

    @Column(name = "status", nullable = false)
    private TouchStatus status;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "responded_at")
    private OffsetDateTime respondedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public UUID getRequesterId() {
        return requesterId;
    }

    public void setRequesterId(UUID requesterId) {
        this.requesterId = requesterId;
    }

    public UUID getRequestedId() {
        return requestedId;
    }

    public void setRequestedId(UUID requestedId) {
        this.requestedId = requestedId;
    }

    public TouchStatus getStatus() {
        return status;
    }

    public void setStatus(TouchStatus status) {
        this.status = status;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getRespondedAt() {
        return respondedAt;
    }

    public void setRespondedAt(OffsetDateTime respondedAt) {
        this.respondedAt = respondedAt;
    }

    /** The participant that is not {@code userId}. */
    public UUID otherParty(UUID userId) {
        return requesterId.equals(userId) ? requestedId : requesterId;
    }

    @PrePersist
    public void prePersist() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
