package io.github.chirino.social.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A direct-message channel between two users. The pair is stored in canonical order
 * ({@code participantLow < participantHigh} by UUID string comparison) so that a single row
 * exists per unordered pair.
 */
@Entity
@Table(name = "direct_channels")
public class DirectChannelEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "participant_low", nullable = false, updatable = false)
    private UUID participantLow;

    @Column(name = "participant_high", nullable = false, updatable = false)
    private UUID participantHigh;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getParticipantLow() {
        return participantLow;
    }

    public void setParticipantLow(UUID participantLow) {
        this.participantLow = participantLow;
    }

    public UUID getParticipantHigh() {
        return participantHigh;
    }

    public void setParticipantHigh(UUID participantHigh) {
        this.participantHigh = participantHigh;
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

    public boolean hasParticipant(UUID userId) {
        return participantLow.equals(userId) || participantHigh.equals(userId);
    }

    public UUID otherParticipant(UUID userId) {
        return participantLow.equals(userId) ? participantHigh : participantLow;
    }

    @PrePersist
    public void prePersist() {
        OffsetDateTime now = OffsetDateTime.now();
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
