package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "hush_memberships")
public class HushMembershipEntity {

    @EmbeddedId private HushMembershipId id;

    @Column(name = "role", nullable = false)
    private HushRole role;

    @Column(name = "status", nullable = false)
    private HushMemberStatus status;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public HushMembershipId getId() {
        return id;
    }

    public void setId(HushMembershipId id) {
        this.id = id;
    }

    public UUID getChatId() {
        return id.getChatId();
    }

    public UUID getUserId() {
        return id.getUserId();
    }

    public HushRole getRole() {
        return role;
    }

    public void setRole(HushRole role) {
        this.role = role;
    }

    public HushMemberStatus getStatus() {
        return status;
    }

    public void setStatus(HushMemberStatus status) {
        this.status = status;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    /** Owner with an accepted membership: the only role allowed to manage the chat. */
    public boolean isActiveOwner() {
        return role == HushRole.OWNER && status == HushMemberStatus.ACCEPTED;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    @Embeddable
    public static class HushMembershipId implements Serializable {

        @Column(name = "chat_id")
        private UUID chatId;

        @Column(name = "user_id")
        private UUID userId;

        public HushMembershipId() {}

        public HushMembershipId(UUID chatId, UUID userId) {
            this.chatId = chatId;
            this.userId = userId;
        }

        public UUID getChatId() {
            return chatId;
        }

        public void setChatId(UUID chatId) {
            this.chatId = chatId;
        }

        public UUID getUserId() {
            return userId;
        }

        public void setUserId(UUID userId) {
            this.userId = userId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof HushMembershipId)) {
                return false;
            }
            HushMembershipId that = (HushMembershipId) o;
            return Objects.equals(chatId, that.chatId) && Objects.equals(userId, that.userId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(chatId, userId);
        }
    }
}
