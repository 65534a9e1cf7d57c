package io.github.chirino.social.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "direct_channel_orders")
public class DirectChannelOrderEntity {

    @EmbeddedId private DirectChannelOrderId id;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public DirectChannelOrderId getId() {
        return id;
    }

    public void setId(DirectChannelOrderId id) {
        this.id = id;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = OffsetDateTime.now();
    }

    @Embeddable
    public static class DirectChannelOrderId implements Serializable {

        @Column(name = "owner_user_id")
        private UUID ownerUserId;

        @Column(name = "channel_id")
        private UUID channelId;

        public DirectChannelOrderId() {}

        public DirectChannelOrderId(UUID ownerUserId, UUID channelId) {
            this.ownerUserId = ownerUserId;
            this.channelId = channelId;
        }

        public UUID getOwnerUserId() {
            return ownerUserId;
        }

        public void setOwnerUserId(UUID ownerUserId) {
            this.ownerUserId = ownerUserId;
        }

        public UUID getChannelId() {
            return channelId;
        }

        public void setChannelId(UUID channelId) {
            this.channelId = channelId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DirectChannelOrderId)) {
                return false;
            }
            DirectChannelOrderId that = (DirectChannelOrderId) o;
            return Objects.equals(ownerUserId, that.ownerUserId)
                    && Objects.equals(channelId, that.channelId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ownerUserId, channelId);
        }
    }
}
