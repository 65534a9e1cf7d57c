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
@Table(name = "touch_orders")
public class TouchOrderEntity {

    @EmbeddedId private TouchOrderId id;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public TouchOrderId getId() {
        return id;
    }

    public void setId(TouchOrderId id) {
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
    public static class TouchOrderId implements Serializable {

        @Column(name = "owner_user_id")
        private UUID ownerUserId;

        @Column(name = "contact_user_id")
        private UUID contactUserId;

        public TouchOrderId() {}

        public TouchOrderId(UUID ownerUserId, UUID contactUserId) {
            this.ownerUserId = ownerUserId;
            this.contactUserId = contactUserId;
        }

        public UUID getOwnerUserId() {
            return ownerUserId;
        }

        public void setOwnerUserId(UUID ownerUserId) {
            this.ownerUserId = ownerUserId;
        }

        public UUID getContactUserId() {
            return contactUserId;
        }

        public void setContactUserId(UUID contactUserId) {
            this.contactUserId = contactUserId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof TouchOrderId)) {
                return false;
            }
            TouchOrderId that = (TouchOrderId) o;
            return Objects.equals(ownerUserId, that.ownerUserId)
                    && Objects.equals(contactUserId, that.contactUserId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ownerUserId, contactUserId);
        }
    }
}
