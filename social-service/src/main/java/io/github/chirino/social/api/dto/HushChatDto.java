package io.github.chirino.social.api.dto;

import io.github.chirino.social.model.HushChatStatus;
import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;

public class HushChatDto {

    private String id;
    private String createdBy;
    private HushChatStatus status;
    private String createdAt;
    private String label;
    private HushMemberStatus membershipStatus;
    private HushRole membershipRole;
    private boolean canRequestJoin;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public HushChatStatus getStatus() {
        return status;
    }

    public void setStatus(HushChatStatus status) {
        this.status = status;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public HushMemberStatus getMembershipStatus() {
        return membershipStatus;
    }

    public void setMembershipStatus(HushMemberStatus membershipStatus) {
        this.membershipStatus = membershipStatus;
    }

    public HushRole getMembershipRole() {
        return membershipRole;
    }

    public void setMembershipRole(HushRole membershipRole) {
        this.membershipRole = membershipRole;
    }

    public boolean isCanRequestJoin() {
        return canRequestJoin;
    }

    public void setCanRequestJoin(boolean canRequestJoin) {
        this.canRequestJoin = canRequestJoin;
    }
}
