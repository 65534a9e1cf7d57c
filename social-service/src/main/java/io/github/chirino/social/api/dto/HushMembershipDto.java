package io.github.chirino.social.api.dto;

import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;

public class HushMembershipDto {

    private String chatId;
    private String userId;
    private HushRole role;
    private HushMemberStatus status;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
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
}
