package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public class ChatInvitePayload {

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String chatId;

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String targetUserId;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public String getTargetUserId() {
        return targetUserId;
    }

    public void setTargetUserId(String targetUserId) {
        this.targetUserId = targetUserId;
    }
}
