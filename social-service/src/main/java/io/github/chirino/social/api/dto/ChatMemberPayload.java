package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public class ChatMemberPayload {

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String chatId;

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String memberUserId;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public String getMemberUserId() {
        return memberUserId;
    }

    public void setMemberUserId(String memberUserId) {
        this.memberUserId = memberUserId;
    }
}
