package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public class ChatSendPayload {

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String chatId;

    @NotBlank private String content;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}
