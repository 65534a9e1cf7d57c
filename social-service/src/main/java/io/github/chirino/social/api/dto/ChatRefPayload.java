package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public class ChatRefPayload {

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String chatId;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }
}
