package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public class ChatMessagesPayload {

    @NotBlank
    @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
    private String chatId;
    private Integer limit;

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
