package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

public class DirectChatOrderRequest {

    private List<
                    @NotBlank @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
                    String>
            orderedChatIds;

    public List<String> getOrderedChatIds() {
        return orderedChatIds;
    }

    public void setOrderedChatIds(List<String> orderedChatIds) {
        this.orderedChatIds = orderedChatIds;
    }
}
