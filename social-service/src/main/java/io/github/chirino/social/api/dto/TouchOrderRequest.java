package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

public class TouchOrderRequest {

    private List<
                    @NotBlank @Pattern(regexp = IdFormat.UUID, message = IdFormat.UUID_MESSAGE)
                    String>
            orderedUserIds;

    public List<String> getOrderedUserIds() {
        return orderedUserIds;
    }

    public void setOrderedUserIds(List<String> orderedUserIds) {
        this.orderedUserIds = orderedUserIds;
    }
}
