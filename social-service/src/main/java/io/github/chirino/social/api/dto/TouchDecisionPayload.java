package io.github.chirino.social.api.dto;

import jakarta.validation.constraints.NotNull;

public class TouchDecisionPayload {

    @NotNull private Long requestId;
    @NotNull private Boolean accept;

    public Long getRequestId() {
        return requestId;
    }

    public void setRequestId(Long requestId) {
        this.requestId = requestId;
    }

    public Boolean getAccept() {
        return accept;
    }

    public void setAccept(Boolean accept) {
        this.accept = accept;
    }
}
