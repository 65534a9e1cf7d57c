package io.github.chirino.social.api.dto;

import io.github.chirino.social.model.TouchStatus;

public class TouchResultDto {

    private Long relationId;
    private TouchStatus status;

    public Long getRelationId() {
        return relationId;
    }

    public void setRelationId(Long relationId) {
        this.relationId = relationId;
    }

    public TouchStatus getStatus() {
        return status;
    }

    public void setStatus(TouchStatus status) {
        this.status = status;
    }
}
