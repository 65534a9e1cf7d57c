package io.github.chirino.social.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** Envelope of the action dispatch endpoint: a verb plus its verb-specific payload. */
public class OpsRequest {

    private String action;
    private JsonNode payload;

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }
}
