package io.github.chirino.social.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.chirino.social.service.ValidationException;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** Body of the accept-or-decline endpoints. */
public class DecisionRequest {

    @NotBlank
    @Pattern(regexp = "(?i)accept|decline", message = "must be accept or decline")
    private String decision;

    public String getDecision() {
        return decision;
    }

    public void setDecision(String decision) {
        this.decision = decision;
    }

    /** {@code true} for accept, {@code false} for decline; anything else is rejected. */
    @JsonIgnore
    public boolean isAccept() {
        if ("accept".equalsIgnoreCase(decision)) {
            return true;
        }
        if ("decline".equalsIgnoreCase(decision)) {
            return false;
        }
        throw new ValidationException("decision", "decision must be accept or decline");
    }
}
