package io.github.chirino.social.service;

/** Classification of every failure an engine operation can raise. */
public enum ErrorKind {
    /** A required field is missing or malformed, or the action targets the caller. */
    VALIDATION("validation_error"),
    /** A referenced user, relation, chat, membership or channel does not exist. */
    NOT_FOUND("not_found"),
    /** The caller lacks the role or status the operation requires. */
    FORBIDDEN("forbidden"),
    /** The entity exists but its current state does not admit the transition. */
    INVALID_STATE("invalid_state"),
    /** Unexpected store failure. */
    INTERNAL("internal_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Expected conditions a caller can react to, as opposed to {@link #INTERNAL}. */
    public boolean isRecoverable() {
        return this != INTERNAL;
    }
}
