package io.github.chirino.social.service;

/** Wraps an unexpected failure (typically the store) together with the operation context. */
public class InternalFailureException extends SocialException {

    private final String operation;

    public InternalFailureException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTERNAL;
    }
}
