package io.github.chirino.social.service;

/** Base type of all classified failures raised by the social engines. */
public abstract class SocialException extends RuntimeException {

    protected SocialException(String message) {
        super(message);
    }

    protected SocialException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
