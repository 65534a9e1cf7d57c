package io.github.chirino.social.service;

public class AccessDeniedException extends SocialException {

    public AccessDeniedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FORBIDDEN;
    }
}
