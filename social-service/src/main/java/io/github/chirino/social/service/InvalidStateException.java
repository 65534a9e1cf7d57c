package io.github.chirino.social.service;

/**
 * Thrown when the target entity exists but is in a state that does not admit the requested
 * transition, e.g. responding to a request that was already resolved.
 */
public class InvalidStateException extends SocialException {

    private final String resource;
    private final String state;

    public InvalidStateException(String resource, String state, String message) {
        super(message);
        this.resource = resource;
        this.state = state;
    }

    public String getResource() {
        return resource;
    }

    public String getState() {
        return state;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_STATE;
    }
}
