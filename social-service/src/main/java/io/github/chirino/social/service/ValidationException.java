package io.github.chirino.social.service;

public class ValidationException extends SocialException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
