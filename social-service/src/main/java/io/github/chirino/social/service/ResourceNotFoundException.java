package io.github.chirino.social.service;

public class ResourceNotFoundException extends SocialException {

    private final String resource;
    private final String id;

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
