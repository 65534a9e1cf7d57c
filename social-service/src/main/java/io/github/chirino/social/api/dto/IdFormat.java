package io.github.chirino.social.api.dto;

/** Id formats shared by the request constraints and the path parameter parsing. */
public final class IdFormat {

    public static final String UUID =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    public static final String UUID_MESSAGE = "must be a UUID";

    private IdFormat() {}
}
