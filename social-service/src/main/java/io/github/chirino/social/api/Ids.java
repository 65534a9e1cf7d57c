package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.IdFormat;
import io.github.chirino.social.service.ValidationException;
import io.quarkus.security.identity.SecurityIdentity;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/** Parsing of the string ids that arrive in paths, bodies and tokens. */
final class Ids {

    private static final Pattern UUID_PATTERN = Pattern.compile(IdFormat.UUID);

    private Ids() {}

    /** Parses a required id; missing or malformed values are validation errors on {@code field}. */
    static UUID uuid(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        String trimmed = value.trim();
        if (!UUID_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException(field, field + " " + IdFormat.UUID_MESSAGE);
        }
        return UUID.fromString(trimmed);
    }

    /** Parses a required numeric id such as a touch request id. */
    static Long number(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field, field + " must be a number");
        }
    }

    /** Parses a list of ids, rejecting the whole list if any entry is malformed. */
    static List<UUID> uuids(String field, List<String> values) {
        List<UUID> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            result.add(uuid(field, value));
        }
        return result;
    }

    /** The caller's user id: the token principal name. */
    static UUID actor(SecurityIdentity identity) {
        return uuid("principal", identity.getPrincipal().getName());
    }
}
