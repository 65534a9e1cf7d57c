package io.github.chirino.social.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/** Content and page-size rules shared by hush chat and direct channel messages. */
@ApplicationScoped
public class MessagePolicy {

    @ConfigProperty(name = "social-service.messages.max-length", defaultValue = "2000")
    int maxLength = 2000;

    @ConfigProperty(name = "social-service.messages.default-limit", defaultValue = "200")
    int defaultLimit = 200;

    @ConfigProperty(name = "social-service.messages.max-limit", defaultValue = "300")
    int maxLimit = 300;

    /**
     * Trims the content and truncates it to the configured maximum length.
     *
     * @throws ValidationException if nothing is left after trimming
     */
    public String normalizeContent(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("content", "content is required");
        }
        if (trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength);
        }
        return trimmed;
    }

    /** Clamps a requested page size to [1, max-limit]; absent means the default limit. */
    public int clampLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, limit));
    }
}
