package io.github.chirino.social.service;

import io.github.chirino.social.api.dto.ProfileDto;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.persistence.repo.ProfileRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Read-through access to user profiles. Every call goes to the store; nothing is cached across
 * requests.
 */
@ApplicationScoped
public class IdentityLookup {

    @Inject ProfileRepository profileRepository;

    @ConfigProperty(name = "social-service.profiles.max-public-lookup", defaultValue = "100")
    int maxPublicLookup = 100;

    /** Exact username match first, then a case-insensitive match. */
    public Optional<ProfileEntity> resolveUsername(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        String trimmed = username.trim();
        Optional<ProfileEntity> exact = profileRepository.findByUsername(trimmed);
        if (exact.isPresent()) {
            return exact;
        }
        return profileRepository.findByUsernameIgnoreCase(trimmed);
    }

    public Optional<ProfileEntity> findProfile(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return profileRepository.findProfile(userId);
    }

    /** Profiles for the given ids; ids without a profile are absent from the map. */
    public Map<UUID, ProfileEntity> profilesById(Collection<UUID> userIds) {
        Map<UUID, ProfileEntity> result = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return result;
        }
        for (ProfileEntity profile : profileRepository.listByIds(new LinkedHashSet<>(userIds))) {
            result.put(profile.getId(), profile);
        }
        return result;
    }

    public Map<UUID, String> usernamesById(Collection<UUID> userIds) {
        Map<UUID, String> result = new HashMap<>();
        profilesById(userIds).forEach((id, profile) -> result.put(id, profile.getUsername()));
        return result;
    }

    /**
     * Public profile lookup by username. Names are trimmed and deduplicated, blanks dropped, and
     * at most {@code social-service.profiles.max-public-lookup} names are considered.
     */
    public List<ProfileDto> publicProfiles(Collection<String> usernames) {
        if (usernames == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String username : usernames) {
            if (username == null || username.isBlank()) {
                continue;
            }
            if (names.size() >= maxPublicLookup) {
                break;
            }
            names.add(username.trim());
        }
        List<ProfileDto> result = new ArrayList<>();
        for (ProfileEntity profile : profileRepository.listByUsernames(names)) {
            result.add(toProfileDto(profile));
        }
        return result;
    }

    public static ProfileDto toProfileDto(ProfileEntity profile) {
        ProfileDto dto = new ProfileDto();
        dto.setId(profile.getId().toString());
        dto.setUsername(profile.getUsername());
        dto.setAvatarUrl(profile.getAvatarUrl());
        return dto;
    }
}
