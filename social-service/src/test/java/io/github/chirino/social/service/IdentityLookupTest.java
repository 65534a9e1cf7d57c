package io.github.chirino.social.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.social.api.dto.ProfileDto;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IdentityLookupTest {

    private InMemorySocialStore store;
    private IdentityLookup lookup;

    @BeforeEach
    void setUp() {
        store = new InMemorySocialStore();
        lookup = store.identityLookup();
    }

    @Test
    void resolves_exact_then_case_insensitive() {
        ProfileEntity exact = store.addUser("Jo");
        ProfileEntity other = store.addUser("jo");

        assertEquals(exact.getId(), lookup.resolveUsername("Jo").get().getId());
        assertEquals(other.getId(), lookup.resolveUsername("jo").get().getId());
        assertEquals(exact.getId(), lookup.resolveUsername("JO").get().getId());
        assertTrue(lookup.resolveUsername("nobody").isEmpty());
        assertTrue(lookup.resolveUsername("  ").isEmpty());
    }

    @Test
    void maps_ids_to_profiles_and_skips_unknown_ids() {
        ProfileEntity ann = store.addUser("ann");
        ProfileEntity ben = store.addUser("ben");

        Map<UUID, String> names =
                lookup.usernamesById(List.of(ann.getId(), ben.getId(), UUID.randomUUID()));

        assertEquals(Map.of(ann.getId(), "ann", ben.getId(), "ben"), names);
        assertTrue(lookup.profilesById(List.of()).isEmpty());
        assertTrue(lookup.findProfile(null).isEmpty());
    }

    @Test
    void public_profiles_trims_dedupes_and_caps_names() {
        store.addUser("ann");
        store.addUser("ben");

        List<ProfileDto> found =
                lookup.publicProfiles(Arrays.asList(" ben", "ann", "ben", "", null));

        assertEquals(List.of("ann", "ben"), found.stream().map(ProfileDto::getUsername).toList());

        lookup.maxPublicLookup = 2;
        List<String> many = new ArrayList<>(List.of("zed", "yan", "ann"));
        assertTrue(lookup.publicProfiles(many).isEmpty());
    }
}
