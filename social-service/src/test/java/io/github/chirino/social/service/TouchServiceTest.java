package io.github.chirino.social.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.social.api.dto.IncomingTouchRequestDto;
import io.github.chirino.social.api.dto.ProfileDto;
import io.github.chirino.social.api.dto.TouchListDto;
import io.github.chirino.social.api.dto.TouchResultDto;
import io.github.chirino.social.model.TouchStatus;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.github.chirino.social.persistence.entity.TouchOrderEntity.TouchOrderId;
import io.github.chirino.social.persistence.entity.TouchRelationEntity;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TouchServiceTest {

    private InMemorySocialStore store;
    private TouchService touch;
    private ProfileEntity alice;
    private ProfileEntity bob;
    private ProfileEntity carol;

    @BeforeEach
    void setUp() {
        store = new InMemorySocialStore();
        touch = store.touchService();
        alice = store.addUser("alice");
        bob = store.addUser("bob");
        carol = store.addUser("Carol");
    }

    private TouchRelationEntity relation(ProfileEntity a, ProfileEntity b) {
        return store.relation(a.getId(), b.getId()).orElseThrow();
    }

    private void befriend(ProfileEntity a, ProfileEntity b) {
        touch.request(a.getId(), b.getUsername());
        touch.request(b.getId(), a.getUsername());
    }

    @Test
    void first_request_creates_pending_relation() {
        TouchResultDto result = touch.request(alice.getId(), "bob");

        assertEquals(TouchStatus.PENDING, result.getStatus());
        assertNotNull(result.getRelationId());
        TouchRelationEntity row = relation(alice, bob);
        assertEquals(alice.getId(), row.getRequesterId());
        assertEquals(bob.getId(), row.getRequestedId());
        assertEquals(TouchStatus.PENDING, row.getStatus());
    }

    @Test
    void username_falls_back_to_case_insensitive_match() {
        TouchResultDto result = touch.request(alice.getId(), "  carol ");

        assertEquals(TouchStatus.PENDING, result.getStatus());
        assertEquals(carol.getId(), relation(alice, carol).getRequestedId());
    }

    @Test
    void exact_username_match_wins_over_case_insensitive_match() {
        ProfileEntity upperBob = store.addUser("Bob");

        touch.request(alice.getId(), "Bob");

        assertTrue(store.relation(alice.getId(), upperBob.getId()).isPresent());
        assertTrue(store.relation(alice.getId(), bob.getId()).isEmpty());
    }

    @Test
    void unknown_username_is_not_found() {
        assertThrows(ResourceNotFoundException.class, () -> touch.request(alice.getId(), "zed"));
    }

    @Test
    void requesting_yourself_or_nobody_is_rejected() {
        assertThrows(ValidationException.class, () -> touch.request(alice.getId(), "alice"));
        assertThrows(ValidationException.class, () -> touch.request(alice.getId(), " "));
        assertThrows(ValidationException.class, () -> touch.request(alice.getId(), null));
        assertTrue(store.relations.isEmpty());
    }

    @Test
    void mutual_requests_accept_in_either_order_with_a_single_row() {
        assertEquals(TouchStatus.PENDING, touch.request(alice.getId(), "bob").getStatus());
        assertEquals(TouchStatus.ACCEPTED, touch.request(bob.getId(), "alice").getStatus());

        assertEquals(TouchStatus.PENDING, touch.request(carol.getId(), "bob").getStatus());
        assertEquals(TouchStatus.ACCEPTED, touch.request(bob.getId(), "Carol").getStatus());

        assertEquals(2, store.relations.size());
        assertEquals(TouchStatus.ACCEPTED, relation(alice, bob).getStatus());
        assertEquals(TouchStatus.ACCEPTED, relation(bob, carol).getStatus());
        assertNotNull(relation(alice, bob).getRespondedAt());
    }

    @Test
    void repeated_request_by_requester_stays_pending() {
        touch.request(alice.getId(), "bob");
        TouchResultDto again = touch.request(alice.getId(), "bob");

        assertEquals(TouchStatus.PENDING, again.getStatus());
        assertEquals(1, store.relations.size());
        assertEquals(alice.getId(), relation(alice, bob).getRequesterId());
    }

    @Test
    void request_on_accepted_relation_changes_nothing() {
        befriend(alice, bob);
        OffsetDateTime updatedAt = relation(alice, bob).getUpdatedAt();

        assertEquals(TouchStatus.ACCEPTED, touch.request(alice.getId(), "bob").getStatus());
        assertEquals(TouchStatus.ACCEPTED, touch.request(bob.getId(), "alice").getStatus());
        assertEquals(updatedAt, relation(alice, bob).getUpdatedAt());
    }

    @Test
    void request_after_decline_reopens_with_new_requester() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        touch.respond(bob.getId(), pending.getRelationId(), false);
        assertEquals(TouchStatus.DECLINED, relation(alice, bob).getStatus());

        TouchResultDto reopened = touch.request(bob.getId(), "alice");

        assertEquals(TouchStatus.PENDING, reopened.getStatus());
        TouchRelationEntity row = relation(alice, bob);
        assertEquals(bob.getId(), row.getRequesterId());
        assertEquals(alice.getId(), row.getRequestedId());
        assertNull(row.getRespondedAt());
        assertEquals(pending.getRelationId(), row.getId());
    }

    @Test
    void declined_requester_can_ask_again() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        touch.respond(bob.getId(), pending.getRelationId(), false);

        assertEquals(TouchStatus.PENDING, touch.request(alice.getId(), "bob").getStatus());
        assertEquals(alice.getId(), relation(alice, bob).getRequesterId());
    }

    @Test
    void lost_insert_race_converges_on_the_winning_row() {
        touch.relationRepository =
                store.new Relations() {
                    private boolean raced;

                    @Override
                    public boolean insertPending(
                            UUID requesterId, UUID requestedId, OffsetDateTime now) {
                        if (!raced) {
                            raced = true;
                            // the other side commits first
                            super.insertPending(requestedId, requesterId, now);
                            return false;
                        }
                        return super.insertPending(requesterId, requestedId, now);
                    }
                };

        TouchResultDto result = touch.request(alice.getId(), "bob");

        assertEquals(TouchStatus.ACCEPTED, result.getStatus());
        assertEquals(1, store.relations.size());
    }

    /** Hands out one cached copy per row until evicted, like a persistence context does. */
    private class CachingRelations extends InMemorySocialStore.Relations {
        final Map<Long, TouchRelationEntity> cached = new HashMap<>();
        int evictions;

        CachingRelations() {
            store.super();
        }

        @Override
        public Optional<TouchRelationEntity> findPair(UUID userA, UUID userB) {
            return super.findPair(userA, userB)
                    .map(row -> cached.computeIfAbsent(row.getId(), id -> copyOf(row)));
        }

        @Override
        public void evict(TouchRelationEntity relation) {
            evictions++;
            cached.remove(relation.getId());
        }

        private TouchRelationEntity copyOf(TouchRelationEntity row) {
            TouchRelationEntity copy = new TouchRelationEntity();
            copy.setId(row.getId());
            copy.setRequesterId(row.getRequesterId());
            copy.setRequestedId(row.getRequestedId());
            copy.setStatus(row.getStatus());
            copy.setCreatedAt(row.getCreatedAt());
            copy.setUpdatedAt(row.getUpdatedAt());
            copy.setRespondedAt(row.getRespondedAt());
            return copy;
        }
    }

    @Test
    void asking_back_while_the_request_is_accepted_elsewhere_returns_accepted() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        CachingRelations relations =
                new CachingRelations() {
                    private boolean raced;

                    @Override
                    public int resolvePending(
                            Long id, UUID requestedId, TouchStatus nextStatus, OffsetDateTime now) {
                        if (!raced) {
                            raced = true;
                            // bob's other session accepts first
                            super.resolvePending(id, requestedId, TouchStatus.ACCEPTED, now);
                            return 0;
                        }
                        return super.resolvePending(id, requestedId, nextStatus, now);
                    }
                };
        touch.relationRepository = relations;

        TouchResultDto result = touch.request(bob.getId(), "alice");

        assertEquals(TouchStatus.ACCEPTED, result.getStatus());
        assertEquals(pending.getRelationId(), result.getRelationId());
        assertEquals(1, relations.evictions);
        assertEquals(TouchStatus.ACCEPTED, relation(alice, bob).getStatus());
    }

    @Test
    void reopening_a_declined_request_reopened_elsewhere_accepts_it() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        touch.respond(bob.getId(), pending.getRelationId(), false);
        CachingRelations relations =
                new CachingRelations() {
                    private boolean raced;

                    @Override
                    public int reopenDeclined(
                            Long id, UUID requesterId, UUID requestedId, OffsetDateTime now) {
                        if (!raced) {
                            raced = true;
                            // bob reopens first, so alice is now the one being asked
                            super.reopenDeclined(id, requestedId, requesterId, now);
                            return 0;
                        }
                        return super.reopenDeclined(id, requesterId, requestedId, now);
                    }
                };
        touch.relationRepository = relations;

        TouchResultDto result = touch.request(alice.getId(), "bob");

        assertEquals(TouchStatus.ACCEPTED, result.getStatus());
        assertEquals(1, relations.evictions);
        assertEquals(1, store.relations.size());
    }

    @Test
    void only_the_requested_user_can_respond() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");

        assertThrows(
                AccessDeniedException.class,
                () -> touch.respond(alice.getId(), pending.getRelationId(), true));
        assertThrows(
                AccessDeniedException.class,
                () -> touch.respond(carol.getId(), pending.getRelationId(), true));
        assertEquals(TouchStatus.PENDING, relation(alice, bob).getStatus());
    }

    @Test
    void wrong_responder_is_forbidden_even_after_resolution() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        touch.respond(bob.getId(), pending.getRelationId(), true);

        assertThrows(
                AccessDeniedException.class,
                () -> touch.respond(alice.getId(), pending.getRelationId(), false));
    }

    @Test
    void responding_twice_is_invalid_state() {
        TouchResultDto pending = touch.request(alice.getId(), "bob");
        TouchResultDto accepted = touch.respond(bob.getId(), pending.getRelationId(), true);
        assertEquals(TouchStatus.ACCEPTED, accepted.getStatus());
        assertNotNull(relation(alice, bob).getRespondedAt());

        InvalidStateException e =
                assertThrows(
                        InvalidStateException.class,
                        () -> touch.respond(bob.getId(), pending.getRelationId(), false));
        assertEquals("accepted", e.getState());
    }

    @Test
    void responding_to_unknown_request_is_not_found() {
        assertThrows(ResourceNotFoundException.class, () -> touch.respond(bob.getId(), 99L, true));
        assertThrows(ValidationException.class, () -> touch.respond(bob.getId(), null, true));
    }

    @Test
    void remove_deletes_relation_and_both_order_entries() {
        befriend(alice, bob);
        touch.setOrder(alice.getId(), List.of(bob.getId()));
        touch.setOrder(bob.getId(), List.of(alice.getId()));

        touch.remove(alice.getId(), bob.getId());

        assertTrue(store.relations.isEmpty());
        assertFalse(
                store.touchOrders.containsKey(new TouchOrderId(alice.getId(), bob.getId())));
        assertFalse(
                store.touchOrders.containsKey(new TouchOrderId(bob.getId(), alice.getId())));
        assertTrue(touch.list(alice.getId()).getInTouch().isEmpty());
    }

    @Test
    void remove_works_in_any_status_and_is_idempotent() {
        touch.request(alice.getId(), "bob");

        touch.remove(bob.getId(), alice.getId());
        touch.remove(bob.getId(), alice.getId());

        assertTrue(store.relations.isEmpty());
        assertThrows(
                ValidationException.class, () -> touch.remove(alice.getId(), alice.getId()));
    }

    @Test
    void list_orders_contacts_by_rank_then_username_with_unranked_last() {
        ProfileEntity dave = store.addUser("dave");
        befriend(alice, bob);
        befriend(alice, carol);
        befriend(alice, dave);
        touch.setOrder(alice.getId(), List.of(dave.getId()));

        List<ProfileDto> inTouch = touch.list(alice.getId()).getInTouch();

        assertEquals(
                List.of("dave", "bob", "Carol"),
                inTouch.stream().map(ProfileDto::getUsername).toList());
        assertEquals(dave.getId().toString(), inTouch.get(0).getId());
    }

    @Test
    void list_returns_incoming_requests_only_for_requested_user() {
        ProfileEntity aaron = store.addUser("aaron");
        TouchResultDto fromBob = touch.request(bob.getId(), "alice");
        touch.request(aaron.getId(), "alice");
        touch.request(alice.getId(), "Carol");

        TouchListDto view = touch.list(alice.getId());

        assertTrue(view.getInTouch().isEmpty());
        List<IncomingTouchRequestDto> incoming = view.getIncoming();
        assertEquals(
                List.of("aaron", "bob"),
                incoming.stream().map(IncomingTouchRequestDto::getUsername).toList());
        assertEquals(fromBob.getRelationId(), incoming.get(1).getId());
        assertEquals(bob.getId().toString(), incoming.get(1).getUserId());
        assertEquals(1, touch.list(carol.getId()).getIncoming().size());
    }

    @Test
    void list_skips_contacts_without_profile() {
        befriend(alice, bob);
        store.profiles.remove(bob.getId());

        assertTrue(touch.list(alice.getId()).getInTouch().isEmpty());
    }

    @Test
    void set_order_dedupes_and_keeps_only_accepted_contacts() {
        befriend(alice, bob);
        befriend(alice, carol);
        ProfileEntity stranger = store.addUser("stranger");
        touch.request(alice.getId(), "stranger");

        List<UUID> kept =
                touch.setOrder(
                        alice.getId(),
                        List.of(carol.getId(), stranger.getId(), carol.getId(), bob.getId()));

        assertEquals(List.of(carol.getId(), bob.getId()), kept);
        assertEquals(0, rank(alice, carol));
        assertEquals(1, rank(alice, bob));
        assertEquals(2, store.touchOrders.size());
    }

    private int rank(ProfileEntity owner, ProfileEntity contact) {
        TouchOrderId id = new TouchOrderId(owner.getId(), contact.getId());
        return store.touchOrders.get(id).getSortOrder();
    }

    @Test
    void empty_order_clears_previous_ranks() {
        befriend(alice, bob);
        touch.setOrder(alice.getId(), List.of(bob.getId()));

        assertTrue(touch.setOrder(alice.getId(), List.of()).isEmpty());
        assertTrue(store.touchOrders.isEmpty());
    }
}
