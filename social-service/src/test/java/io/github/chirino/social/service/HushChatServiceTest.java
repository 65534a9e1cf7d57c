package io.github.chirino.social.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.social.api.dto.HushChatDto;
import io.github.chirino.social.api.dto.HushListDto;
import io.github.chirino.social.api.dto.HushMessageDto;
import io.github.chirino.social.model.HushChatStatus;
import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.HushRole;
import io.github.chirino.social.persistence.entity.HushMembershipEntity;
import io.github.chirino.social.persistence.entity.ProfileEntity;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HushChatServiceTest {

    private InMemorySocialStore store;
    private HushChatService hush;
    private ProfileEntity owner;
    private ProfileEntity member;
    private ProfileEntity carol;

    @BeforeEach
    void setUp() {
        store = new InMemorySocialStore();
        hush = store.hushChatService();
        owner = store.addUser("olivia");
        member = store.addUser("mike");
        carol = store.addUser("carol");
    }

    private UUID createChat() {
        return UUID.fromString(hush.createWith(owner.getId(), member.getId()).getId());
    }

    private HushMemberStatus statusOf(UUID chatId, ProfileEntity user) {
        return store.membership(chatId, user.getId())
                .map(HushMembershipEntity::getStatus)
                .orElse(null);
    }

    private UUID chatWithAcceptedMember() {
        UUID chatId = createChat();
        hush.respondInvite(member.getId(), chatId, true);
        return chatId;
    }

    @Test
    void create_with_adds_owner_and_invited_member() {
        HushChatDto chat = hush.createWith(owner.getId(), member.getId());
        UUID chatId = UUID.fromString(chat.getId());

        assertEquals(HushChatStatus.OPEN, chat.getStatus());
        assertEquals(owner.getId().toString(), chat.getCreatedBy());
        assertEquals(HushRole.OWNER, chat.getMembershipRole());
        assertEquals(HushMemberStatus.ACCEPTED, chat.getMembershipStatus());
        assertEquals("olivia + mike", chat.getLabel());
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, owner));
        assertEquals(HushMemberStatus.INVITED, statusOf(chatId, member));
        assertEquals(HushRole.MEMBER, store.membership(chatId, member.getId()).get().getRole());
    }

    @Test
    void create_with_rejects_self_and_unknown_users() {
        assertThrows(
                ValidationException.class, () -> hush.createWith(owner.getId(), owner.getId()));
        assertThrows(
                ResourceNotFoundException.class,
                () -> hush.createWith(owner.getId(), UUID.randomUUID()));
        assertThrows(ValidationException.class, () -> hush.createWith(owner.getId(), null));
        assertTrue(store.chats.isEmpty());
    }

    @Test
    void only_active_owner_can_invite() {
        UUID chatId = createChat();

        assertThrows(
                AccessDeniedException.class,
                () -> hush.invite(member.getId(), chatId, carol.getId()));
        assertThrows(
                AccessDeniedException.class,
                () -> hush.invite(carol.getId(), chatId, member.getId()));
        assertNull(statusOf(chatId, carol));
    }

    @Test
    void invite_validates_target() {
        UUID chatId = createChat();

        assertThrows(
                ValidationException.class,
                () -> hush.invite(owner.getId(), chatId, owner.getId()));
        assertThrows(
                ResourceNotFoundException.class,
                () -> hush.invite(owner.getId(), chatId, UUID.randomUUID()));
    }

    @Test
    void invite_into_unknown_chat_does_not_reveal_whether_it_exists() {
        UUID chatId = createChat();

        assertThrows(
                AccessDeniedException.class,
                () -> hush.invite(carol.getId(), UUID.randomUUID(), member.getId()));
        assertThrows(
                AccessDeniedException.class,
                () -> hush.invite(carol.getId(), chatId, member.getId()));
    }

    @Test
    void invite_reinvites_terminal_rows_but_not_active_ones() {
        UUID chatId = createChat();
        hush.respondInvite(member.getId(), chatId, false);
        assertEquals(HushMemberStatus.DECLINED, statusOf(chatId, member));

        hush.invite(owner.getId(), chatId, member.getId());
        assertEquals(HushMemberStatus.INVITED, statusOf(chatId, member));

        InvalidStateException e =
                assertThrows(
                        InvalidStateException.class,
                        () -> hush.invite(owner.getId(), chatId, member.getId()));
        assertEquals("invited", e.getState());

        hush.invite(owner.getId(), chatId, carol.getId());
        assertEquals(HushMemberStatus.INVITED, statusOf(chatId, carol));
    }

    @Test
    void request_join_is_blocked_while_membership_is_active() {
        UUID chatId = createChat();

        assertThrows(
                InvalidStateException.class, () -> hush.requestJoin(member.getId(), chatId));
        assertThrows(InvalidStateException.class, () -> hush.requestJoin(owner.getId(), chatId));

        hush.requestJoin(carol.getId(), chatId);
        assertEquals(HushMemberStatus.REQUESTED, statusOf(chatId, carol));
        assertThrows(InvalidStateException.class, () -> hush.requestJoin(carol.getId(), chatId));
    }

    @Test
    void request_join_reenters_from_declined_left_and_removed() {
        UUID chatId = createChat();
        hush.invite(owner.getId(), chatId, carol.getId());
        ProfileEntity dave = store.addUser("dave");
        hush.invite(owner.getId(), chatId, dave.getId());

        hush.respondInvite(member.getId(), chatId, false);
        hush.respondInvite(carol.getId(), chatId, true);
        hush.leave(carol.getId(), chatId);
        hush.respondInvite(dave.getId(), chatId, true);
        hush.removeMember(owner.getId(), chatId, dave.getId());

        for (ProfileEntity user : List.of(member, carol, dave)) {
            hush.requestJoin(user.getId(), chatId);
            assertEquals(HushMemberStatus.REQUESTED, statusOf(chatId, user));
        }
    }

    @Test
    void request_join_requires_an_open_chat() {
        UUID chatId = createChat();
        hush.leave(owner.getId(), chatId);

        assertThrows(InvalidStateException.class, () -> hush.requestJoin(carol.getId(), chatId));
        assertThrows(
                ResourceNotFoundException.class,
                () -> hush.requestJoin(carol.getId(), UUID.randomUUID()));
    }

    @Test
    void resolve_request_checks_owner_and_pending_status() {
        UUID chatId = createChat();
        hush.requestJoin(carol.getId(), chatId);

        assertThrows(
                AccessDeniedException.class,
                () -> hush.resolveRequest(member.getId(), chatId, carol.getId(), true));
        assertThrows(
                ResourceNotFoundException.class,
                () -> hush.resolveRequest(owner.getId(), chatId, UUID.randomUUID(), true));
        assertThrows(
                InvalidStateException.class,
                () -> hush.resolveRequest(owner.getId(), chatId, member.getId(), true));

        hush.resolveRequest(owner.getId(), chatId, carol.getId(), false);
        assertEquals(HushMemberStatus.DECLINED, statusOf(chatId, carol));
    }

    @Test
    void respond_invite_requires_pending_invite() {
        UUID chatId = createChat();

        assertThrows(
                ResourceNotFoundException.class,
                () -> hush.respondInvite(carol.getId(), chatId, true));
        assertThrows(
                InvalidStateException.class, () -> hush.respondInvite(owner.getId(), chatId, true));

        hush.respondInvite(member.getId(), chatId, true);
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, member));
        assertThrows(
                InvalidStateException.class,
                () -> hush.respondInvite(member.getId(), chatId, false));
    }

    @Test
    void owner_leave_closes_chat_at_two_or_fewer_active_members() {
        UUID chatId = chatWithAcceptedMember();

        hush.leave(owner.getId(), chatId);

        assertEquals(HushChatStatus.CLOSED, store.chats.get(chatId).getStatus());
        assertEquals(HushMemberStatus.LEFT, statusOf(chatId, owner));
        assertTrue(hush.list(member.getId()).getChats().isEmpty());
    }

    @Test
    void owner_leave_counts_a_pending_invite_as_active() {
        UUID chatId = createChat();

        hush.leave(owner.getId(), chatId);

        assertEquals(HushChatStatus.CLOSED, store.chats.get(chatId).getStatus());
    }

    @Test
    void owner_leave_keeps_chat_open_above_two_active_members() {
        UUID chatId = chatWithAcceptedMember();
        hush.requestJoin(carol.getId(), chatId);
        hush.resolveRequest(owner.getId(), chatId, carol.getId(), true);

        hush.leave(owner.getId(), chatId);

        assertEquals(HushChatStatus.OPEN, store.chats.get(chatId).getStatus());
        assertEquals(HushMemberStatus.LEFT, statusOf(chatId, owner));
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, member));
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, carol));
    }

    @Test
    void owner_leave_ignores_members_who_already_left() {
        UUID chatId = chatWithAcceptedMember();
        hush.requestJoin(carol.getId(), chatId);
        hush.resolveRequest(owner.getId(), chatId, carol.getId(), true);
        hush.leave(carol.getId(), chatId);

        hush.leave(owner.getId(), chatId);

        assertEquals(HushChatStatus.CLOSED, store.chats.get(chatId).getStatus());
    }

    @Test
    void member_leaving_never_closes_chat() {
        UUID chatId = chatWithAcceptedMember();

        hush.leave(member.getId(), chatId);

        assertEquals(HushChatStatus.OPEN, store.chats.get(chatId).getStatus());
        assertEquals(HushMemberStatus.LEFT, statusOf(chatId, member));
        assertThrows(ResourceNotFoundException.class, () -> hush.leave(carol.getId(), chatId));
    }

    @Test
    void remove_member_requires_owner_and_ignores_unknown_users() {
        UUID chatId = chatWithAcceptedMember();

        assertThrows(
                ValidationException.class,
                () -> hush.removeMember(owner.getId(), chatId, owner.getId()));
        assertThrows(
                AccessDeniedException.class,
                () -> hush.removeMember(member.getId(), chatId, owner.getId()));

        hush.removeMember(owner.getId(), chatId, carol.getId());
        assertNull(statusOf(chatId, carol));

        hush.removeMember(owner.getId(), chatId, member.getId());
        assertEquals(HushMemberStatus.REMOVED, statusOf(chatId, member));
        assertThrows(
                AccessDeniedException.class,
                () -> hush.sendMessage(member.getId(), chatId, "still here?"));
    }

    @Test
    void only_accepted_members_exchange_messages() {
        UUID chatId = createChat();

        assertThrows(
                AccessDeniedException.class,
                () -> hush.sendMessage(member.getId(), chatId, "hello"));
        assertThrows(
                AccessDeniedException.class, () -> hush.listMessages(member.getId(), chatId, null));
        assertThrows(
                AccessDeniedException.class, () -> hush.listMessages(carol.getId(), chatId, null));
    }

    @Test
    void message_content_is_trimmed_truncated_and_required() {
        UUID chatId = createChat();

        HushMessageDto sent = hush.sendMessage(owner.getId(), chatId, "  hi there  ");
        assertEquals("hi there", sent.getContent());
        assertEquals("olivia", sent.getUsername());

        HushMessageDto longOne = hush.sendMessage(owner.getId(), chatId, "x".repeat(2500));
        assertEquals(2000, longOne.getContent().length());

        assertThrows(
                ValidationException.class, () -> hush.sendMessage(owner.getId(), chatId, "   "));
    }

    @Test
    void list_messages_returns_earliest_first_with_clamped_limit() {
        UUID chatId = chatWithAcceptedMember();
        hush.sendMessage(owner.getId(), chatId, "one");
        hush.sendMessage(member.getId(), chatId, "two");
        hush.sendMessage(owner.getId(), chatId, "three");

        List<HushMessageDto> firstTwo = hush.listMessages(member.getId(), chatId, 2);
        assertEquals(
                List.of("one", "two"), firstTwo.stream().map(HushMessageDto::getContent).toList());
        assertEquals(
                List.of("olivia", "mike"),
                firstTwo.stream().map(HushMessageDto::getUsername).toList());

        assertEquals(1, hush.listMessages(member.getId(), chatId, 0).size());
        assertEquals(3, hush.listMessages(member.getId(), chatId, 1000).size());
        assertEquals(3, hush.listMessages(member.getId(), chatId, null).size());
    }

    @Test
    void message_names_fall_back_to_profile_username() {
        UUID chatId = createChat();
        store.membership(chatId, owner.getId()).get().setDisplayName(null);

        hush.sendMessage(owner.getId(), chatId, "hello");

        assertEquals("olivia", hush.listMessages(owner.getId(), chatId, null).get(0).getUsername());
    }

    @Test
    void list_shows_chats_from_the_callers_point_of_view() {
        UUID chatId = createChat();
        hush.requestJoin(carol.getId(), chatId);

        HushListDto ownerView = hush.list(owner.getId());
        HushChatDto ownerChat = ownerView.getChats().get(0);
        assertEquals(HushMemberStatus.ACCEPTED, ownerChat.getMembershipStatus());
        assertFalse(ownerChat.isCanRequestJoin());
        assertEquals(1, ownerView.getRequestsForMe().size());
        assertEquals(carol.getId().toString(), ownerView.getRequestsForMe().get(0).getUserId());
        assertEquals("carol", ownerView.getRequestsForMe().get(0).getUsername());
        assertTrue(ownerView.getInvitesForMe().isEmpty());

        HushListDto memberView = hush.list(member.getId());
        assertEquals(1, memberView.getInvitesForMe().size());
        assertEquals(chatId.toString(), memberView.getInvitesForMe().get(0).getChatId());
        assertEquals("olivia + mike", memberView.getInvitesForMe().get(0).getFrom());
        assertTrue(memberView.getRequestsForMe().isEmpty());

        ProfileEntity stranger = store.addUser("stranger");
        HushChatDto strangerChat = hush.list(stranger.getId()).getChats().get(0);
        assertNull(strangerChat.getMembershipStatus());
        assertTrue(strangerChat.isCanRequestJoin());
    }

    @Test
    void label_falls_back_when_no_member_is_visible() {
        UUID chatId = createChat();
        hush.respondInvite(member.getId(), chatId, false);
        assertEquals("olivia", hush.list(owner.getId()).getChats().get(0).getLabel());

        store.membership(chatId, owner.getId()).get().setStatus(HushMemberStatus.LEFT);
        assertEquals("hush", hush.list(member.getId()).getChats().get(0).getLabel());
    }

    @Test
    void list_orders_open_chats_newest_first() {
        UUID first = createChat();
        UUID second = UUID.fromString(hush.createWith(owner.getId(), carol.getId()).getId());

        List<HushChatDto> chats = hush.list(owner.getId()).getChats();

        assertEquals(second.toString(), chats.get(0).getId());
        assertEquals(first.toString(), chats.get(1).getId());
    }

    @Test
    void decline_then_request_join_then_accept_lets_member_talk() {
        UUID chatId = createChat();
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, owner));
        assertEquals(HushMemberStatus.INVITED, statusOf(chatId, member));

        hush.respondInvite(member.getId(), chatId, false);
        assertEquals(HushMemberStatus.DECLINED, statusOf(chatId, member));

        hush.requestJoin(member.getId(), chatId);
        assertEquals(HushMemberStatus.REQUESTED, statusOf(chatId, member));

        hush.resolveRequest(owner.getId(), chatId, member.getId(), true);
        assertEquals(HushMemberStatus.ACCEPTED, statusOf(chatId, member));

        hush.sendMessage(member.getId(), chatId, "finally in");
        List<HushMessageDto> messages = hush.listMessages(member.getId(), chatId, null);
        assertEquals(1, messages.size());
        assertEquals("finally in", messages.get(0).getContent());
        assertEquals("mike", messages.get(0).getUsername());
    }
}
