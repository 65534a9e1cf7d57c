package io.github.chirino.social.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Membership status of a user in a hush chat.
 *
 * <pre>
 * (none) --invite--> invited --accept--> accepted --leave--> left
 * (none) --requestJoin--> requested --ownerAccept--> accepted
 * invited --decline--> declined         requested --ownerDecline--> declined
 * accepted --ownerRemove--> removed
 * {declined, left, removed} --requestJoin--> requested
 * {declined, left, removed} --invite--> invited
 * </pre>
 */
public enum HushMemberStatus {
    INVITED,
    REQUESTED,
    ACCEPTED,
    DECLINED,
    LEFT,
    REMOVED;

    private static final Set<HushMemberStatus> REENTERABLE = EnumSet.of(DECLINED, LEFT, REMOVED);

    private static final Set<HushMemberStatus> LABEL_VISIBLE = EnumSet.of(INVITED, ACCEPTED);

    /** Statuses from which a fresh invite or join request may move the row again. */
    public static Set<HushMemberStatus> reenterable() {
        return EnumSet.copyOf(REENTERABLE);
    }

    public boolean isReenterable() {
        return REENTERABLE.contains(this);
    }

    /** Active memberships count toward the owner-leave closure threshold. */
    public boolean isActive() {
        return !REENTERABLE.contains(this);
    }

    /** Whether the member's name is part of the chat's derived label. */
    public boolean isLabelVisible() {
        return LABEL_VISIBLE.contains(this);
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HushMemberStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return HushMemberStatus.valueOf(value.toUpperCase());
    }
}
