package io.github.chirino.social.api;

import io.github.chirino.social.service.ValidationException;
import java.util.HashMap;
import java.util.Map;

/** The closed set of verbs accepted by {@code POST /v1/ops}. */
public enum SocialAction {
    CONTEXT_SNAPSHOT("context.snapshot"),
    TOUCH_LIST("touch.list"),
    TOUCH_REQUEST("touch.request"),
    TOUCH_RESPOND("touch.respond"),
    TOUCH_REMOVE("touch.remove"),
    TOUCH_ORDER("touch.order"),
    HUSH_LIST("hush.list"),
    HUSH_CREATE_WITH("hush.create_with"),
    HUSH_INVITE("hush.invite"),
    HUSH_REQUEST_JOIN("hush.request_join"),
    HUSH_ACCEPT_REQUEST("hush.accept_request"),
    HUSH_DECLINE_REQUEST("hush.decline_request"),
    HUSH_ACCEPT_INVITE("hush.accept_invite"),
    HUSH_DECLINE_INVITE("hush.decline_invite"),
    HUSH_LEAVE("hush.leave"),
    HUSH_REMOVE_MEMBER("hush.remove_member"),
    HUSH_MESSAGES("hush.messages"),
    HUSH_SEND("hush.send"),
    DM_LIST("dm.list"),
    DM_OPEN("dm.open"),
    DM_MESSAGES("dm.messages"),
    DM_SEND("dm.send"),
    DM_REMOVE("dm.remove"),
    DM_ORDER("dm.order");

    private static final Map<String, SocialAction> BY_VERB = new HashMap<>();

    static {
        for (SocialAction action : values()) {
            BY_VERB.put(action.verb, action);
        }
    }

    private final String verb;

    SocialAction(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }

    /**
     * @throws ValidationException if the verb is missing or not one of the known verbs
     */
    public static SocialAction fromVerb(String verb) {
        if (verb == null || verb.isBlank()) {
            throw new ValidationException("action", "action is required");
        }
        SocialAction action = BY_VERB.get(verb.trim());
        if (action == null) {
            throw new ValidationException("action", "unknown action: " + verb.trim());
        }
        return action;
    }
}
