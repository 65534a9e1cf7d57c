package io.github.chirino.social.security;

import io.github.chirino.social.model.HushMemberStatus;
import io.github.chirino.social.model.TouchStatus;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.UUID;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SocialAuditLogger {

    private static final Logger AUDIT_LOG = Logger.getLogger("io.github.chirino.social.audit");

    /** Log a keep-in-touch relation state change. */
    public void logRelation(
            UUID actorUserId, String action, UUID targetUserId, TouchStatus status) {
        AUDIT_LOG.infof(
                "RELATION_CHANGE actor=%s action=%s target=%s status=%s",
                actorUserId, action, targetUserId, status == null ? "deleted" : status.toValue());
    }

    /** Log a hush chat membership state change. */
    public void logMembership(
            UUID actorUserId,
            String action,
            UUID chatId,
            UUID targetUserId,
            HushMemberStatus status) {
        AUDIT_LOG.infof(
                "MEMBERSHIP_CHANGE actor=%s action=%s chat=%s target=%s status=%s",
                actorUserId, action, chatId, targetUserId, status.toValue());
    }

    /** Log a hush chat being closed because its owner left. */
    public void logChatClosed(UUID actorUserId, UUID chatId, int activeMembersBeforeLeave) {
        AUDIT_LOG.infof(
                "MEMBERSHIP_CHANGE actor=%s action=close chat=%s activeMembers=%d",
                actorUserId, chatId, activeMembersBeforeLeave);
    }

    /** Log a direct channel being opened or removed. */
    public void logChannel(UUID actorUserId, String action, UUID channelId) {
        AUDIT_LOG.infof(
                "CHANNEL_CHANGE actor=%s action=%s channel=%s", actorUserId, action, channelId);
    }
}
