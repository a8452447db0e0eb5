package max.xiangqi.engine.session;

import java.time.Instant;

/** Pending challenge from {@code inviterId} to {@code targetId}. */
public record Invite(String id, long inviterId, long targetId, Instant expiresAt) {

    /** Expired invites count as absent even before a sweep removes them. */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
