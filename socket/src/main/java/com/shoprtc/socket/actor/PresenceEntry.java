package com.shoprtc.socket.actor;

import com.shoprtc.core.model.OnlineUser;
import com.shoprtc.core.model.PresenceStatus;
import com.shoprtc.socket.session.Session;

/**
 * One row of the online directory, tied to the session that created it.
 */
public class PresenceEntry {
    private final Session session;
    private PresenceStatus status = PresenceStatus.CONNECTING;

    public PresenceEntry(Session session) {
        this.session = session;
    }

    /**
     * @throws IllegalStateException if the entry cannot move to {@code next}
     */
    public void transitionTo(PresenceStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Presence of " + getUserId() + " cannot go " + status + " -> " + next);
        }
        status = next;
    }

    public Session getSession() {
        return session;
    }

    public PresenceStatus getStatus() {
        return status;
    }

    public String getUserId() {
        return session.getIdentity().getUserId();
    }

    public String getUsername() {
        return session.getIdentity().getUsername();
    }

    public String getShopSlug() {
        return session.getIdentity().getShopSlug();
    }

    public OnlineUser toOnlineUser() {
        return new OnlineUser(getUserId(), getUsername(), status);
    }
}
