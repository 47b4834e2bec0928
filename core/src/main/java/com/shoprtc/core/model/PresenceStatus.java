package com.shoprtc.core.model;

/**
 * Lifecycle of one presence connection: {@code CONNECTING → ONLINE → OFFLINE}.
 * {@code OFFLINE} is terminal; a reconnect starts a new machine.
 */
public enum PresenceStatus {
    CONNECTING,
    ONLINE,
    OFFLINE;

    public boolean canTransitionTo(PresenceStatus next) {
        return switch (this) {
            case CONNECTING -> next == ONLINE || next == OFFLINE;
            case ONLINE -> next == OFFLINE;
            case OFFLINE -> false;
        };
    }
}
