package com.shoprtc.core.msg;

/**
 * Values of the {@code type} field on the wire.
 */
public final class EventTypes {
    private EventTypes() {
    }

    public static final String HISTORY = "HISTORY";
    public static final String MESSAGE = "MESSAGE";
    public static final String PRESENCE = "PRESENCE";
    public static final String ONLINE_USERS = "ONLINE_USERS";
    public static final String CHAT_MESSAGE = "CHAT_MESSAGE";
    public static final String PING = "PING";
    public static final String PONG = "PONG";

    /**
     * Relayed to a shop lobby when a guest writes in one of the shop's guest rooms.
     */
    public static final String GUEST_NOTIFICATION = "GUEST_NOTIFICATION";

    /**
     * Relayed through presence to a shop that received a direct message.
     */
    public static final String DM_NOTIFICATION = "DM_NOTIFICATION";
}
