package com.shoprtc.core.room;

/**
 * Shape of a room key, as produced by {@link RoomKeys}.
 */
public enum RoomKind {
    /**
     * {@code chat-<shopSlug>}: a shop's own channel, also the target of guest notifications.
     */
    LOBBY,
    /**
     * {@code chat-<shopSlug>-guest-<id>}: a storefront visitor talking to a shop.
     */
    GUEST,
    /**
     * {@code dm-<slugA>-<slugB>}: two shops talking to each other.
     */
    DIRECT,
    /**
     * Any other accepted key; no cross-room notifications are derived from it.
     */
    OTHER
}
