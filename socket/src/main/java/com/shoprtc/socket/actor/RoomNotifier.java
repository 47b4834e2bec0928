package com.shoprtc.socket.actor;

/**
 * Outbound side of cross-room notifications.
 * <p>
 * Both calls are fire-and-forget: they enqueue work on another actor and return at once.
 * Nothing is reported back, and a recipient that is not connected is a normal outcome.
 * </p>
 */
public interface RoomNotifier {
    /**
     * Pushes a payload verbatim to everyone connected to {@code roomKey}.
     */
    void notifyRoom(String roomKey, String payloadJson);

    /**
     * Pushes a payload verbatim to the online users whose shop slug is {@code targetSlug}.
     */
    void notifyIdentity(String targetSlug, String payloadJson);
}
