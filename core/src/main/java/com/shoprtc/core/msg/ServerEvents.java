package com.shoprtc.core.msg;

import com.shoprtc.core.model.OnlineUser;
import com.shoprtc.core.model.PresenceStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Events pushed from the server to connected clients.
 * <p>
 * Every event is a JSON object with a {@code type} discriminator, except {@link ErrorReply},
 * which carries only {@code error} and is sent to the offending session alone.
 * </p>
 */
public final class ServerEvents {
    private ServerEvents() {
    }

    /**
     * Sent once, right after a connection is accepted. Messages are in chronological order.
     */
    @Value
    public static class History {
        String type = EventTypes.HISTORY;
        List<ChatMessage> messages;
    }

    /**
     * A newly persisted room message.
     */
    @Value
    public static class Message {
        String type = EventTypes.MESSAGE;
        ChatMessage message;
    }

    /**
     * A newly persisted general-channel message.
     */
    @Value
    public static class GeneralMessage {
        String type = EventTypes.CHAT_MESSAGE;
        ChatMessage message;
    }

    @Value
    public static class Presence {
        String type = EventTypes.PRESENCE;
        String userId;
        String username;
        PresenceStatus status;
    }

    @Value
    public static class OnlineUsers {
        String type = EventTypes.ONLINE_USERS;
        List<OnlineUser> users;
    }

    @Value
    public static class Pong {
        String type = EventTypes.PONG;
    }

    @Value
    public static class ErrorReply {
        String error;
    }

    /**
     * Relayed to a shop's lobby room when a guest writes in one of the shop's guest rooms.
     */
    @Value
    @Builder
    public static class GuestNotification {
        String type = EventTypes.GUEST_NOTIFICATION;
        String roomId;
        String guestId;
        String guestName;
        String lastMessage;
        long timestamp;
        ProductSnapshot product;
    }

    /**
     * Pushed through the presence channel to a shop that received a direct message.
     */
    @Value
    @Builder
    public static class DirectMessageNotification {
        String type = EventTypes.DM_NOTIFICATION;
        String targetSlug;
        String roomId;
        String senderName;
        String lastMessage;
        long timestamp;
    }
}
