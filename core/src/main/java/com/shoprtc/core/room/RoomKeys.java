package com.shoprtc.core.room;

import java.util.Optional;

/**
 * Deterministic room keys.
 * <p>
 * <b>Key formats:</b>
 * <ul>
 *   <li>{@code chat-<shopSlug>}: shop lobby</li>
 *   <li>{@code chat-<shopSlug>-guest-<id>}: guest conversation with a shop</li>
 *   <li>{@code dm-<slugA>-<slugB>}: direct room, slugs in lexical order</li>
 * </ul>
 * The same participants always produce the same key, so both ends of a conversation
 * land on the same room actor. Shop slugs may themselves contain dashes, which is why
 * guest keys are split on the <em>last</em> {@code -guest-} marker.
 * </p>
 */
public final class RoomKeys {
    private RoomKeys() {
    }

    public static final String LOBBY_PREFIX = "chat-";
    public static final String GUEST_MARKER = "-guest-";
    public static final String GUEST_ID_PREFIX = "guest-";
    public static final String DIRECT_PREFIX = "dm-";

    /**
     * Name of the presence channel; never a room.
     */
    public static final String GENERAL = "general";

    public static final int MAX_LENGTH = 200;

    public static String lobby(String shopSlug) {
        return LOBBY_PREFIX + requireSegment(shopSlug, "shopSlug");
    }

    /**
     * Key of the conversation between a guest and a shop.
     *
     * @param shopSlug shop slug
     * @param guestId  guest id, with or without the {@code guest-} prefix
     * @return room key
     */
    public static String guest(String shopSlug, String guestId) {
        String id = requireSegment(guestId, "guestId");
        String normalized = id.startsWith(GUEST_ID_PREFIX) ? id : GUEST_ID_PREFIX + id;
        return LOBBY_PREFIX + requireSegment(shopSlug, "shopSlug") + "-" + normalized;
    }

    /**
     * Key of the direct room between two shops; argument order does not matter.
     */
    public static String direct(String slugA, String slugB) {
        String a = requireSegment(slugA, "slugA");
        String b = requireSegment(slugB, "slugB");
        return a.compareTo(b) <= 0
                ? DIRECT_PREFIX + a + "-" + b
                : DIRECT_PREFIX + b + "-" + a;
    }

    /**
     * Validates a client-supplied room id and returns it as a room key.
     *
     * @throws IllegalArgumentException if the id is blank, too long, contains whitespace or
     *                                  a slash, or names the presence channel
     */
    public static String normalize(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("Missing roomId");
        }
        if (roomId.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("roomId longer than " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < roomId.length(); i++) {
            char c = roomId.charAt(i);
            if (Character.isWhitespace(c) || c == '/') {
                throw new IllegalArgumentException("roomId contains illegal character");
            }
        }
        if (GENERAL.equals(roomId)) {
            throw new IllegalArgumentException("'general' is reserved for the presence channel");
        }
        return roomId;
    }

    public static RoomKind kindOf(String roomKey) {
        if (roomKey.startsWith(DIRECT_PREFIX)) {
            return RoomKind.DIRECT;
        }
        if (roomKey.startsWith(LOBBY_PREFIX)) {
            return lobbyOf(roomKey).isPresent() ? RoomKind.GUEST : RoomKind.LOBBY;
        }
        return RoomKind.OTHER;
    }

    /**
     * For a guest room, the lobby key of the shop it belongs to.
     */
    public static Optional<String> lobbyOf(String roomKey) {
        if (!roomKey.startsWith(LOBBY_PREFIX)) {
            return Optional.empty();
        }
        int guestIndex = roomKey.lastIndexOf(GUEST_MARKER);
        if (guestIndex <= LOBBY_PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(LOBBY_PREFIX + roomKey.substring(LOBBY_PREFIX.length(), guestIndex));
    }

    /**
     * For a direct room, the slug of the shop on the other side of {@code selfSlug}.
     */
    public static Optional<String> directCounterpart(String roomKey, String selfSlug) {
        if (!roomKey.startsWith(DIRECT_PREFIX) || selfSlug == null || selfSlug.isBlank()) {
            return Optional.empty();
        }
        String pair = roomKey.substring(DIRECT_PREFIX.length());
        if (pair.startsWith(selfSlug + "-") && pair.length() > selfSlug.length() + 1) {
            return Optional.of(pair.substring(selfSlug.length() + 1));
        }
        if (pair.endsWith("-" + selfSlug) && pair.length() > selfSlug.length() + 1) {
            return Optional.of(pair.substring(0, pair.length() - selfSlug.length() - 1));
        }
        return Optional.empty();
    }

    private static String requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
