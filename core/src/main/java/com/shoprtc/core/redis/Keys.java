package com.shoprtc.core.redis;

/**
 * Redis keyspace definitions for room logs and the general channel.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions ({@code room:}, {@code presence:})</li>
 *   <li>Bound growth by age (room logs) or by count (general channel)</li>
 *   <li>Use streams where entries need ordered, range-addressable ids</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Message log of one room: {@code room:{roomKey}:log}
     * <p>
     * <b>Type:</b> Stream, entry id {@code <millis>-<seq>}
     * <br>
     * <b>Fields:</b> {@code msg}: serialized ChatMessage
     * <br>
     * <b>Retention:</b> entries older than the retention window are removed with
     * {@code XTRIM MINID} whenever a client joins the room.
     * </p>
     *
     * @param roomKey room key
     * @return Redis key
     */
    public static String roomLog(String roomKey) {
        return "room:" + roomKey + ":log";
    }

    /**
     * History of the general channel: {@code presence:general:messages}
     * <p>
     * <b>Type:</b> List, oldest first
     * <br>
     * <b>Retention:</b> last N messages ({@code LTRIM -N -1} after every push)
     * </p>
     *
     * @return Redis key
     */
    public static String generalMessages() {
        return "presence:general:messages";
    }

    /**
     * Field holding the message body inside a room-log stream entry.
     */
    public static final String MESSAGE_FIELD = "msg";

}
