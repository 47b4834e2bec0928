package com.shoprtc.core.msg;

/**
 * Kind of payload carried by a {@link ChatMessage}.
 * For {@link #IMAGE} and {@link #FILE} the content is a storage reference, not inline bytes.
 */
public enum MessageType {
    TEXT,
    IMAGE,
    FILE;

    /**
     * Parses a client-supplied type; {@code null} means {@link #TEXT}.
     *
     * @throws IllegalArgumentException if the value names no known type
     */
    public static MessageType fromWire(String value) {
        if (value == null) {
            return TEXT;
        }
        return MessageType.valueOf(value);
    }
}
