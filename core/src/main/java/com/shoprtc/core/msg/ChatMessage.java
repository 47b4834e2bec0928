package com.shoprtc.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One persisted unit of room history.
 * <p>
 * <b>Immutability:</b> once appended to a room log a message is never rewritten;
 * only the retention sweep removes it.
 * </p>
 * <p>
 * <b>Ordering:</b> {@code timestamp} is the millisecond part of the message's storage key,
 * so it is non-decreasing in log order. Messages sharing a millisecond are ordered by the
 * key's sequence number.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChatMessage {
    /**
     * Random UUID generated at write time.
     */
    @JsonProperty("id")
    String id;

    /**
     * Author identity as it was when the message was sent (not re-resolved later).
     */
    @JsonProperty("senderId")
    String senderId;

    @JsonProperty("senderName")
    String senderName;

    /**
     * Text, or a storage reference for image/file messages.
     */
    @JsonProperty("content")
    String content;

    /**
     * Epoch millis.
     */
    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("type")
    MessageType type;

    /**
     * Present only for product inquiries.
     */
    @JsonProperty("product")
    ProductSnapshot product;

    @JsonCreator
    public ChatMessage(
        @JsonProperty("id") String id,
        @JsonProperty("senderId") String senderId,
        @JsonProperty("senderName") String senderName,
        @JsonProperty("content") String content,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("type") MessageType type,
        @JsonProperty("product") ProductSnapshot product
    ) {
        this.id = id;
        this.senderId = senderId;
        this.senderName = senderName;
        this.content = content;
        this.timestamp = timestamp;
        this.type = type;
        this.product = product;
    }
}
