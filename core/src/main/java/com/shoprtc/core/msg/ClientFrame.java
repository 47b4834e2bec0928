package com.shoprtc.core.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Envelope for everything a client sends over a room or presence connection.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>{@code MESSAGE}: {content, messageType?, product?} on a room channel</li>
 *   <li>{@code CHAT_MESSAGE}: {content} on the presence channel</li>
 *   <li>{@code PING}: keepalive, answered with {@code PONG}</li>
 * </ul>
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ClientFrame {
    String type;

    String content;

    /**
     * One of TEXT, IMAGE, FILE; absent means TEXT.
     */
    String messageType;

    ProductSnapshot product;
}
