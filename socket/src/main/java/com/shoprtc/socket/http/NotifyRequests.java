package com.shoprtc.socket.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.shoprtc.core.msg.EventTypes;
import com.shoprtc.core.util.JsonUtils;
import lombok.Value;

import java.util.Optional;

/**
 * Bodies accepted by the internal notification endpoints.
 * <p>
 * Presence notifications come in two shapes: the envelope {@code {targetKey, notification}}
 * and a bare {@code DM_NOTIFICATION} event addressed by its own {@code targetSlug}, which
 * is relayed whole.
 * </p>
 */
public final class NotifyRequests {
    private NotifyRequests() {
    }

    @Value
    public static class PresenceNotify {
        String targetKey;
        String payloadJson;
    }

    /**
     * @return the target and payload, or empty if the body names no target
     * @throws com.shoprtc.core.util.JsonCodecException if the body is not JSON
     */
    public static Optional<PresenceNotify> parsePresenceNotify(String body) {
        JsonNode node = JsonUtils.readTree(body);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        String targetKey = text(node, "targetKey");
        JsonNode notification = node.get("notification");
        if (targetKey != null && notification != null && notification.isObject()) {
            return Optional.of(new PresenceNotify(targetKey, JsonUtils.writeValueAsString(notification)));
        }

        String targetSlug = text(node, "targetSlug");
        if (EventTypes.DM_NOTIFICATION.equals(text(node, "type")) && targetSlug != null) {
            return Optional.of(new PresenceNotify(targetSlug, JsonUtils.writeValueAsString(node)));
        }
        return Optional.empty();
    }

    /**
     * @return the payload to relay to the room, or empty if the event type is not relayed
     * @throws com.shoprtc.core.util.JsonCodecException if the body is not JSON
     */
    public static Optional<String> parseRoomNotify(String body) {
        JsonNode node = JsonUtils.readTree(body);
        if (node == null || !EventTypes.GUEST_NOTIFICATION.equals(text(node, "type"))) {
            return Optional.empty();
        }
        return Optional.of(JsonUtils.writeValueAsString(node));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
