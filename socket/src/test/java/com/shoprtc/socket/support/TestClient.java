package com.shoprtc.socket.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.shoprtc.core.model.Identity;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.session.Session;
import com.shoprtc.socket.session.SessionFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A session plus everything written to it, standing in for a WebSocket client.
 */
public class TestClient {
    private final Session session;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    private TestClient(Session session, boolean subscribe) {
        this.session = session;
        if (subscribe) {
            session.getOutboundFlux().subscribe(frames::add, err -> closed = true, () -> closed = true);
        }
    }

    public static TestClient of(Identity identity) {
        return new TestClient(new SessionFactory(256).createSession(identity), true);
    }

    /**
     * A client that never reads, with room for a single queued frame.
     */
    public static TestClient stalled(Identity identity) {
        return new TestClient(new SessionFactory(1).createSession(identity), false);
    }

    public static TestClient user(String userId, String username, String shopSlug) {
        return of(Identity.authenticated(userId, username, shopSlug));
    }

    public static TestClient guest(String guestId, String guestName) {
        return of(Identity.guest(guestId, guestName));
    }

    public Session session() {
        return session;
    }

    public List<JsonNode> frames() {
        return frames.stream().map(JsonUtils::readTree).collect(Collectors.toList());
    }

    public List<String> rawFrames() {
        return List.copyOf(frames);
    }

    public List<JsonNode> framesOfType(String type) {
        return frames().stream()
            .filter(node -> node.has("type") && type.equals(node.get("type").asText()))
            .collect(Collectors.toList());
    }

    public List<JsonNode> errors() {
        return frames().stream().filter(node -> node.has("error")).collect(Collectors.toList());
    }

    /**
     * Waits for cross-actor deliveries, which are not awaited by the sender.
     */
    public List<JsonNode> awaitFramesOfType(String type, int count) {
        long deadline = System.currentTimeMillis() + 2000;
        List<JsonNode> matching = framesOfType(type);
        while (matching.size() < count && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            matching = framesOfType(type);
        }
        return matching;
    }

    public void clear() {
        frames.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
