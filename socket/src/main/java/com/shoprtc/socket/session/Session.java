package com.shoprtc.socket.session;

import com.shoprtc.core.model.Identity;
import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One live connection and the identity it was opened with.
 * <p>
 * Frames are serialized before they reach the session; the sink buffers them until the
 * WebSocket outbound drains it. Never persisted: a reconnect creates a new session.
 * </p>
 */
@Getter
public class Session {
    private final String sessionId;
    private final Identity identity;
    private final Sinks.Many<String> sink;
    @Getter(AccessLevel.NONE)
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();
    @Getter(AccessLevel.NONE)
    private volatile boolean closed;

    public Session(String sessionId, Identity identity, Sinks.Many<String> sink) {
        this.sessionId = sessionId;
        this.identity = identity;
        this.sink = sink;
    }

    /**
     * Queues a frame for this connection.
     *
     * @param frame serialized event
     * @return result of the emission; any failure means the frame was not queued
     */
    public Sinks.EmitResult send(String frame) {
        return sink.tryEmitNext(frame);
    }

    /**
     * Completes the outbound stream, which ends the connection once queued frames are written.
     * Idempotent.
     */
    public void close() {
        closed = true;
        sink.tryEmitComplete();
        closeSignal.tryEmitEmpty();
    }

    /**
     * Completes once the session has been closed, by the client or by the actor dropping it.
     */
    public Mono<Void> onClose() {
        return closeSignal.asMono();
    }

    public boolean isClosed() {
        return closed;
    }

    public Flux<String> getOutboundFlux() {
        return sink.asFlux();
    }

    public String getUserId() {
        return identity.getUserId();
    }

    @Override
    public String toString() {
        return "Session[" + sessionId + ", user=" + identity.getUserId() + "]";
    }
}
