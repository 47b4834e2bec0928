package com.shoprtc.socket.ws;

import com.shoprtc.core.util.BytesUtils;
import com.shoprtc.socket.actor.ConnectionActor;
import com.shoprtc.socket.actor.MailboxClosedException;
import com.shoprtc.socket.config.RtcConfig;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.session.Session;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Pumps one accepted WebSocket between the network and the actor that owns it.
 * <p>
 * The session is connected before any inbound frame is read, inbound text frames are
 * handed to the actor one at a time, and the session's outbound stream is written as it
 * fills. Closing the socket, from either side, disconnects the session, and an actor
 * dropping the session closes the socket.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final RtcConfig config;
    private final MetricsService metricsService;

    public WebSocketHandler(RtcConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;
    }

    /**
     * Handles the WebSocket connection lifecycle.
     *
     * @param inbound   WebSocket inbound
     * @param outbound  WebSocket outbound
     * @param connector connects the session and emits the room or presence actor that owns it
     * @param session   session created for the resolved identity
     * @return Publisher for the connection
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
                                  Function<Session, Mono<? extends ConnectionActor>> connector, Session session) {
        MDC.put("userId", session.getUserId());
        log.debug("WebSocket handshake for {}", session);

        AtomicReference<ConnectionActor> owner = new AtomicReference<>();
        handleConnectionStateUpdates(inbound, owner, session);

        return connector.apply(session)
            .flatMap(actor -> {
                owner.set(actor);
                if (session.isClosed()) {
                    // Socket went away while connecting
                    return actor.disconnect(session);
                }
                // Completes when either side closes, which closes the socket
                return Mono.when(
                    outbound.sendString(sendOutboundMessages(session)),
                    handleInboundMessages(inbound, actor, session)
                );
            })
            .onErrorResume(err -> {
                log.error("WebSocket error for {}", session, err);
                ConnectionActor actor = owner.get();
                Mono<Void> cleanup = actor == null
                    ? Mono.fromRunnable(session::close)
                    : actor.disconnect(session).onErrorResume(e -> {
                        log.debug("Disconnect after error failed for {}: {}", session, e.getMessage());
                        return Mono.empty();
                    });
                return cleanup.then(outbound.sendClose());
            });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, AtomicReference<ConnectionActor> owner,
                                              Session session) {
        inbound.withConnection(connection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingTimeoutInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingTimeoutInMillis, () ->
                    connection.channel().writeAndFlush(new PingWebSocketFrame()))
                .onReadIdle(idleTimeoutInMillis, () -> {
                    log.debug("Closing idle connection of {}", session);
                    connection.dispose();
                })
                .onDispose(() -> {
                    log.debug("WebSocket connection disposed for {}, disconnecting", session);
                    ConnectionActor actor = owner.get();
                    if (actor == null) {
                        // Still connecting; the connect path sees the closed session
                        session.close();
                        return;
                    }
                    actor.disconnect(session).subscribe(
                        v -> { },
                        err -> {
                            if (err instanceof MailboxClosedException) {
                                log.debug("{} already gone with its retired room", session);
                            } else {
                                log.error("Failed to disconnect {}", session, err);
                            }
                        }
                    );
                });
        });
    }

    /**
     * Client frames until the session closes. An actor closes a session it drops, which ends
     * this stream and with it the connection.
     */
    static Flux<String> untilClosed(Flux<String> frames, Session session) {
        return frames.takeUntilOther(session.onClose());
    }

    private Flux<String> sendOutboundMessages(Session session) {
        return session.getOutboundFlux()
            .doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(frame)));
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, ConnectionActor actor, Session session) {
        return inbound.aggregateFrames()
            .receiveFrames()
            .ofType(TextWebSocketFrame.class)
            .map(TextWebSocketFrame::text)
            .transform(frames -> untilClosed(frames, session))
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .concatMap(msg -> {
                metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(msg));
                return actor.receive(session, msg).onErrorResume(err -> {
                    log.warn("Error processing frame from {}: {}", session, err.getMessage());
                    return Mono.empty();
                });
            })
            .doOnError(err -> {
                // AbortedException is expected on close
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", session, err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then();
    }
}
