package com.shoprtc.socket.ws;

import com.shoprtc.core.model.Identity;
import com.shoprtc.core.room.RoomKeys;
import com.shoprtc.socket.actor.ConnectionActor;
import com.shoprtc.socket.actor.PresenceRegistryActor;
import com.shoprtc.socket.auth.ConnectionIdentityResolver;
import com.shoprtc.socket.config.RtcConfig;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.router.RoomKeyRouter;
import com.shoprtc.socket.session.Session;
import com.shoprtc.socket.session.SessionFactory;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Handles WebSocket upgrades for room and presence channels.
 * <p>
 * The identity, and for rooms the room key, are resolved from the HTTP request before the
 * upgrade, so a rejected request never reaches an actor or creates one.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    static final String EXPECTED_UPGRADE = "Expected Upgrade: websocket";

    private final WebSocketHandler wsHandler;
    private final RoomKeyRouter router;
    private final ConnectionIdentityResolver identityResolver;
    private final SessionFactory sessionFactory;
    private final MetricsService metricsService;

    public WebSocketUpgradeHandler(
        RtcConfig config,
        RoomKeyRouter router,
        ConnectionIdentityResolver identityResolver,
        MetricsService metricsService
    ) {
        this.wsHandler = new WebSocketHandler(config, metricsService);
        this.router = router;
        this.identityResolver = identityResolver;
        this.sessionFactory = new SessionFactory(config);
        this.metricsService = metricsService;
    }

    /**
     * Upgrades a request for {@code /api/chat/room/{roomId}}.
     */
    public Mono<Void> handleRoom(HttpServerRequest req, HttpServerResponse res) {
        Admission admission = admitRoom(
            req.requestHeaders().get(HttpHeaderNames.UPGRADE),
            QueryStringDecoder.decodeComponent(req.param("roomId")),
            new QueryStringDecoder(req.uri()).parameters()
        );
        if (!admission.isAccepted()) {
            return reject(res, admission);
        }

        String roomKey = admission.getRoomKey();
        MDC.put("roomKey", roomKey);
        return upgrade(res, session -> router.join(roomKey, session),
            sessionFactory.createSession(admission.getIdentity()));
    }

    /**
     * Upgrades a request for {@code /api/chat/presence}.
     */
    public Mono<Void> handlePresence(HttpServerRequest req, HttpServerResponse res) {
        Admission admission = admitPresence(
            req.requestHeaders().get(HttpHeaderNames.UPGRADE),
            new QueryStringDecoder(req.uri()).parameters()
        );
        if (!admission.isAccepted()) {
            return reject(res, admission);
        }

        PresenceRegistryActor presence = router.presence();
        return upgrade(res, session -> presence.connect(session).thenReturn(presence),
            sessionFactory.createSession(admission.getIdentity()));
    }

    /**
     * Decides whether a room upgrade may proceed: 426 without an upgrade header, 400 for an
     * invalid room id, 401 without an acceptable identity. Creates nothing.
     */
    Admission admitRoom(String upgradeHeader, String roomId, Map<String, List<String>> params) {
        if (!isWebSocketUpgrade(upgradeHeader)) {
            return Admission.rejected(426, EXPECTED_UPGRADE, "not_upgrade");
        }
        String roomKey;
        try {
            roomKey = RoomKeys.normalize(roomId);
        } catch (IllegalArgumentException e) {
            return Admission.rejected(400, e.getMessage(), "invalid_room");
        }
        ConnectionIdentityResolver.Resolution resolution = identityResolver.forRoom(params);
        if (!resolution.isAccepted()) {
            return Admission.rejected(401, resolution.getError(), resolution.getReason());
        }
        return Admission.accepted(roomKey, resolution.getIdentity());
    }

    Admission admitPresence(String upgradeHeader, Map<String, List<String>> params) {
        if (!isWebSocketUpgrade(upgradeHeader)) {
            return Admission.rejected(426, EXPECTED_UPGRADE, "not_upgrade");
        }
        ConnectionIdentityResolver.Resolution resolution = identityResolver.forPresence(params);
        if (!resolution.isAccepted()) {
            return Admission.rejected(401, resolution.getError(), resolution.getReason());
        }
        return Admission.accepted(null, resolution.getIdentity());
    }

    private Mono<Void> upgrade(HttpServerResponse res, Function<Session, Mono<? extends ConnectionActor>> connector,
                               Session session) {
        log.debug("Upgrading {} to WebSocket", session);
        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, connector, session));
    }

    private Mono<Void> reject(HttpServerResponse res, Admission admission) {
        log.warn("Rejecting WebSocket upgrade with {}: {}", admission.getStatus(), admission.getError());
        metricsService.recordRejection(admission.getReason());
        return res.status(admission.getStatus()).sendString(Mono.just(admission.getError())).then();
    }

    private static boolean isWebSocketUpgrade(String upgradeHeader) {
        return "websocket".equalsIgnoreCase(upgradeHeader);
    }

    /**
     * Outcome of checking one upgrade request: a room key (rooms only) and identity, or an
     * HTTP status with its message.
     */
    @Value
    static class Admission {
        String roomKey;
        Identity identity;
        int status;
        String error;

        /**
         * Short tag for the rejection counter.
         */
        String reason;

        static Admission accepted(String roomKey, Identity identity) {
            return new Admission(roomKey, identity, 101, null, null);
        }

        static Admission rejected(int status, String error, String reason) {
            return new Admission(null, null, status, error, reason);
        }

        boolean isAccepted() {
            return identity != null;
        }
    }
}
