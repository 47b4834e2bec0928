package com.shoprtc.socket.http;

import com.shoprtc.core.room.RoomKeys;
import com.shoprtc.core.util.JsonCodecException;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.config.RtcConfig;
import com.shoprtc.socket.metrics.PrometheusMetricsExporter;
import com.shoprtc.socket.router.RoomKeyRouter;
import com.shoprtc.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, internal notifications, presence lookups and
 * WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String JSON = "application/json";

    private final RtcConfig config;
    private final RoomKeyRouter router;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/api/chat/room/{roomId}", upgradeHandler::handleRoom)
                .get("/api/chat/presence", upgradeHandler::handlePresence)
                .get("/api/presence/{userId}", this::presenceStatus)
                .post("/internal/presence/notify", this::notifyPresence)
                .post("/internal/rooms/{roomId}/notify", this::notifyRoom)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    private Mono<Void> presenceStatus(HttpServerRequest req, HttpServerResponse res) {
        String userId = QueryStringDecoder.decodeComponent(req.param("userId"));
        return router.presence().status(userId)
            .flatMap(user -> res.status(200)
                .header("Content-Type", JSON)
                .sendString(Mono.just(JsonUtils.writeValueAsString(user)))
                .then());
    }

    private Mono<Void> notifyPresence(HttpServerRequest req, HttpServerResponse res) {
        return req.receive().aggregate().asString().defaultIfEmpty("")
            .flatMap(body -> {
                Optional<NotifyRequests.PresenceNotify> request;
                try {
                    request = NotifyRequests.parsePresenceNotify(body);
                } catch (JsonCodecException e) {
                    log.warn("Unreadable presence notification: {}", e.getMessage());
                    return res.status(400).sendString(Mono.just("Invalid body")).then();
                }
                if (request.isEmpty()) {
                    return res.status(400).sendString(Mono.just("Missing targetKey")).then();
                }
                NotifyRequests.PresenceNotify notify = request.get();
                return router.presence().notifyByIdentity(notify.getTargetKey(), notify.getPayloadJson())
                    .doOnNext(delivered -> log.debug("Presence notification for {} delivered to {}",
                        notify.getTargetKey(), delivered))
                    .then(res.status(200).sendString(Mono.just("OK")).then());
            });
    }

    private Mono<Void> notifyRoom(HttpServerRequest req, HttpServerResponse res) {
        String roomKey;
        try {
            roomKey = RoomKeys.normalize(QueryStringDecoder.decodeComponent(req.param("roomId")));
        } catch (IllegalArgumentException e) {
            return res.status(400).sendString(Mono.just(e.getMessage())).then();
        }

        return req.receive().aggregate().asString().defaultIfEmpty("")
            .flatMap(body -> {
                Optional<String> payload;
                try {
                    payload = NotifyRequests.parseRoomNotify(body);
                } catch (JsonCodecException e) {
                    log.warn("Unreadable room notification for {}: {}", roomKey, e.getMessage());
                    return res.status(400).sendString(Mono.just("Invalid body")).then();
                }
                if (payload.isEmpty()) {
                    return res.status(400).sendString(Mono.just("Unknown type")).then();
                }
                return router.deliverToRoom(roomKey, payload.get())
                    .then(res.status(200).sendString(Mono.just("OK")).then());
            });
    }
}
