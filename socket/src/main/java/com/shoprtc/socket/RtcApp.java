package com.shoprtc.socket;

import com.shoprtc.socket.actor.PresenceRegistryActor;
import com.shoprtc.socket.auth.ConnectionIdentityResolver;
import com.shoprtc.socket.auth.JwtIdentityVerifier;
import com.shoprtc.socket.config.RtcConfig;
import com.shoprtc.socket.http.HttpServer;
import com.shoprtc.socket.log.GeneralChatLog;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.metrics.PrometheusMetricsExporter;
import com.shoprtc.socket.redis.RedisService;
import com.shoprtc.socket.router.RoomKeyRouter;
import com.shoprtc.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the chat node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve room WebSockets at /api/chat/room/{roomId} (query: token, or guestId and guestName)</li>
 *   <li>Serve the presence WebSocket at /api/chat/presence (query: token)</li>
 *   <li>Persist room logs and the general channel in Redis</li>
 *   <li>Relay guest and direct-message notifications</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class RtcApp {
    private static final Logger log = LoggerFactory.getLogger(RtcApp.class);

    public static void main(String[] args) {
        RtcConfig config = RtcConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting chat node: {}", config.getNodeId());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Room history: {} messages, retention {}", config.getRoomHistoryLimit(), config.getRoomRetention());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RedisService redisService = new RedisService(config);
        Clock clock = Clock.systemUTC();

        PresenceRegistryActor presence = new PresenceRegistryActor(
            new GeneralChatLog(redisService, config.getGeneralHistoryCap()), metricsService, clock
        );
        RoomKeyRouter router = new RoomKeyRouter(config, redisService, metricsService, presence, clock);

        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config,
            router,
            new ConnectionIdentityResolver(new JwtIdentityVerifier(config.getJwtSecret())),
            metricsService
        );

        HttpServer httpServer = new HttpServer(config, router, upgradeHandler, metricsExporter);
        httpServer.start();

        log.info("Chat node {} is ready", config.getNodeId());

        handleShutdown(config, router, httpServer, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(RtcConfig config,
                                       RoomKeyRouter router,
                                       HttpServer httpServer,
                                       RedisService redisService) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            // Close sessions first so clients see a clean close
            router.closeAll().block(Duration.ofSeconds(10));

            // Stop WS server
            httpServer.stop();

            // Close Redis
            redisService.close();

            log.info("Shutdown complete");
        }));
    }
}
