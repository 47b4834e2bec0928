package com.shoprtc.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RtcConfig {

    String nodeId;
    int httpPort;
    String redisUrl;

    /**
     * HS256 secret shared with the service that issues user tokens.
     */
    String jwtSecret;

    // Room log
    int roomHistoryLimit;      // messages replayed on join
    Duration roomRetention;    // entries older than this are swept on join

    // General channel
    int generalHistoryCap;     // messages kept, oldest dropped first

    // Transport
    int perConnBufferSize;     // outbound frames buffered per session before it is dropped
    int pingInterval;          // seconds of write-idle before a ping frame
    int idleTimeout;           // seconds of read-idle before the connection is closed

    public static RtcConfig fromEnv() {
        return RtcConfig.builder()
                .nodeId(getEnv("NODE_ID", "socket-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .jwtSecret(getEnv("JWT_SECRET", "change-me-change-me-change-me-change-me"))
                .roomHistoryLimit(Integer.parseInt(getEnv("ROOM_HISTORY_LIMIT", "50")))
                .roomRetention(Duration.ofDays(Long.parseLong(getEnv("ROOM_RETENTION_DAYS", "14"))))
                .generalHistoryCap(Integer.parseInt(getEnv("GENERAL_HISTORY_CAP", "100")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "30")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "90")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
