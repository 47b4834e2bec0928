package com.shoprtc.socket.support;

import com.shoprtc.socket.config.RtcConfig;

import java.time.Duration;

public final class TestConfigs {
    private TestConfigs() {
    }

    public static RtcConfig config() {
        return RtcConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .redisUrl("redis://localhost:6379")
            .jwtSecret("test-secret-test-secret-test-secret-42")
            .roomHistoryLimit(50)
            .roomRetention(Duration.ofDays(14))
            .generalHistoryCap(100)
            .perConnBufferSize(256)
            .pingInterval(30)
            .idleTimeout(90)
            .build();
    }
}
