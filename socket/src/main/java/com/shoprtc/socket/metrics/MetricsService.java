package com.shoprtc.socket.metrics;

import com.shoprtc.core.metrics.MetricsNames;
import com.shoprtc.core.metrics.MetricsTags;
import com.shoprtc.socket.config.RtcConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for socket node.
 */
public class MetricsService {

    public static final String CHANNEL_ROOM = "room";
    public static final String CHANNEL_PRESENCE = "presence";
    public static final String CHANNEL_GENERAL = "general";

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter roomConnections;
    private final Counter presenceConnections;
    private final Counter roomPersisted;
    private final Counter generalPersisted;
    private final Counter roomPersistFailures;
    private final Counter generalPersistFailures;
    private final Counter swept;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;
    private final Counter malformed;
    private final Counter notifyDelivered;
    private final Counter notifyMissed;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeInbound;

    // Timers
    private final Timer persistLatency;

    public MetricsService(MeterRegistry registry, RtcConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        roomConnections = channelCounter(MetricsNames.CONNECTIONS_TOTAL, CHANNEL_ROOM,
            "WebSocket connections accepted by room actors");
        presenceConnections = channelCounter(MetricsNames.CONNECTIONS_TOTAL, CHANNEL_PRESENCE,
            "WebSocket connections accepted by the presence registry");

        roomPersisted = channelCounter(MetricsNames.MESSAGES_PERSISTED_TOTAL, CHANNEL_ROOM,
            "Room messages written to the durable log");
        generalPersisted = channelCounter(MetricsNames.MESSAGES_PERSISTED_TOTAL, CHANNEL_GENERAL,
            "General channel messages written to Redis");

        roomPersistFailures = channelCounter(MetricsNames.PERSIST_FAILURES_TOTAL, CHANNEL_ROOM,
            "Room submissions rejected because the write failed");
        generalPersistFailures = channelCounter(MetricsNames.PERSIST_FAILURES_TOTAL, CHANNEL_GENERAL,
            "General channel submissions rejected because the write failed");

        swept = Counter.builder(MetricsNames.SWEPT_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Room log entries removed by retention sweeps")
            .register(registry);

        dropsBufferFull = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Sessions dropped because their outbound buffer was full")
            .register(registry);

        dropsClosed = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "closed")
            .description("Sessions dropped because their outbound stream was already closed")
            .register(registry);

        malformed = Counter.builder(MetricsNames.MALFORMED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Client frames that could not be parsed")
            .register(registry);

        notifyDelivered = Counter.builder(MetricsNames.NOTIFY_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "delivered")
            .register(registry);

        notifyMissed = Counter.builder(MetricsNames.NOTIFY_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "missed")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        // Timer with percentile histogram for p95, p99 tracking
        persistLatency = Timer.builder(MetricsNames.PERSIST_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Durable append latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    private Counter channelCounter(String name, String channel, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.CHANNEL, channel)
            .description(description)
            .register(registry);
    }

    /**
     * Registers a gauge sampled from live actor state.
     *
     * @param name  metric name from {@link MetricsNames}
     * @param value sampled on every scrape
     */
    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    public void recordRoomConnection() {
        roomConnections.increment();
    }

    public void recordPresenceConnection() {
        presenceConnections.increment();
    }

    /**
     * Records an upgrade request rejected before the handshake.
     *
     * @param reason short machine-readable reason, used as a tag
     */
    public void recordRejection(String reason) {
        Counter.builder(MetricsNames.REJECTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    /**
     * Records a successful room-log append and its latency.
     *
     * @param startNanos {@link System#nanoTime()} at submission
     */
    public void recordRoomPersisted(long startNanos) {
        roomPersisted.increment();
        persistLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordGeneralPersisted() {
        generalPersisted.increment();
    }

    public void recordRoomPersistFailure() {
        roomPersistFailures.increment();
    }

    public void recordGeneralPersistFailure() {
        generalPersistFailures.increment();
    }

    public void recordSwept(long entries) {
        swept.increment(entries);
    }

    /**
     * Records a session dropped after a failed emission.
     *
     * @param result the failed emission result
     */
    public void recordDrop(Sinks.EmitResult result) {
        if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
            dropsClosed.increment();
        } else {
            dropsBufferFull.increment();
        }
    }

    public void recordMalformed() {
        malformed.increment();
    }

    public void recordNotify(int delivered) {
        if (delivered > 0) {
            notifyDelivered.increment(delivered);
        } else {
            notifyMissed.increment();
        }
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public double getRoomPersistedCount() {
        return roomPersisted.count();
    }

    public double getRoomPersistFailureCount() {
        return roomPersistFailures.count();
    }

}
