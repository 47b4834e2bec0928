package com.shoprtc.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code rtc.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Accepted WebSocket connections.
     * <p>
     * Tags: nodeId, channel (room/presence)
     * </p>
     */
    public static final String CONNECTIONS_TOTAL = "rtc.socket.connections.total";

    /**
     * Counter: Upgrade requests rejected before the handshake.
     * <p>
     * Tags: nodeId, reason (missing_identity/invalid_token/bad_room)
     * </p>
     */
    public static final String REJECTIONS_TOTAL = "rtc.socket.rejections.total";

    /**
     * Gauge: Sessions currently registered with room actors.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ROOM_SESSIONS = "rtc.room.sessions";

    /**
     * Gauge: Room actors alive on this node.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ROOMS = "rtc.room.actors";

    /**
     * Gauge: Entries in the online directory.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ONLINE_USERS = "rtc.presence.online";

    /**
     * Counter: Messages written to a durable log.
     * <p>
     * Tags: nodeId, channel (room/general)
     * </p>
     */
    public static final String MESSAGES_PERSISTED_TOTAL = "rtc.log.persisted.total";

    /**
     * Counter: Submissions rejected because the durable write failed.
     * <p>
     * Tags: nodeId, channel (room/general)
     * </p>
     */
    public static final String PERSIST_FAILURES_TOTAL = "rtc.log.persist.failures.total";

    /**
     * Counter: Entries removed by retention sweeps.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String SWEPT_TOTAL = "rtc.log.swept.total";

    /**
     * Counter: Sessions dropped because a broadcast could not be emitted to them.
     * <p>
     * Tags: nodeId, reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "rtc.socket.drops.total";

    /**
     * Counter: Malformed client frames.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String MALFORMED_TOTAL = "rtc.socket.malformed.total";

    /**
     * Counter: Notification relays.
     * <p>
     * Tags: nodeId, result (delivered/missed)
     * </p>
     */
    public static final String NOTIFY_TOTAL = "rtc.presence.notify.total";

    /**
     * Timer: Durable append latency, from submission to acknowledged write.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String PERSIST_LATENCY = "rtc.log.persist.latency";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "rtc.socket.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "rtc.socket.network.outbound.ws.bytes";
}
