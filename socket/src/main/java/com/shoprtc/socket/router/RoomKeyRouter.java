package com.shoprtc.socket.router;

import com.shoprtc.core.metrics.MetricsNames;
import com.shoprtc.core.room.RoomKeys;
import com.shoprtc.socket.actor.ChatRoomActor;
import com.shoprtc.socket.actor.MailboxClosedException;
import com.shoprtc.socket.actor.PresenceRegistryActor;
import com.shoprtc.socket.actor.RoomNotifier;
import com.shoprtc.socket.config.RtcConfig;
import com.shoprtc.socket.log.DurableLog;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.redis.IRedisService;
import com.shoprtc.socket.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps room keys to their single {@link ChatRoomActor} and owns the process-wide
 * {@link PresenceRegistryActor}.
 * <p>
 * A room actor is created on first use and kept while any session is connected to it, so
 * every connection to a key, from any thread, reaches the same actor. An actor whose last
 * session has left retires and is removed; the next connection creates a fresh one, which
 * continues the same log. Also relays cross-room notifications: a notification is enqueued
 * on the target actor and never awaited.
 * </p>
 */
public class RoomKeyRouter implements RoomNotifier {
    private static final Logger log = LoggerFactory.getLogger(RoomKeyRouter.class);

    private static final int MAX_JOIN_ATTEMPTS = 3;

    private final RtcConfig config;
    private final IRedisService redisService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final PresenceRegistryActor presence;
    private final Map<String, ChatRoomActor> rooms = new ConcurrentHashMap<>();

    public RoomKeyRouter(
        RtcConfig config,
        IRedisService redisService,
        MetricsService metricsService,
        PresenceRegistryActor presence,
        Clock clock
    ) {
        this.config = config;
        this.redisService = redisService;
        this.metricsService = metricsService;
        this.presence = presence;
        this.clock = clock;

        metricsService.registerGauge(MetricsNames.ROOMS, rooms::size);
        metricsService.registerGauge(MetricsNames.ROOM_SESSIONS, this::getRoomSessionCount);
        metricsService.registerGauge(MetricsNames.ONLINE_USERS, presence::getOnlineCount);
    }

    /**
     * Validates a client-supplied room id and returns the actor owning it, creating the
     * actor if this is the first connection to the room.
     *
     * @throws IllegalArgumentException if the room id is not a valid room key
     */
    public ChatRoomActor resolve(String roomId) {
        String roomKey = RoomKeys.normalize(roomId);
        return rooms.computeIfAbsent(roomKey, this::createRoom);
    }

    /**
     * Connects a session to the actor owning {@code roomId}. If the actor retires between
     * lookup and connect, the session is connected to its replacement instead.
     *
     * @return Mono of the actor that now owns the session; errors with
     * {@link IllegalArgumentException} if the room id is not a valid room key
     */
    public Mono<ChatRoomActor> join(String roomId, Session session) {
        return Mono.defer(() -> {
                ChatRoomActor room = resolve(roomId);
                return room.connect(session).thenReturn(room);
            })
            .retryWhen(Retry.max(MAX_JOIN_ATTEMPTS).filter(MailboxClosedException.class::isInstance));
    }

    /**
     * The actor for {@code roomKey}, if one is live.
     */
    public Optional<ChatRoomActor> find(String roomKey) {
        return Optional.ofNullable(rooms.get(roomKey));
    }

    public PresenceRegistryActor presence() {
        return presence;
    }

    @Override
    public void notifyRoom(String roomKey, String payloadJson) {
        deliverToRoom(roomKey, payloadJson)
            .subscribe(
                delivered -> log.debug("Notification for room {} delivered to {} sessions", roomKey, delivered),
                err -> log.error("Failed to notify room {}", roomKey, err)
            );
    }

    /**
     * Pushes a payload verbatim to every session of a room. A room with no live actor has
     * nobody listening, which is not an error.
     *
     * @return Mono of the number of sessions the payload was queued for
     */
    public Mono<Integer> deliverToRoom(String roomKey, String payloadJson) {
        return find(roomKey)
            .map(room -> room.notifySessions(payloadJson)
                // Retired since the lookup: it had no sessions left
                .onErrorResume(MailboxClosedException.class, err -> Mono.just(0)))
            .orElseGet(() -> {
                log.debug("No actor for room {}, notification dropped", roomKey);
                return Mono.just(0);
            })
            .doOnNext(metricsService::recordNotify);
    }

    @Override
    public void notifyIdentity(String targetSlug, String payloadJson) {
        presence.notifyByIdentity(targetSlug, payloadJson)
            .subscribe(
                delivered -> { },
                err -> log.error("Failed to notify {}", targetSlug, err)
            );
    }

    /**
     * Closes every session of every room and of the presence registry.
     */
    public Mono<Void> closeAll() {
        return Flux.fromIterable(rooms.values())
            .flatMap(ChatRoomActor::closeAll)
            .then(presence.closeAll())
            .doOnSuccess(v -> log.info("Closed {} rooms and the presence registry", rooms.size()));
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public int getRoomSessionCount() {
        return rooms.values().stream().mapToInt(ChatRoomActor::getSessionCount).sum();
    }

    private ChatRoomActor createRoom(String roomKey) {
        log.info("Creating actor for room {}", roomKey);
        return ChatRoomActor.builder()
            .roomKey(roomKey)
            .durableLog(new DurableLog(roomKey, redisService, clock))
            .notifier(this)
            .metricsService(metricsService)
            .historyLimit(config.getRoomHistoryLimit())
            .retention(config.getRoomRetention())
            .idleListener(this::retire)
            .build();
    }

    private void retire(ChatRoomActor room) {
        if (rooms.remove(room.getRoomKey(), room)) {
            log.info("Removed idle actor for room {}, {} rooms live", room.getRoomKey(), rooms.size());
        }
    }
}
