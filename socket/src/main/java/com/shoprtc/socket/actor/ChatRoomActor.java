package com.shoprtc.socket.actor;

import com.shoprtc.core.model.Identity;
import com.shoprtc.core.msg.ChatMessage;
import com.shoprtc.core.msg.ClientFrame;
import com.shoprtc.core.msg.EventTypes;
import com.shoprtc.core.msg.MessageType;
import com.shoprtc.core.msg.ServerEvents;
import com.shoprtc.core.room.RoomKeys;
import com.shoprtc.core.room.RoomKind;
import com.shoprtc.core.util.JsonCodecException;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.log.DurableLog;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.session.Session;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Single-threaded owner of one room: its live sessions and its durable message log.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>HISTORY: {messages}, once, right after the connection is accepted</li>
 *   <li>MESSAGE: {message}, for every message persisted while connected</li>
 *   <li>PONG, in reply to PING</li>
 *   <li>{error}, to the sender only</li>
 * </ul>
 * </p>
 * <p>
 * <b>Ordering:</b> a message is persisted before it is broadcast, and both happen inside one
 * mailbox turn, so every session registered at that point sees messages in log order.
 * A session joining later sees earlier messages only through its history replay.
 * </p>
 * <p>
 * When an idle listener is set the actor retires as soon as its last session leaves, so a
 * room holds no memory while nobody is connected. The log stays in Redis.
 * </p>
 */
public class ChatRoomActor implements ConnectionActor {
    private static final Logger log = LoggerFactory.getLogger(ChatRoomActor.class);

    static final String INVALID_FORMAT = "Invalid message format";
    static final String DELIVERY_FAILED = "Message could not be delivered";

    private final String roomKey;
    private final RoomKind kind;
    private final DurableLog durableLog;
    private final RoomNotifier notifier;
    private final MetricsService metricsService;
    private final int historyLimit;
    private final Duration retention;
    private final Consumer<ChatRoomActor> idleListener;
    private final Mailbox mailbox;

    // Owned by the mailbox; insertion order is broadcast order
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final AtomicInteger sessionCount = new AtomicInteger();

    @Builder
    public ChatRoomActor(
        String roomKey,
        DurableLog durableLog,
        RoomNotifier notifier,
        MetricsService metricsService,
        int historyLimit,
        Duration retention,
        Consumer<ChatRoomActor> idleListener
    ) {
        this.roomKey = roomKey;
        this.kind = RoomKeys.kindOf(roomKey);
        this.durableLog = durableLog;
        this.notifier = notifier;
        this.metricsService = metricsService;
        this.historyLimit = historyLimit;
        this.retention = retention;
        this.idleListener = idleListener;
        this.mailbox = new Mailbox("room:" + roomKey);
    }

    /**
     * Sweeps expired messages, replays the newest {@code historyLimit} messages to the new
     * session and registers it. A failed sweep is skipped and expired entries are filtered
     * from the replay instead; a failed history read replays nothing rather than refusing
     * the connection.
     * <p>
     * Fails with {@link MailboxClosedException} once the actor has retired; the caller then
     * connects to the room's next actor.
     * </p>
     */
    @Override
    public Mono<Void> connect(Session session) {
        return mailbox.submit(() -> {
            if (mailbox.isClosed()) {
                return Mono.error(new MailboxClosedException(mailbox.getName()));
            }
            return join(session);
        });
    }

    private Mono<Void> join(Session session) {
        return durableLog.sweep(retention)
            .doOnNext(metricsService::recordSwept)
            .onErrorResume(err -> {
                log.warn("Retention sweep skipped for room {}: {}", roomKey, err.getMessage());
                return Mono.just(0L);
            })
            .then(Mono.defer(() -> durableLog.latest(historyLimit, retention)))
            .onErrorResume(err -> {
                log.warn("History unavailable for room {}, replaying nothing: {}", roomKey, err.getMessage());
                return Mono.just(List.<ChatMessage>of());
            })
            .doOnNext(history -> {
                String frame = JsonUtils.writeValueAsString(new ServerEvents.History(history));
                Sinks.EmitResult result = session.send(frame);
                if (result.isFailure()) {
                    log.warn("Could not send history to {} in room {}: {}", session, roomKey, result);
                    metricsService.recordDrop(result);
                    session.close();
                    retireIfIdle();
                    return;
                }
                sessions.put(session.getSessionId(), session);
                sessionCount.set(sessions.size());
                metricsService.recordRoomConnection();
                log.info("Session {} joined room {} ({} messages replayed, {} connected)",
                    session, roomKey, history.size(), sessions.size());
            })
            .then();
    }

    @Override
    public Mono<Void> receive(Session session, String rawPayload) {
        return mailbox.submit(() -> {
            if (!sessions.containsKey(session.getSessionId())) {
                log.debug("Ignoring frame from unregistered {} in room {}", session, roomKey);
                return Mono.empty();
            }

            ClientFrame frame;
            try {
                frame = JsonUtils.readValue(rawPayload, ClientFrame.class);
            } catch (JsonCodecException e) {
                return rejectMalformed(session, e.getMessage());
            }
            if (frame == null || frame.getType() == null) {
                return rejectMalformed(session, "missing type");
            }

            switch (frame.getType()) {
                case EventTypes.MESSAGE -> {
                    return submitMessage(session, frame);
                }
                case EventTypes.PING -> {
                    deliver(session, JsonUtils.writeValueAsString(new ServerEvents.Pong()));
                    return Mono.empty();
                }
                default -> log.debug("Ignoring frame type '{}' from {} in room {}", frame.getType(), session, roomKey);
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> disconnect(Session session) {
        return mailbox.submit(() -> Mono.fromRunnable(() -> {
            if (sessions.remove(session.getSessionId()) != null) {
                sessionCount.set(sessions.size());
                log.info("Session {} left room {} ({} connected)", session, roomKey, sessions.size());
                retireIfIdle();
            }
            session.close();
        }));
    }

    /**
     * Pushes an external payload verbatim to every session in the room. Nothing is persisted.
     *
     * @return Mono of the number of sessions the payload was queued for
     */
    public Mono<Integer> notifySessions(String payloadJson) {
        return mailbox.submit(() -> Mono.fromCallable(() -> broadcastFrame(payloadJson)));
    }

    @Override
    public Mono<Void> closeAll() {
        return mailbox.submit(() -> Mono.fromRunnable(() -> {
            sessions.values().forEach(Session::close);
            sessions.clear();
            sessionCount.set(0);
        }));
    }

    private Mono<Void> submitMessage(Session session, ClientFrame frame) {
        if (frame.getContent() == null) {
            return rejectMalformed(session, "missing content");
        }
        MessageType type;
        try {
            type = MessageType.fromWire(frame.getMessageType());
        } catch (IllegalArgumentException e) {
            return rejectMalformed(session, "unknown messageType " + frame.getMessageType());
        }

        Identity sender = session.getIdentity();
        long start = System.nanoTime();

        return durableLog.append(key -> ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .senderId(sender.getUserId())
                .senderName(sender.getUsername())
                .content(frame.getContent())
                .timestamp(key.millis())
                .type(type)
                .product(frame.getProduct())
                .build())
            .onErrorResume(err -> {
                // Not broadcast: a message that is not in the log could never be replayed
                log.error("Failed to persist message from {} in room {}", session, roomKey, err);
                metricsService.recordRoomPersistFailure();
                deliver(session, errorFrame(DELIVERY_FAILED));
                return Mono.empty();
            })
            .doOnNext(message -> {
                metricsService.recordRoomPersisted(start);
                int delivered = broadcastFrame(JsonUtils.writeValueAsString(new ServerEvents.Message(message)));
                log.debug("Message {} in room {} broadcast to {} sessions", message.getId(), roomKey, delivered);
                notifyOtherRooms(sender, message);
            })
            .then();
    }

    /**
     * Queues a serialized event for every registered session. A session whose emission fails
     * is removed and closed; the remaining sessions still receive the frame.
     *
     * @return number of sessions the frame was queued for
     */
    private int broadcastFrame(String frame) {
        int before = sessions.size();
        int delivered = 0;
        Iterator<Session> iterator = sessions.values().iterator();
        while (iterator.hasNext()) {
            Session target = iterator.next();
            Sinks.EmitResult result = target.send(frame);
            if (result.isSuccess()) {
                delivered++;
                continue;
            }
            log.warn("Dropping {} from room {}: {}", target, roomKey, result);
            iterator.remove();
            metricsService.recordDrop(result);
            target.close();
        }
        sessionCount.set(sessions.size());
        if (sessions.size() < before) {
            retireIfIdle();
        }
        return delivered;
    }

    private void deliver(Session session, String frame) {
        Sinks.EmitResult result = session.send(frame);
        if (result.isFailure() && sessions.remove(session.getSessionId()) != null) {
            log.warn("Dropping {} from room {}: {}", session, roomKey, result);
            sessionCount.set(sessions.size());
            metricsService.recordDrop(result);
            session.close();
            retireIfIdle();
        }
    }

    /**
     * Once the last session is gone, closes the mailbox and tells the listener, which stops
     * routing to this actor. Work already queued still runs; a queued connect fails with
     * {@link MailboxClosedException} and is retried on a fresh actor.
     */
    private void retireIfIdle() {
        if (idleListener == null || !sessions.isEmpty() || mailbox.isClosed()) {
            return;
        }
        log.info("Room {} is idle, retiring its actor", roomKey);
        mailbox.close();
        idleListener.accept(this);
    }

    private Mono<Void> rejectMalformed(Session session, String reason) {
        log.warn("Malformed frame from {} in room {}: {}", session, roomKey, reason);
        metricsService.recordMalformed();
        deliver(session, errorFrame(INVALID_FORMAT));
        return Mono.empty();
    }

    private void notifyOtherRooms(Identity sender, ChatMessage message) {
        switch (kind) {
            case GUEST -> {
                if (!sender.isGuest()) {
                    return;
                }
                RoomKeys.lobbyOf(roomKey).ifPresent(lobby -> notifier.notifyRoom(lobby,
                    JsonUtils.writeValueAsString(ServerEvents.GuestNotification.builder()
                        .roomId(roomKey)
                        .guestId(sender.getUserId())
                        .guestName(sender.getUsername())
                        .lastMessage(message.getContent())
                        .timestamp(message.getTimestamp())
                        .product(message.getProduct())
                        .build())));
            }
            case DIRECT -> RoomKeys.directCounterpart(roomKey, sender.getShopSlug())
                .ifPresent(target -> notifier.notifyIdentity(target,
                    JsonUtils.writeValueAsString(ServerEvents.DirectMessageNotification.builder()
                        .targetSlug(target)
                        .roomId(roomKey)
                        .senderName(sender.getUsername())
                        .lastMessage(message.getContent())
                        .timestamp(message.getTimestamp())
                        .build())));
            default -> {
            }
        }
    }

    private static String errorFrame(String error) {
        return JsonUtils.writeValueAsString(new ServerEvents.ErrorReply(error));
    }

    public String getRoomKey() {
        return roomKey;
    }

    /**
     * Registered sessions; safe to read from any thread.
     */
    public int getSessionCount() {
        return sessionCount.get();
    }
}
