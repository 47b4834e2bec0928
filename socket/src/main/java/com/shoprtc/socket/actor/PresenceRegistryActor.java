package com.shoprtc.socket.actor;

import com.shoprtc.core.model.OnlineUser;
import com.shoprtc.core.model.PresenceStatus;
import com.shoprtc.core.msg.ChatMessage;
import com.shoprtc.core.msg.ClientFrame;
import com.shoprtc.core.msg.EventTypes;
import com.shoprtc.core.msg.MessageType;
import com.shoprtc.core.msg.ServerEvents;
import com.shoprtc.core.util.JsonCodecException;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.log.GeneralChatLog;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide directory of online users, the shared "general" channel, and the relay for
 * notifications addressed to a user by shop slug.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>PRESENCE: {userId, username, status} when another user comes online or goes offline</li>
 *   <li>ONLINE_USERS: {users}, once, right after the connection is accepted</li>
 *   <li>HISTORY: {messages}, the general channel's recent messages, right after ONLINE_USERS</li>
 *   <li>CHAT_MESSAGE: {message}, for every general channel message</li>
 *   <li>relayed notifications, verbatim</li>
 * </ul>
 * </p>
 * <p>
 * At most one entry exists per userId. A second connection for the same user replaces the
 * entry; the replaced connection stays open but no longer receives anything, and closing it
 * does not affect the newer entry.
 * </p>
 */
public class PresenceRegistryActor implements ConnectionActor {
    private static final Logger log = LoggerFactory.getLogger(PresenceRegistryActor.class);

    static final String INVALID_FORMAT = "Invalid message format";
    static final String DELIVERY_FAILED = "Message could not be delivered";

    private final GeneralChatLog generalLog;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Mailbox mailbox = new Mailbox("presence");

    // Owned by the mailbox
    private final Map<String, PresenceEntry> entries = new LinkedHashMap<>();
    private long lastTimestamp;
    private final AtomicInteger onlineCount = new AtomicInteger();

    public PresenceRegistryActor(GeneralChatLog generalLog, MetricsService metricsService, Clock clock) {
        this.generalLog = generalLog;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public Mono<Void> connect(Session session) {
        return mailbox.submit(() -> {
            PresenceEntry entry = new PresenceEntry(session);
            PresenceEntry replaced = entries.put(entry.getUserId(), entry);
            if (replaced != null) {
                log.info("User {} reconnected, replacing {}", entry.getUserId(), replaced.getSession());
                replaced.transitionTo(PresenceStatus.OFFLINE);
            }
            entry.transitionTo(PresenceStatus.ONLINE);
            onlineCount.set(entries.size());
            metricsService.recordPresenceConnection();
            log.info("User {} ({}) online, {} users online", entry.getUserId(), entry.getUsername(), entries.size());

            broadcast(presenceFrame(entry, PresenceStatus.ONLINE), session);

            List<OnlineUser> online = new ArrayList<>();
            entries.values().forEach(e -> online.add(e.toOnlineUser()));
            if (!deliver(entry, JsonUtils.writeValueAsString(new ServerEvents.OnlineUsers(online)))) {
                return Mono.empty();
            }

            return generalLog.history()
                .doOnNext(history -> deliver(entry, JsonUtils.writeValueAsString(new ServerEvents.History(history))))
                .then();
        });
    }

    @Override
    public Mono<Void> receive(Session session, String rawPayload) {
        return mailbox.submit(() -> {
            PresenceEntry entry = entries.get(session.getUserId());
            if (entry == null || entry.getSession() != session) {
                log.debug("Ignoring frame from unregistered {}", session);
                return Mono.empty();
            }

            ClientFrame frame;
            try {
                frame = JsonUtils.readValue(rawPayload, ClientFrame.class);
            } catch (JsonCodecException e) {
                return rejectMalformed(entry, e.getMessage());
            }
            if (frame == null || frame.getType() == null) {
                return rejectMalformed(entry, "missing type");
            }

            switch (frame.getType()) {
                case EventTypes.CHAT_MESSAGE -> {
                    return submitGeneralMessage(entry, frame);
                }
                case EventTypes.PING -> {
                    deliver(entry, JsonUtils.writeValueAsString(new ServerEvents.Pong()));
                    return Mono.empty();
                }
                default -> log.debug("Ignoring frame type '{}' from {}", frame.getType(), session);
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> disconnect(Session session) {
        return mailbox.submit(() -> Mono.fromRunnable(() -> {
            PresenceEntry entry = entries.get(session.getUserId());
            if (entry != null && entry.getSession() == session) {
                evict(entry);
            }
            session.close();
        }));
    }

    /**
     * Pushes a payload verbatim to every online user whose shop slug equals {@code targetKey}.
     * No match is not an error.
     *
     * @return Mono of the number of connections the payload was queued for
     */
    public Mono<Integer> notifyByIdentity(String targetKey, String payloadJson) {
        return mailbox.submit(() -> Mono.fromCallable(() -> {
            if (targetKey == null || targetKey.isBlank()) {
                metricsService.recordNotify(0);
                return 0;
            }
            int delivered = 0;
            List<PresenceEntry> failed = new ArrayList<>();
            for (PresenceEntry entry : entries.values()) {
                if (!targetKey.equals(entry.getShopSlug())) {
                    continue;
                }
                Sinks.EmitResult result = entry.getSession().send(payloadJson);
                if (result.isSuccess()) {
                    delivered++;
                } else {
                    metricsService.recordDrop(result);
                    failed.add(entry);
                }
            }
            failed.forEach(this::evict);
            metricsService.recordNotify(delivered);
            log.debug("Notification for '{}' delivered to {} connections", targetKey, delivered);
            return delivered;
        }));
    }

    /**
     * Current status of a user; {@code OFFLINE} with no username if the user is not registered.
     */
    public Mono<OnlineUser> status(String userId) {
        return mailbox.submit(() -> Mono.fromCallable(() -> {
            PresenceEntry entry = entries.get(userId);
            return entry != null ? entry.toOnlineUser() : new OnlineUser(userId, null, PresenceStatus.OFFLINE);
        }));
    }

    @Override
    public Mono<Void> closeAll() {
        return mailbox.submit(() -> Mono.fromRunnable(() -> {
            entries.values().forEach(entry -> {
                entry.transitionTo(PresenceStatus.OFFLINE);
                entry.getSession().close();
            });
            entries.clear();
            onlineCount.set(0);
        }));
    }

    private Mono<Void> submitGeneralMessage(PresenceEntry sender, ClientFrame frame) {
        if (frame.getContent() == null) {
            return rejectMalformed(sender, "missing content");
        }

        ChatMessage message = ChatMessage.builder()
            .id(UUID.randomUUID().toString())
            .senderId(sender.getUserId())
            .senderName(sender.getUsername())
            .content(frame.getContent())
            .timestamp(nextTimestamp())
            .type(MessageType.TEXT)
            .build();

        return generalLog.append(message)
            .onErrorResume(err -> {
                log.error("Failed to persist general message from {}", sender.getUserId(), err);
                metricsService.recordGeneralPersistFailure();
                deliver(sender, errorFrame(DELIVERY_FAILED));
                return Mono.empty();
            })
            .doOnNext(stored -> {
                metricsService.recordGeneralPersisted();
                broadcast(JsonUtils.writeValueAsString(new ServerEvents.GeneralMessage(stored)), null);
            })
            .then();
    }

    /**
     * Queues a frame for every entry except {@code except}'s. Entries whose emission fails are
     * evicted after the loop, which announces them as offline to the rest.
     */
    private int broadcast(String frame, Session except) {
        int delivered = 0;
        List<PresenceEntry> failed = new ArrayList<>();
        for (PresenceEntry entry : entries.values()) {
            if (entry.getSession() == except) {
                continue;
            }
            Sinks.EmitResult result = entry.getSession().send(frame);
            if (result.isSuccess()) {
                delivered++;
            } else {
                log.warn("Dropping {} from presence: {}", entry.getSession(), result);
                metricsService.recordDrop(result);
                failed.add(entry);
            }
        }
        failed.forEach(this::evict);
        return delivered;
    }

    private boolean deliver(PresenceEntry entry, String frame) {
        Sinks.EmitResult result = entry.getSession().send(frame);
        if (result.isFailure()) {
            log.warn("Dropping {} from presence: {}", entry.getSession(), result);
            metricsService.recordDrop(result);
            evict(entry);
            return false;
        }
        return true;
    }

    private void evict(PresenceEntry entry) {
        if (!entries.remove(entry.getUserId(), entry)) {
            return;
        }
        entry.transitionTo(PresenceStatus.OFFLINE);
        onlineCount.set(entries.size());
        entry.getSession().close();
        log.info("User {} ({}) offline, {} users online", entry.getUserId(), entry.getUsername(), entries.size());
        broadcast(presenceFrame(entry, PresenceStatus.OFFLINE), null);
    }

    private Mono<Void> rejectMalformed(PresenceEntry entry, String reason) {
        log.warn("Malformed frame from {} on presence: {}", entry.getSession(), reason);
        metricsService.recordMalformed();
        deliver(entry, errorFrame(INVALID_FORMAT));
        return Mono.empty();
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(clock.millis(), lastTimestamp);
        return lastTimestamp;
    }

    private static String presenceFrame(PresenceEntry entry, PresenceStatus status) {
        return JsonUtils.writeValueAsString(
            new ServerEvents.Presence(entry.getUserId(), entry.getUsername(), status));
    }

    private static String errorFrame(String error) {
        return JsonUtils.writeValueAsString(new ServerEvents.ErrorReply(error));
    }

    /**
     * Users currently in the directory; safe to read from any thread.
     */
    public int getOnlineCount() {
        return onlineCount.get();
    }
}
