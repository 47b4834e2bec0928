package com.shoprtc.socket.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serialized operation queue of one actor.
 * <p>
 * Operations run strictly one at a time in the order they were submitted, including any
 * Redis I/O they wait on, so the state an actor owns is never touched concurrently and
 * needs no locks. Different mailboxes are independent: an operation waiting on I/O holds
 * back only its own actor.
 * </p>
 * <p>
 * A failing operation fails only the {@code Mono} returned to its submitter; the mailbox
 * keeps draining.
 * </p>
 */
public class Mailbox {
    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private static final Duration CONTENTION_TIMEOUT = Duration.ofSeconds(2);

    private final String name;
    private final Sinks.Many<Mono<Void>> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicLong pending = new AtomicLong();
    private volatile boolean closed;

    public Mailbox(String name) {
        this.name = name;
        queue.asFlux()
            .concatMap(task -> task)
            .subscribe(
                v -> { },
                err -> log.error("Mailbox {} terminated unexpectedly", name, err)
            );
    }

    /**
     * Enqueues an operation. The operation is not started until every operation submitted
     * before it has completed.
     *
     * @param operation supplies the work to run; invoked on the mailbox's turn
     * @return Mono of the operation's result, completing when the operation has run
     */
    public <T> Mono<T> submit(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            if (closed) {
                return Mono.error(new MailboxClosedException(name));
            }
            Sinks.One<T> reply = Sinks.one();
            Mono<Void> task = Mono.defer(operation)
                .doOnSuccess(value -> {
                    if (value == null) {
                        reply.tryEmitEmpty();
                    } else {
                        reply.tryEmitValue(value);
                    }
                })
                .doOnError(reply::tryEmitError)
                .onErrorResume(err -> Mono.empty())
                .doFinally(signal -> pending.decrementAndGet())
                .then();

            pending.incrementAndGet();
            Sinks.EmitFailureHandler retryOnContention = Sinks.EmitFailureHandler.busyLooping(CONTENTION_TIMEOUT);
            AtomicReference<Sinks.EmitResult> failure = new AtomicReference<>();
            queue.emitNext(task, (signal, result) -> {
                if (retryOnContention.onEmitFailure(signal, result)) {
                    return true;
                }
                failure.set(result);
                return false;
            });
            if (failure.get() != null) {
                pending.decrementAndGet();
                return Mono.error(failure.get() == Sinks.EmitResult.FAIL_TERMINATED
                    ? new MailboxClosedException(name)
                    : new IllegalStateException("Mailbox " + name + " rejected an operation: " + failure.get()));
            }
            return reply.asMono();
        });
    }

    /**
     * Number of operations enqueued but not yet finished.
     */
    public long getPending() {
        return pending.get();
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops accepting work. Operations already queued still run; later submissions fail with
     * {@link MailboxClosedException}. May be called from inside an operation.
     */
    public void close() {
        closed = true;
        queue.tryEmitComplete();
        log.debug("Mailbox {} closed", name);
    }
}
