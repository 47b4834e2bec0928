package com.shoprtc.socket.actor;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailboxTest {

    @Test
    void testOperations_RunInSubmissionOrder() {
        Mailbox mailbox = new Mailbox("test");
        List<Integer> order = new CopyOnWriteArrayList<>();

        Mono<Void> slow = mailbox.submit(() -> Mono.delay(Duration.ofMillis(50)).doOnNext(t -> order.add(1)).then());
        Mono<Void> fast = mailbox.submit(() -> Mono.fromRunnable(() -> order.add(2)));
        Mono<Void> last = mailbox.submit(() -> Mono.fromRunnable(() -> order.add(3)));

        Mono.when(slow, fast, last).block(Duration.ofSeconds(5));

        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void testFailure_IsolatedToItsCaller() {
        Mailbox mailbox = new Mailbox("test");

        StepVerifier.create(mailbox.submit(() -> Mono.error(new IllegalStateException("boom"))))
            .expectErrorMessage("boom")
            .verify();

        StepVerifier.create(mailbox.submit(() -> Mono.just("still alive")))
            .expectNext("still alive")
            .verifyComplete();
    }

    @Test
    void testThrowingSupplier_ReportedAsError() {
        Mailbox mailbox = new Mailbox("test");

        StepVerifier.create(mailbox.<String>submit(() -> {
                throw new IllegalArgumentException("bad input");
            }))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    void testClose_QueuedWorkStillRuns() {
        Mailbox mailbox = new Mailbox("test");
        List<Integer> order = new CopyOnWriteArrayList<>();

        Mono<Void> closing = mailbox.submit(() -> Mono.delay(Duration.ofMillis(50))
            .doOnNext(t -> {
                order.add(1);
                mailbox.close();
            })
            .then());
        Mono<Void> queued = mailbox.submit(() -> Mono.fromRunnable(() -> order.add(2)));

        Mono.when(closing, queued).block(Duration.ofSeconds(5));

        assertEquals(List.of(1, 2), order);
        assertTrue(mailbox.isClosed());
    }

    @Test
    void testSubmitAfterClose_Rejected() {
        Mailbox mailbox = new Mailbox("test");
        mailbox.close();

        StepVerifier.create(mailbox.submit(() -> Mono.just("too late")))
            .expectError(MailboxClosedException.class)
            .verify();
        assertEquals(0, mailbox.getPending());
    }
}
