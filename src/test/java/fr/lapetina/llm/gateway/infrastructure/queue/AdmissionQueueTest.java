package fr.lapetina.llm.gateway.infrastructure.queue;

import fr.lapetina.llm.gateway.domain.exception.QueueFullException;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.Priority;
import fr.lapetina.llm.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdmissionQueueTest {

    private MutableClock clock;
    private List<QueuedRequest> expired;
    private AdmissionQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        expired = new ArrayList<>();
        queue = new AdmissionQueue(3, clock, expired::add);
    }

    private static InferenceRequest request(String id) {
        return InferenceRequest.builder()
                .requestId(id)
                .callerId("team-a")
                .messages(List.of(Message.user("hi")))
                .build();
    }

    private String next() {
        return queue.poll().map(item -> item.request().requestId()).orElse(null);
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should serve higher priority first")
        void shouldServeByPriority() {
            queue.enqueue(request("low"), Priority.LOW, (Instant) null);
            queue.enqueue(request("critical"), Priority.CRITICAL, (Instant) null);
            queue.enqueue(request("normal"), Priority.NORMAL, (Instant) null);

            assertThat(next()).isEqualTo("critical");
            assertThat(next()).isEqualTo("normal");
            assertThat(next()).isEqualTo("low");
        }

        @Test
        @DisplayName("should serve the earliest deadline first within a priority")
        void shouldServeEarliestDeadlineFirst() {
            Instant now = clock.instant();
            queue.enqueue(request("no-deadline"), Priority.HIGH, (Instant) null);
            queue.enqueue(request("late"), Priority.HIGH, now.plusSeconds(60));
            queue.enqueue(request("soon"), Priority.HIGH, now.plusSeconds(5));

            assertThat(next()).isEqualTo("soon");
            assertThat(next()).isEqualTo("late");
            assertThat(next()).isEqualTo("no-deadline");
        }

        @Test
        @DisplayName("should be FIFO on full ties")
        void shouldBeFifoOnTies() {
            queue.enqueue(request("first"), Priority.NORMAL, (Instant) null);
            queue.enqueue(request("second"), Priority.NORMAL, (Instant) null);
            queue.enqueue(request("third"), Priority.NORMAL, (Instant) null);

            assertThat(next()).isEqualTo("first");
            assertThat(next()).isEqualTo("second");
            assertThat(next()).isEqualTo("third");
        }
    }

    @Nested
    @DisplayName("Capacity")
    class CapacityTests {

        @Test
        @DisplayName("should reject immediately when full")
        void shouldRejectWhenFull() {
            for (int i = 0; i < 3; i++) {
                queue.enqueue(request("r" + i), Priority.NORMAL, (Instant) null);
            }

            assertThat(queue.isFull()).isTrue();
            assertThatThrownBy(() -> queue.enqueue(request("overflow"), Priority.CRITICAL, (Instant) null))
                    .isInstanceOf(QueueFullException.class)
                    .satisfies(e -> assertThat(((QueueFullException) e).getCapacity()).isEqualTo(3));
            assertThat(queue.size()).isEqualTo(3);
            assertThat(queue.stats().rejected()).isEqualTo(1);
        }

        @Test
        @DisplayName("should accept again after a dequeue")
        void shouldAcceptAfterDequeue() {
            for (int i = 0; i < 3; i++) {
                queue.enqueue(request("r" + i), Priority.NORMAL, (Instant) null);
            }
            next();

            queue.enqueue(request("r3"), Priority.NORMAL, (Instant) null);

            assertThat(queue.size()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTests {

        @Test
        @DisplayName("should drop expired items on delivery and notify the listener")
        void shouldDropExpiredItems() {
            queue.enqueue(request("expiring"), Priority.CRITICAL, Duration.ofSeconds(1));
            queue.enqueue(request("patient"), Priority.LOW, Duration.ofMinutes(5));

            clock.advance(Duration.ofSeconds(2));

            assertThat(queue.poll()).isEmpty();
            assertThat(next()).isEqualTo("patient");
            assertThat(expired).extracting(item -> item.request().requestId()).containsExactly("expiring");
            assertThat(queue.stats().expired()).isEqualTo(1);
            assertThat(queue.stats().dequeued()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should wake a blocked consumer on enqueue")
    void shouldWakeBlockedConsumer() throws Exception {
        CompletableFuture<Optional<QueuedRequest>> consumer = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.dequeue(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        });

        Thread.sleep(50);
        queue.enqueue(request("wake-up"), Priority.NORMAL, (Instant) null);

        Optional<QueuedRequest> item = consumer.get(2, TimeUnit.SECONDS);
        assertThat(item).map(i -> i.request().requestId()).contains("wake-up");
    }

    @Test
    @DisplayName("should time out an empty dequeue")
    void shouldTimeOutEmptyDequeue() throws Exception {
        assertThat(queue.dequeue(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    @DisplayName("should fail every pending future on drain")
    void shouldFailPendingOnDrain() {
        QueuedRequest a = queue.enqueue(request("a"), Priority.NORMAL, (Instant) null);
        QueuedRequest b = queue.enqueue(request("b"), Priority.NORMAL, (Instant) null);

        int drained = queue.drain(new IllegalStateException("shutting down"));

        assertThat(drained).isEqualTo(2);
        assertThat(queue.size()).isZero();
        assertThat(a.response()).isCompletedExceptionally();
        assertThat(b.response()).isCompletedExceptionally();
    }
}
