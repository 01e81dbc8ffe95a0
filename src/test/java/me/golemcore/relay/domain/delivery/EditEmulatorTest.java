package me.golemcore.relay.domain.delivery;

import me.golemcore.relay.domain.model.DeliveredMessage;
import me.golemcore.relay.testsupport.ManualDelayScheduler;
import me.golemcore.relay.testsupport.MutableClock;
import me.golemcore.relay.testsupport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EditEmulatorTest {

    private static final String THREAD = "thread-1";
    private static final Duration DEBOUNCE = Duration.ofMillis(300);
    private static final Duration MAX_WAIT = Duration.ofMillis(2000);

    private MutableClock clock;
    private ManualDelayScheduler scheduler;
    private RecordingTransport transport;
    private EditEmulator emulator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        scheduler = new ManualDelayScheduler(clock);
        transport = RecordingTransport.withoutEdit();
        emulator = new EditEmulator(transport, scheduler, clock, DEBOUNCE, MAX_WAIT);
        emulator.trackMessage(THREAD, "r-placeholder");
    }

    @Test
    void shouldCoalesceBurstIntoSingleEditWithLastContent() throws Exception {
        List<CompletableFuture<DeliveredMessage>> waiters = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            waiters.add(emulator.queueEdit(THREAD, "v" + i));
            scheduler.advance(Duration.ofMillis(100));
        }
        assertTrue(transport.posts().isEmpty());

        scheduler.advance(DEBOUNCE);

        assertEquals(List.of("v5"), transport.posts());
        assertEquals(List.of("r-placeholder"), transport.recalls());
        DeliveredMessage first = waiters.get(0).get();
        assertEquals("m1", first.messageId());
        for (CompletableFuture<DeliveredMessage> waiter : waiters) {
            assertEquals(first, waiter.get());
        }
    }

    @Test
    void shouldFlushWhenOldestRequestReachesMaxWaitWithoutQuietPeriod() {
        for (int i = 0; i <= 8; i++) {
            if (i > 0) {
                scheduler.advance(Duration.ofMillis(250));
            }
            emulator.queueEdit(THREAD, "v" + i);
            if (i < 8) {
                assertTrue(transport.posts().isEmpty(), "flushed too early at step " + i);
            }
        }

        assertEquals(List.of("v8"), transport.posts());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void shouldDebounceWhenOldestRequestIsJustBelowMaxWait() {
        emulator.queueEdit(THREAD, "a");
        for (int i = 0; i < 7; i++) {
            scheduler.advance(Duration.ofMillis(285));
            emulator.queueEdit(THREAD, "b" + i);
        }

        // 1995ms after the first request: still debouncing
        assertTrue(transport.posts().isEmpty());
        assertEquals(1, scheduler.pendingTasks());

        scheduler.advance(DEBOUNCE);
        assertEquals(List.of("b6"), transport.posts());
    }

    @Test
    void shouldResolveEditEvenWhenRecallFails() throws Exception {
        transport.setFailRecalls(true);

        CompletableFuture<DeliveredMessage> waiter = emulator.queueEdit(THREAD, "content");
        scheduler.advance(DEBOUNCE);

        assertEquals(new DeliveredMessage("m1", "r-m1"), waiter.get());
        assertEquals(List.of("r-placeholder"), transport.recalls());
        assertTrue(emulator.hasTrackedMessage(THREAD));

        emulator.queueEdit(THREAD, "next");
        scheduler.advance(DEBOUNCE);
        assertEquals(List.of("r-placeholder", "r-m1"), transport.recalls());
    }

    @Test
    void shouldSendBeforeRecallingAndTrackNewHandle() {
        emulator.queueEdit(THREAD, "one");
        scheduler.advance(DEBOUNCE);
        emulator.queueEdit(THREAD, "two");
        scheduler.advance(DEBOUNCE);

        assertEquals(List.of("one", "two"), transport.posts());
        assertEquals(List.of("r-placeholder", "r-m1"), transport.recalls());
    }

    @Test
    void shouldSkipRecallWhenNothingIsTracked() {
        emulator.cleanup(THREAD);
        assertFalse(emulator.hasTrackedMessage(THREAD));

        emulator.queueEdit(THREAD, "first");
        scheduler.advance(DEBOUNCE);

        assertEquals(List.of("first"), transport.posts());
        assertTrue(transport.recalls().isEmpty());
        assertTrue(emulator.hasTrackedMessage(THREAD));
    }

    @Test
    void shouldFlushNowSupersedingPendingContent() throws Exception {
        CompletableFuture<DeliveredMessage> draft = emulator.queueEdit(THREAD, "draft");
        CompletableFuture<DeliveredMessage> last = emulator.flushNow(THREAD, "final");

        assertEquals(List.of("final"), transport.posts());
        assertEquals(draft.get(), last.get());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void shouldRunFlushNowAfterExecutingRound() throws Exception {
        transport.setHoldPosts(true);
        CompletableFuture<DeliveredMessage> progress = emulator.queueEdit(THREAD, "progress");
        scheduler.advance(DEBOUNCE);
        assertEquals(List.of("progress"), transport.posts());

        CompletableFuture<DeliveredMessage> last = emulator.flushNow(THREAD, "final");
        assertEquals(1, transport.posts().size());
        assertFalse(last.isDone());

        transport.setHoldPosts(false);
        transport.releaseNextPost();

        assertEquals(List.of("progress", "final"), transport.posts());
        assertEquals("m1", progress.get().messageId());
        assertEquals("m2", last.get().messageId());
        assertEquals(List.of("r-placeholder", "r-m1"), transport.recalls());
    }

    @Test
    void shouldStartFollowUpRoundWithoutDebounceWhenContentArrivedDuringExecution() {
        transport.setHoldPosts(true);
        emulator.queueEdit(THREAD, "a");
        scheduler.advance(DEBOUNCE);
        emulator.queueEdit(THREAD, "b");
        emulator.queueEdit(THREAD, "c");

        transport.setHoldPosts(false);
        transport.releaseNextPost();

        assertEquals(List.of("a", "c"), transport.posts());
    }

    @Test
    void shouldFailRoundWaitersOnSendFailureAndStayUsable() throws Exception {
        transport.setFailPosts(true);
        CompletableFuture<DeliveredMessage> failed = emulator.queueEdit(THREAD, "lost");
        scheduler.advance(DEBOUNCE);

        ExecutionException error = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(transport.recalls().isEmpty());

        transport.setFailPosts(false);
        CompletableFuture<DeliveredMessage> retried = emulator.queueEdit(THREAD, "retry");
        scheduler.advance(DEBOUNCE);

        assertEquals("retry", transport.posts().get(transport.posts().size() - 1));
        assertTrue(retried.isDone());
        assertFalse(retried.isCompletedExceptionally());
    }

    @Test
    void shouldCancelPendingWaitersOnCleanup() {
        CompletableFuture<DeliveredMessage> waiter = emulator.queueEdit(THREAD, "pending");

        emulator.cleanup(THREAD);
        scheduler.advance(DEBOUNCE);

        assertTrue(waiter.isCompletedExceptionally());
        assertThrows(CancellationException.class, waiter::get);
        assertTrue(transport.posts().isEmpty());
        assertFalse(emulator.hasTrackedMessage(THREAD));
    }

    @Test
    void shouldKeepThreadsIndependent() {
        emulator.queueEdit(THREAD, "one");
        scheduler.advance(Duration.ofMillis(200));
        emulator.queueEdit("thread-2", "other");
        scheduler.advance(Duration.ofMillis(100));

        assertEquals(List.of("one"), transport.posts());
        scheduler.advance(Duration.ofMillis(200));
        assertEquals(List.of("one", "other"), transport.posts());
    }
}
