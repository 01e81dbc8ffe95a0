package me.golemcore.relay.domain.delivery;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveredMessage;
import me.golemcore.relay.domain.model.RecallOutcome;
import me.golemcore.relay.port.outbound.ChatTransportPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Emulates message edits on transports that can only post and recall.
 *
 * <p>
 * Each thread moves between three states:
 * <ul>
 * <li><b>Idle</b> - nothing pending.</li>
 * <li><b>Debouncing</b> - content is pending and a debounce timer is armed.
 * Every new request replaces the pending content and re-arms the timer,
 * unless the oldest pending request has waited at least the maximum wait, in
 * which case the content is flushed at once.</li>
 * <li><b>Executing</b> - a flush round is running: the content is posted as a
 * new message, the previous message is recalled, and the tracked recall
 * handle moves to the new message. Content arriving meanwhile is flushed in a
 * follow-up round as soon as this one ends, without waiting for the
 * debounce.</li>
 * </ul>
 * All callers whose content was superseded within a round resolve with the
 * message delivered by that round. Recall failures are logged and never fail
 * the edit.
 */
@Slf4j
public class EditEmulator {

    private final ChatTransportPort transport;
    private final DelayScheduler scheduler;
    private final Clock clock;
    private final Duration debounce;
    private final Duration maxWait;
    private final ThreadSerializer serializer = new ThreadSerializer();
    private final Map<String, ThreadEditState> states = new ConcurrentHashMap<>();

    public EditEmulator(ChatTransportPort transport, DelayScheduler scheduler, Clock clock, Duration debounce,
            Duration maxWait) {
        this.transport = transport;
        this.scheduler = scheduler;
        this.clock = clock;
        this.debounce = debounce;
        this.maxWait = maxWait;
    }

    /**
     * Records the recall handle of the message currently shown in the thread.
     * Nothing is sent.
     */
    public void trackMessage(String threadId, String recallHandle) {
        ThreadEditState state = stateFor(threadId);
        synchronized (state) {
            state.recallHandle = recallHandle;
        }
    }

    public boolean hasTrackedMessage(String threadId) {
        ThreadEditState state = states.get(threadId);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.recallHandle != null;
        }
    }

    /**
     * Replaces the message shown in the thread with {@code content} after the
     * debounce window. The latest content wins.
     *
     * @return completes with the message that finally carried this content (or
     *         content that superseded it)
     */
    public CompletableFuture<DeliveredMessage> queueEdit(String threadId, String content) {
        ThreadEditState state = stateFor(threadId);
        CompletableFuture<DeliveredMessage> waiter = new CompletableFuture<>();
        boolean flushImmediately = false;
        synchronized (state) {
            Instant now = clock.instant();
            addPendingLocked(state, content, waiter, now);
            if (state.executing) {
                return waiter;
            }
            cancelDebounceLocked(state);
            if (!now.isBefore(state.firstPendingAt.plus(maxWait))) {
                flushImmediately = true;
            } else {
                long generation = state.timerGeneration;
                state.debounceTask = scheduler.schedule(debounce,
                        () -> onDebounceElapsed(threadId, state, generation));
            }
        }
        if (flushImmediately) {
            log.debug("[EditEmulator] max wait reached, flushing: thread={}", threadId);
            startRound(threadId, state);
        }
        return waiter;
    }

    /**
     * Delivers {@code content} as the final edit without debouncing. When a
     * round is executing, the content is delivered right after it. Every
     * still-pending caller resolves with the same result.
     */
    public CompletableFuture<DeliveredMessage> flushNow(String threadId, String content) {
        ThreadEditState state = stateFor(threadId);
        CompletableFuture<DeliveredMessage> waiter = new CompletableFuture<>();
        synchronized (state) {
            cancelDebounceLocked(state);
            addPendingLocked(state, content, waiter, clock.instant());
        }
        startRound(threadId, state);
        return waiter;
    }

    /**
     * Drops the state of a thread. The timer is cancelled and callers still
     * waiting for a pending edit fail with {@link CancellationException}; a
     * round already executing completes normally.
     */
    public void cleanup(String threadId) {
        ThreadEditState state = states.remove(threadId);
        if (state == null) {
            return;
        }
        List<CompletableFuture<DeliveredMessage>> orphaned;
        synchronized (state) {
            cancelDebounceLocked(state);
            state.closed = true;
            state.pendingContent = null;
            state.firstPendingAt = null;
            orphaned = new ArrayList<>(state.waiters);
            state.waiters.clear();
        }
        if (!orphaned.isEmpty()) {
            log.debug("[EditEmulator] cancelling {} pending edits: thread={}", orphaned.size(), threadId);
        }
        for (CompletableFuture<DeliveredMessage> waiter : orphaned) {
            waiter.completeExceptionally(new CancellationException("edit state dropped for thread " + threadId));
        }
    }

    private ThreadEditState stateFor(String threadId) {
        return states.computeIfAbsent(threadId, id -> new ThreadEditState());
    }

    private void addPendingLocked(ThreadEditState state, String content,
            CompletableFuture<DeliveredMessage> waiter, Instant now) {
        state.pendingContent = content;
        state.waiters.add(waiter);
        if (state.firstPendingAt == null) {
            state.firstPendingAt = now;
        }
    }

    private void cancelDebounceLocked(ThreadEditState state) {
        if (state.debounceTask != null) {
            state.debounceTask.cancel();
            state.debounceTask = null;
        }
        state.timerGeneration++;
    }

    private void onDebounceElapsed(String threadId, ThreadEditState state, long generation) {
        synchronized (state) {
            if (state.closed || generation != state.timerGeneration) {
                return;
            }
            state.debounceTask = null;
        }
        startRound(threadId, state);
    }

    private void startRound(String threadId, ThreadEditState state) {
        String content;
        List<CompletableFuture<DeliveredMessage>> waiters;
        synchronized (state) {
            if (state.closed || state.executing || state.pendingContent == null) {
                return;
            }
            cancelDebounceLocked(state);
            state.executing = true;
            content = state.pendingContent;
            waiters = new ArrayList<>(state.waiters);
            state.pendingContent = null;
            state.firstPendingAt = null;
            state.waiters.clear();
        }
        serializer.withLock(threadId, () -> executeRound(threadId, state, content))
                .whenComplete((delivered, error) -> finishRound(threadId, state, waiters, delivered, error));
    }

    private CompletableFuture<DeliveredMessage> executeRound(String threadId, ThreadEditState state,
            String content) {
        return transport.post(threadId, content).thenCompose(delivered -> {
            String previous;
            synchronized (state) {
                previous = state.recallHandle;
            }
            return recallPrevious(threadId, previous).thenApply(outcome -> {
                if (outcome.status() == RecallOutcome.Status.RECALLED) {
                    log.debug("[EditEmulator] replaced {} with {}: thread={}", outcome.recallHandle(),
                            delivered.messageId(), threadId);
                }
                synchronized (state) {
                    state.recallHandle = delivered.canRecall() ? delivered.recallHandle() : null;
                }
                return delivered;
            });
        });
    }

    private CompletableFuture<RecallOutcome> recallPrevious(String threadId, String recallHandle) {
        if (recallHandle == null || recallHandle.isBlank()) {
            return CompletableFuture.completedFuture(RecallOutcome.skipped());
        }
        CompletableFuture<Void> recall;
        try {
            recall = transport.recall(threadId, recallHandle);
        } catch (RuntimeException e) {
            recall = CompletableFuture.failedFuture(e);
        }
        return recall.handle((ignored, error) -> {
            if (error == null) {
                return RecallOutcome.recalled(recallHandle);
            }
            Throwable cause = unwrap(error);
            log.warn("[EditEmulator] recall failed: thread={}, handle={}: {}", threadId, recallHandle,
                    cause.getMessage());
            return RecallOutcome.failed(recallHandle, cause.getMessage());
        });
    }

    private void finishRound(String threadId, ThreadEditState state,
            List<CompletableFuture<DeliveredMessage>> waiters, DeliveredMessage delivered, Throwable error) {
        boolean followUp;
        synchronized (state) {
            state.executing = false;
            followUp = !state.closed && state.pendingContent != null;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("[EditEmulator] send failed: thread={}, waiters={}: {}", threadId, waiters.size(),
                    cause.getMessage());
            waiters.forEach(waiter -> waiter.completeExceptionally(cause));
        } else {
            waiters.forEach(waiter -> waiter.complete(delivered));
        }
        if (followUp) {
            startRound(threadId, state);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Edit state of one thread. Guarded by its own monitor.
     */
    private static final class ThreadEditState {

        private String recallHandle;
        private String pendingContent;
        private final List<CompletableFuture<DeliveredMessage>> waiters = new ArrayList<>();
        private Instant firstPendingAt;
        private DelayScheduler.ScheduledTask debounceTask;
        private long timerGeneration;
        private boolean executing;
        private boolean closed;
    }
}
