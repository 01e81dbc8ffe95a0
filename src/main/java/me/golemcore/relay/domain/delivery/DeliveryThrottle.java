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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Rate limiter for the progress renders of one turn.
 *
 * <p>
 * A flush request is delivered immediately when forced or when the minimum
 * interval has passed since the last delivery. Otherwise it is marked pending
 * and a single timer is armed for the remaining interval, so a delayed update
 * is delivered even if no further event arrives. The interval is read on every
 * request because it depends on what the turn is currently showing.
 *
 * <p>
 * {@link #complete(Runnable)} closes the throttle: the timer is cancelled, the
 * final delivery runs exactly once and every later request or timer callback
 * is ignored.
 */
@Slf4j
public class DeliveryThrottle {

    private final Clock clock;
    private final DelayScheduler scheduler;
    private final Supplier<Duration> interval;
    private final Runnable flushAction;

    private Instant lastFlushAt;
    private boolean pending;
    private DelayScheduler.ScheduledTask timer;
    private long timerGeneration;
    private boolean closed;

    public DeliveryThrottle(Clock clock, DelayScheduler scheduler, Supplier<Duration> interval,
            Runnable flushAction) {
        this.clock = clock;
        this.scheduler = scheduler;
        this.interval = interval;
        this.flushAction = flushAction;
    }

    public synchronized void requestFlush(boolean force) {
        if (closed) {
            return;
        }
        Instant now = clock.instant();
        if (force || lastFlushAt == null) {
            flushLocked(now);
            return;
        }
        Instant due = lastFlushAt.plus(interval.get());
        if (!now.isBefore(due)) {
            flushLocked(now);
            return;
        }
        pending = true;
        if (timer == null) {
            long generation = ++timerGeneration;
            timer = scheduler.schedule(Duration.between(now, due), () -> onTimer(generation));
        }
    }

    /**
     * The agent reported its session: show it right away.
     */
    public void onStarted() {
        requestFlush(true);
    }

    /**
     * Closes the throttle and runs {@code finalDelivery} once. Subsequent calls
     * do nothing.
     */
    public void complete(Runnable finalDelivery) {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            pending = false;
            cancelTimerLocked();
        }
        finalDelivery.run();
    }

    public synchronized boolean isPending() {
        return pending;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private synchronized void onTimer(long generation) {
        if (generation != timerGeneration) {
            return;
        }
        timer = null;
        if (closed || !pending) {
            return;
        }
        flushLocked(clock.instant());
    }

    private void flushLocked(Instant now) {
        cancelTimerLocked();
        pending = false;
        lastFlushAt = now;
        try {
            flushAction.run();
        } catch (RuntimeException e) { // NOSONAR - keep the timer thread alive
            log.warn("[Throttle] flush failed: {}", e.getMessage(), e);
        }
    }

    private void cancelTimerLocked() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        timerGeneration++;
    }
}
