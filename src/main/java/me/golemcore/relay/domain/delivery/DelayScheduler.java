package me.golemcore.relay.domain.delivery;

import java.time.Duration;

/**
 * Runs a task once after a delay. Injected into the throttle and the edit
 * emulator so their timers can be driven manually in tests.
 */
public interface DelayScheduler {

    ScheduledTask schedule(Duration delay, Runnable task);

    /**
     * Handle of a scheduled task.
     */
    interface ScheduledTask {

        /**
         * Cancels the task if it has not started yet. Cancelling twice is a no-op.
         */
        void cancel();
    }
}
