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

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Asynchronous per-key mutex.
 *
 * <p>
 * Tasks submitted for the same key run strictly one at a time in arrival
 * order; tasks for different keys never wait on each other. A task is
 * considered finished when the stage it returns completes, successfully or
 * not, so a failing task never blocks its successors. Keys are evicted once
 * their last task finishes.
 */
@Slf4j
public class ThreadSerializer {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> CompletableFuture<T> withLock(String key, Supplier<? extends CompletionStage<T>> task) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, gate);
        CompletableFuture<Void> ready = previous != null ? previous : CompletableFuture.completedFuture(null);

        CompletableFuture<T> result = ready.thenCompose(ignored -> start(key, task));
        result.whenComplete((value, error) -> {
            gate.complete(null);
            tails.remove(key, gate);
        });
        return result;
    }

    /**
     * Whether a task for the key is currently running or queued.
     */
    public boolean isBusy(String key) {
        return tails.containsKey(key);
    }

    int activeKeys() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> start(String key, Supplier<? extends CompletionStage<T>> task) {
        try {
            CompletionStage<T> stage = task.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            log.debug("[ThreadSerializer] task failed synchronously: key={}", key, e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
