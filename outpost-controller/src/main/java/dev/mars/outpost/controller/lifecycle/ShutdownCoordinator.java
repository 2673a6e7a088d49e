/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.outpost.controller.lifecycle;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Runs the controller's graceful shutdown as four ordered phases.
 *
 * <p>Shutdown sequence:
 * <ol>
 *   <li>DRAIN: the HTTP server stops accepting API requests and agent sockets</li>
 *   <li>AWAIT_COMPLETION: in-flight transfers get a bounded window to finish</li>
 *   <li>STOP_SERVICES: agent sockets, the HTTP server and the timeout sweep are stopped</li>
 *   <li>CLOSE_RESOURCES: anything left open is released</li>
 * </ol>
 *
 * <p>Hooks run sequentially, each bounded by its phase's timeout. A hook that fails or times
 * out is logged and the sequence carries on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private static final long COMPLETION_POLL_INTERVAL_MS = 100;

    public enum Phase {
        DRAIN,
        AWAIT_COMPLETION,
        STOP_SERVICES,
        CLOSE_RESOURCES
    }

    public enum State {
        RUNNING,
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final Vertx vertx;
    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);
    private Future<Void> completion;

    /**
     * @param vertx             the Vert.x instance
     * @param drainTimeoutMs    bound on each DRAIN hook
     * @param shutdownTimeoutMs bound on each hook of the later phases
     */
    public ShutdownCoordinator(Vertx vertx, long drainTimeoutMs, long shutdownTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new ArrayList<>());
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    public ShutdownCoordinator onDrain(String name, Supplier<Future<Void>> hook) {
        return register(Phase.DRAIN, name, hook);
    }

    /**
     * Registers a hook whose future completes once some kind of active work has finished.
     */
    public ShutdownCoordinator onAwaitCompletion(String name, Supplier<Future<Void>> hook) {
        return register(Phase.AWAIT_COMPLETION, name, hook);
    }

    /**
     * Registers an AWAIT_COMPLETION hook that polls {@code idle} until it reports true.
     */
    public ShutdownCoordinator onAwaitIdle(String name, BooleanSupplier idle) {
        return register(Phase.AWAIT_COMPLETION, name, () -> pollUntil(idle));
    }

    public ShutdownCoordinator onServiceStop(String name, Supplier<Future<Void>> hook) {
        return register(Phase.STOP_SERVICES, name, hook);
    }

    public ShutdownCoordinator onResourceClose(String name, Supplier<Future<Void>> hook) {
        return register(Phase.CLOSE_RESOURCES, name, hook);
    }

    private ShutdownCoordinator register(Phase phase, String name, Supplier<Future<Void>> hook) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        hooks.get(phase).add(new ShutdownHook(name, hook));
        return this;
    }

    /**
     * Starts the shutdown sequence. Later calls return the future of the first one.
     *
     * @return a future that completes when every phase has run
     */
    public synchronized Future<Void> shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            logger.info("Shutdown already requested, waiting for completion");
            return completion;
        }

        logger.info("Initiating graceful shutdown (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
        state.set(State.DRAINING);

        completion = runPhase(Phase.DRAIN, drainTimeoutMs)
                .compose(v -> runPhase(Phase.AWAIT_COMPLETION, shutdownTimeoutMs))
                .compose(v -> {
                    state.set(State.SHUTTING_DOWN);
                    return runPhase(Phase.STOP_SERVICES, shutdownTimeoutMs);
                })
                .compose(v -> runPhase(Phase.CLOSE_RESOURCES, shutdownTimeoutMs))
                .onComplete(ar -> {
                    state.set(State.STOPPED);
                    logger.info("Graceful shutdown completed");
                });
        return completion;
    }

    private Future<Void> runPhase(Phase phase, long timeoutMs) {
        List<ShutdownHook> phaseHooks = hooks.get(phase);
        logger.info("Phase {}/{}: {} ({} hooks)", phase.ordinal() + 1, Phase.values().length, phase, phaseHooks.size());

        Future<Void> chain = Future.succeededFuture();
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(ShutdownHook hook, long timeoutMs) {
        logger.debug("Executing shutdown hook: {}", hook.name());
        Future<Void> result;
        try {
            result = hook.hook().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .onSuccess(v -> logger.debug("Hook completed: {}", hook.name()))
                .recover(err -> {
                    logger.warn("Hook failed: {} - {}", hook.name(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> pollUntil(BooleanSupplier idle) {
        if (idle.getAsBoolean()) {
            return Future.succeededFuture();
        }
        // stops rescheduling once shutdown has moved past the await phase
        if (state.get() != State.DRAINING) {
            return Future.failedFuture("shutdown moved on");
        }
        return vertx.timer(COMPLETION_POLL_INTERVAL_MS).compose(v -> pollUntil(idle));
    }

    private record ShutdownHook(String name, Supplier<Future<Void>> hook) {
    }
}
