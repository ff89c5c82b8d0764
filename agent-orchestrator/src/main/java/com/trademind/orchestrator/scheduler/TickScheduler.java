package com.trademind.orchestrator.scheduler;

import com.trademind.memory.config.MemoryProperties;
import com.trademind.memory.store.StoreMode;
import com.trademind.memory.store.VectorMemoryStore;
import com.trademind.orchestrator.config.CoordinatorProperties;
import com.trademind.orchestrator.service.AgentCoordinator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Boots the memory store and the coordinator once the application is ready, then drives
 * four independent loops:
 * <pre>
 *   tick            every tick-interval
 *   outcome expiry  every tick-interval
 *   learning retry  every backlog-retry-interval
 *   retention purge every retention.sweep-interval
 * </pre>
 * Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the
 * next one. Errors are logged and the loop carries on.
 */
@Component
public class TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final AgentCoordinator coordinator;
    private final VectorMemoryStore store;
    private final CoordinatorProperties coordinatorProps;
    private final MemoryProperties memoryProps;
    private final Clock clock;

    private final Map<String, Disposable> loops = new ConcurrentHashMap<>();
    private volatile boolean running;

    public TickScheduler(AgentCoordinator coordinator, VectorMemoryStore store,
                         CoordinatorProperties coordinatorProps, MemoryProperties memoryProps, Clock clock) {
        this.coordinator      = coordinator;
        this.store            = store;
        this.coordinatorProps = coordinatorProps;
        this.memoryProps      = memoryProps;
        this.clock            = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        StoreMode mode = store.initialize().block();
        coordinator.start().block();
        log.info("[Scheduler] Coordinator ready. storeMode={} schedulerEnabled={}",
                 mode, coordinatorProps.isSchedulerEnabled());
        if (!coordinatorProps.isSchedulerEnabled()) return;

        running = true;
        Duration tick = coordinatorProps.getTickInterval();
        schedule("tick", tick, () -> coordinator.runTick().then());
        schedule("outcome-expiry", tick, () -> coordinator.expireStaleOutcomes().then());
        schedule("learning-retry", coordinatorProps.getBacklogRetryInterval(),
                 () -> coordinator.retryDeferredLearning().then());
        schedule("retention", memoryProps.getRetention().getSweepInterval(), this::purgeExpired);
    }

    @PreDestroy
    public void stop() {
        if (!running) return;
        running = false;
        loops.values().forEach(Disposable::dispose);
        loops.clear();
        coordinator.stop();
        log.info("[Scheduler] Loops stopped.");
    }

    // ── loops ────────────────────────────────────────────────────────────────

    private void schedule(String loop, Duration interval, Supplier<Mono<Void>> cycle) {
        if (!running) return;
        Disposable next = Mono.delay(interval)
            .then(Mono.defer(cycle))
            .subscribe(
                ignored -> { },
                err -> {
                    log.error("[Scheduler] Cycle failed, rescheduling. loop={} intervalMs={}",
                              loop, interval.toMillis(), err);
                    schedule(loop, interval, cycle);
                },
                () -> schedule(loop, interval, cycle));
        loops.put(loop, next);
    }

    private Mono<Void> purgeExpired() {
        Duration maxAge = memoryProps.getRetention().getMaxAge();
        return store.purgeExpired(clock.instant().minus(maxAge))
            .doOnNext(purged -> {
                if (purged > 0) {
                    log.info("[Scheduler] Retention sweep removed records. purged={} maxAge={}", purged, maxAge);
                }
            })
            .then();
    }
}
