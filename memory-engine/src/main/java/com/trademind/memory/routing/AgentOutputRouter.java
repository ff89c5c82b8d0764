package com.trademind.memory.routing;

import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.Embedding;
import com.trademind.common.model.MemoryRecord;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.memory.embedding.Embedder;
import com.trademind.memory.store.RecordFilter;
import com.trademind.memory.store.VectorMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for everything agents (and the coordinator) emit.
 *
 * <p>For each event two branches run concurrently:
 * <ul>
 *   <li><b>persist</b>: embed, measure novelty against the store, score importance and
 *       insert a MemoryRecord when the score clears the threshold</li>
 *   <li><b>fan-out</b>: notify every agent whose interests include the event category,
 *       except the emitter, each with its own timeout and bounded retry</li>
 * </ul>
 * A persistence failure is reported in the {@link IngestResult}; it never blocks
 * fan-out, and a failing subscriber never blocks another.
 *
 * <p>This router is the only component that creates MemoryRecords or changes their
 * outcome labels.
 */
public class AgentOutputRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentOutputRouter.class);

    private final Embedder embedder;
    private final VectorMemoryStore store;
    private final AgentDirectory directory;
    private final ImportancePolicy importance;
    private final DeliveryPolicy delivery;

    private final AtomicLong eventsIngested = new AtomicLong();
    private final AtomicLong recordsStored = new AtomicLong();
    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();
    private final AtomicLong persistenceFailures = new AtomicLong();

    public AgentOutputRouter(Embedder embedder, VectorMemoryStore store, AgentDirectory directory,
                             ImportancePolicy importance, DeliveryPolicy delivery) {
        this.embedder = embedder;
        this.store = store;
        this.directory = directory;
        this.importance = importance;
        this.delivery = delivery;
    }

    public Mono<IngestResult> ingest(String agentId, AgentEvent event) {
        eventsIngested.incrementAndGet();
        Mono<Persisted> persisted = persist(agentId, event);
        Mono<int[]> fanned = fanOut(agentId, event);

        return Mono.zip(persisted, fanned)
            .map(t -> new IngestResult(t.getT1().recordId() != null, t.getT1().recordId(),
                                       t.getT1().importance(), t.getT2()[0], t.getT2()[1],
                                       t.getT1().error()))
            .doOnNext(r -> log.debug("[OutputRouter] Ingested. agentId={} kind={} stored={} importance={} delivered={} failed={}",
                                     agentId, event.kind(), r.stored(), r.importance(), r.delivered(), r.failed()));
    }

    /** Sets the outcome label of a stored record. Idempotent. */
    public Mono<Boolean> annotateOutcome(String recordId, OutcomeLabel label) {
        return store.updateOutcome(recordId, label)
            .doOnNext(found -> {
                if (!found) log.warn("[OutputRouter] Outcome for unknown record. recordId={} label={}", recordId, label);
            });
    }

    public CommunicationStats stats() {
        return new CommunicationStats(eventsIngested.get(), recordsStored.get(), notificationsSent.get(),
                                      deliveryFailures.get(), persistenceFailures.get());
    }

    // ── persist branch ───────────────────────────────────────────────────────

    private Mono<Persisted> persist(String agentId, AgentEvent event) {
        double significance = significanceOf(agentId);
        return embedder.embed(event)
            .flatMap(vector -> novelty(vector)
                .flatMap(novelty -> {
                    double score = importance.score(event.kind(), significance, novelty);
                    if (!importance.admits(score)) {
                        return Mono.just(new Persisted(null, score, null));
                    }
                    MemoryRecord record = new MemoryRecord(null, vector, event.summary(), agentId,
                        event.kind(), score, event.timestamp(), null, event.symbol());
                    return store.insert(record)
                        .doOnNext(id -> recordsStored.incrementAndGet())
                        .map(id -> new Persisted(id, score, null));
                }))
            .onErrorResume(e -> {
                persistenceFailures.incrementAndGet();
                log.error("[OutputRouter] Persistence failed. agentId={} kind={} eventId={} reason={}",
                          agentId, event.kind(), event.eventId(), e.getMessage());
                return Mono.just(new Persisted(null, 0.0, String.valueOf(e.getMessage())));
            });
    }

    private Mono<Double> novelty(Embedding vector) {
        return store.querySimilar(vector, 1, RecordFilter.NONE)
            .map(hits -> hits.isEmpty() ? 1.0 : 1.0 - Math.max(0.0, hits.get(0).similarity()))
            .onErrorResume(e -> {
                log.warn("[OutputRouter] Novelty lookup failed, assuming novel. reason={}", e.getMessage());
                return Mono.just(1.0);
            });
    }

    private double significanceOf(String agentId) {
        if (AgentEvent.COORDINATOR_ID.equals(agentId)) {
            return importance.coordinatorSignificance();
        }
        return directory.find(agentId).map(TradingAgent::significance).orElse(0.5);
    }

    // ── fan-out branch ───────────────────────────────────────────────────────

    private Mono<int[]> fanOut(String agentId, AgentEvent event) {
        List<TradingAgent> subscribers = directory.subscribersOf(event.category(), agentId);
        if (subscribers.isEmpty()) {
            return Mono.just(new int[] {0, 0});
        }
        return Flux.fromIterable(subscribers)
            .flatMap(subscriber -> deliver(subscriber, event))
            .reduce(new int[] {0, 0}, (acc, ok) -> {
                acc[ok ? 0 : 1]++;
                return acc;
            });
    }

    private Mono<Boolean> deliver(TradingAgent subscriber, AgentEvent event) {
        return Mono.defer(() -> subscriber.consumeEvent(event))
            .timeout(delivery.timeout())
            .retry(delivery.retries())
            .thenReturn(true)
            .doOnNext(ok -> notificationsSent.incrementAndGet())
            .onErrorResume(e -> {
                deliveryFailures.incrementAndGet();
                log.warn("[OutputRouter] Delivery failed. subscriber={} eventId={} kind={} reason={}",
                         subscriber.agentId(), event.eventId(), event.kind(), e.getMessage());
                return Mono.just(false);
            });
    }

    private record Persisted(String recordId, double importance, String error) {}
}
