package com.trademind.memory.routing;

import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.RankedMemory;
import com.trademind.memory.embedding.Embedder;
import com.trademind.memory.store.RecordFilter;
import com.trademind.memory.store.ScoredRecord;
import com.trademind.memory.store.VectorMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agent-facing retrieval. Embeds the expanded query text, over-fetches similar records
 * and re-ranks them with {@link RankingPolicy}.
 *
 * <p>Records labelled FAILURE are left out unless the query opts in. Results are cached
 * per (agent, query signature) in a bounded LRU that is cleared at every tick boundary,
 * so an agent never sees results computed against an earlier tick's store. Retrieval
 * failures are logged and answered with an empty list.
 */
public class AgentInputRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentInputRouter.class);

    private static final Comparator<RankedMemory> BY_SCORE = Comparator
        .comparingDouble(RankedMemory::score).reversed()
        .thenComparing(m -> m.record().recordId());

    private final Embedder embedder;
    private final VectorMemoryStore store;
    private final RankingPolicy ranking;
    private final Clock clock;
    private final Map<String, List<RankedMemory>> cache;

    private final AtomicReference<String> currentTick = new AtomicReference<>("none");
    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public AgentInputRouter(Embedder embedder, VectorMemoryStore store, RankingPolicy ranking, Clock clock) {
        this.embedder = embedder;
        this.store = store;
        this.ranking = ranking;
        this.clock = clock;
        int capacity = ranking.cacheSize();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<String, List<RankedMemory>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<RankedMemory>> eldest) {
                return size() > capacity;
            }
        });
    }

    /** Invalidates cached results; called by the coordinator when a tick starts. */
    public void beginTick(String tickId) {
        cache.clear();
        currentTick.set(tickId);
    }

    public Mono<List<RankedMemory>> retrieve(String agentId, MemoryQuery query) {
        queries.incrementAndGet();
        int k = query.k() > 0 ? query.k() : ranking.defaultK();
        String key = agentId + "::" + query.signature();

        List<RankedMemory> cached = cache.get(key);
        if (cached != null) {
            cacheHits.incrementAndGet();
            return Mono.just(cached);
        }

        RecordFilter filter = query.includeFailures() ? RecordFilter.NONE : RecordFilter.excludingFailures();
        return embedder.embedText(query.expandedText())
            .flatMap(vector -> store.querySimilar(vector, k * ranking.overFetchFactor(), filter))
            .map(hits -> rerank(hits, k, query.recencyBias()))
            .doOnNext(result -> cache.put(key, result))
            .onErrorResume(e -> {
                failures.incrementAndGet();
                log.warn("[InputRouter] Retrieval failed. agentId={} type={} reason={}",
                         agentId, query.type(), e.getMessage());
                return Mono.just(List.of());
            });
    }

    public RetrievalStats stats() {
        return new RetrievalStats(queries.get(), cacheHits.get(), failures.get(), cache.size(), currentTick.get());
    }

    private List<RankedMemory> rerank(List<ScoredRecord> hits, int k, Double recencyBias) {
        Instant now = clock.instant();
        return hits.stream()
            .map(hit -> new RankedMemory(hit.record(), hit.similarity(),
                ranking.score(hit.similarity(), Duration.between(hit.record().createdAt(), now),
                              hit.record().importance(), recencyBias)))
            .sorted(BY_SCORE)
            .limit(k)
            .toList();
    }
}
