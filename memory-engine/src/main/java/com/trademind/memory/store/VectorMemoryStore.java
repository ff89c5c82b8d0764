package com.trademind.memory.store;

import com.trademind.common.exception.DegradedDependencyException;
import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.Embedding;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MemoryRecord;
import com.trademind.common.model.OutcomeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Persistent memory: a vector index and a metadata table keyed by the same record id.
 *
 * <h3>Write path</h3>
 * Inserts, outcome updates and purges go through a single {@link SerializedWriter}.
 * Each insert writes both tables inside one transaction; the in-process vector mirror
 * that serves similarity search is only updated after commit, so a reader never sees a
 * vector whose metadata is missing.
 *
 * <h3>Read path</h3>
 * Similarity search scans the mirror, then joins metadata in batches. Hits without a
 * metadata row are dropped.
 *
 * <h3>Degraded mode</h3>
 * If either table cannot be initialised or loaded at startup the store switches to
 * {@link StoreMode#READ_ONLY}: mutating calls fail fast with
 * {@link DegradedDependencyException} and the host keeps running.
 */
public class VectorMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(VectorMemoryStore.class);
    private static final String DEPENDENCY = "memory-store";
    private static final int JOIN_BATCH = 64;

    private static final Comparator<Map.Entry<String, Double>> BY_SIMILARITY =
        Map.Entry.<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Double>comparingByKey());

    private final VectorIndex index;
    private final MetadataTable metadata;
    private final TransactionalOperator transactions;
    private final int dimension;

    private final Map<String, Embedding> mirror = new ConcurrentHashMap<>();
    private final AtomicReference<StoreMode> mode = new AtomicReference<>(StoreMode.INITIALIZING);
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final SerializedWriter writer = new SerializedWriter();

    public VectorMemoryStore(VectorIndex index, MetadataTable metadata,
                             TransactionalOperator transactions, int dimension) {
        this.index = index;
        this.metadata = metadata;
        this.transactions = transactions;
        this.dimension = dimension;
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    /**
     * Creates both tables when missing and loads the vector mirror. Never errors: a
     * failure leaves the store in READ_ONLY mode.
     */
    public Mono<StoreMode> initialize() {
        return index.initialize()
            .then(metadata.initialize())
            .thenMany(index.loadAll())
            .doOnNext(entry -> mirror.put(entry.getKey(), entry.getValue()))
            .then(Mono.fromCallable(() -> {
                mode.set(StoreMode.READY);
                log.info("[MemoryStore] Ready. records={} dimension={}", mirror.size(), dimension);
                return StoreMode.READY;
            }))
            .onErrorResume(e -> {
                mode.set(StoreMode.READ_ONLY);
                lastError.set(e.getMessage());
                log.error("[MemoryStore] Initialisation failed, entering read-only mode. reason={}", e.getMessage());
                return Mono.just(StoreMode.READ_ONLY);
            });
    }

    public void shutdown() {
        writer.shutdown();
    }

    public StoreStatus status() {
        return new StoreStatus(mode.get(), mirror.size(), dimension, lastError.get());
    }

    public int dimension() {
        return dimension;
    }

    // ── writes ───────────────────────────────────────────────────────────────

    /**
     * Validates and persists {@code record}, generating an id when it has none.
     *
     * @return the record id once both artifacts are committed
     */
    public Mono<String> insert(MemoryRecord record) {
        return Mono.defer(() -> {
            validate(record);
            requireWritable();
            String recordId = record.recordId() != null ? record.recordId() : UUID.randomUUID().toString();
            MemoryRecord stored = record.withRecordId(recordId);

            Mono<String> write = transactions.transactional(
                    index.insert(recordId, stored.embedding())
                        .then(metadata.insert(toRow(stored))))
                .thenReturn(recordId)
                .doOnNext(id -> mirror.put(id, stored.embedding()));

            // mirror update runs inside the queued task, not on the caller's subscription
            return writer.submit(write);
        });
    }

    /**
     * Sets the outcome label. Applying the same label again leaves the record unchanged.
     *
     * @return {@code true} when the record exists
     */
    public Mono<Boolean> updateOutcome(String recordId, OutcomeLabel label) {
        return Mono.defer(() -> {
            ValidationException.require(recordId != null && !recordId.isBlank(), "recordId must not be blank");
            ValidationException.require(label != null, "label must not be null");
            requireWritable();
            return writer.submit(metadata.updateOutcome(recordId, label.name()))
                .map(rows -> rows > 0);
        });
    }

    /**
     * Deletes every record created before {@code cutoff}, both artifacts in one
     * transaction.
     *
     * @return number of records removed
     */
    public Mono<Integer> purgeExpired(Instant cutoff) {
        return Mono.defer(() -> {
            requireWritable();
            Mono<List<String>> purge = metadata.findIdsCreatedBefore(cutoff.toEpochMilli())
                .collectList()
                .flatMap(ids -> ids.isEmpty()
                    ? Mono.just(ids)
                    : transactions.transactional(
                          index.delete(ids).then(metadata.delete(ids)).thenReturn(ids)))
                .doOnNext(ids -> ids.forEach(mirror::remove));
            return writer.submit(purge)
                .map(List::size);
        });
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public Mono<MemoryRecord> get(String recordId) {
        if (recordId == null) return Mono.empty();
        return metadata.findById(recordId)
            .flatMap(row -> Mono.justOrEmpty(toRecord(row)));
    }

    /**
     * Ranks stored records by cosine similarity to {@code vector}. An empty store yields
     * an empty list.
     */
    public Mono<List<ScoredRecord>> querySimilar(Embedding vector, int k, RecordFilter filter) {
        return Mono.defer(() -> {
            ValidationException.require(vector != null && vector.dimension() == dimension,
                "query vector must have dimension " + dimension);
            if (k <= 0 || mirror.isEmpty()) return Mono.just(List.<ScoredRecord>of());
            RecordFilter effective = filter == null ? RecordFilter.NONE : filter;

            List<Map.Entry<String, Double>> ranked = rank(vector);
            List<List<Map.Entry<String, Double>>> batches = new ArrayList<>();
            for (int i = 0; i < ranked.size(); i += JOIN_BATCH) {
                batches.add(ranked.subList(i, Math.min(ranked.size(), i + JOIN_BATCH)));
            }

            return Flux.fromIterable(batches)
                .concatMap(batch -> joinMetadata(batch, effective))
                .take(k)
                .collectList();
        });
    }

    /** Index-level search: ids and distances only, ordered by ascending distance. */
    public Mono<List<SearchHit>> search(Embedding vector, int k, RecordFilter filter) {
        return querySimilar(vector, k, filter)
            .map(hits -> hits.stream()
                .map(hit -> new SearchHit(hit.record().recordId(), hit.distance()))
                .toList());
    }

    public int size() {
        return mirror.size();
    }

    // ── internals ────────────────────────────────────────────────────────────

    private List<Map.Entry<String, Double>> rank(Embedding vector) {
        List<Map.Entry<String, Double>> scored = new ArrayList<>(mirror.size());
        for (Map.Entry<String, Embedding> entry : mirror.entrySet()) {
            if (entry.getValue().dimension() != dimension) continue;
            scored.add(Map.entry(entry.getKey(), vector.cosineSimilarity(entry.getValue())));
        }
        scored.sort(BY_SIMILARITY);
        return scored;
    }

    private Flux<ScoredRecord> joinMetadata(List<Map.Entry<String, Double>> batch, RecordFilter filter) {
        List<String> ids = batch.stream().map(Map.Entry::getKey).toList();
        return metadata.findByIds(ids)
            .collectMap(MemoryMetadataRow::getRecordId, Function.identity())
            .flatMapMany(rows -> Flux.fromIterable(batch)
                .filter(hit -> rows.containsKey(hit.getKey()))
                .filter(hit -> filter.matches(rows.get(hit.getKey())))
                .flatMapSequential(hit -> Mono.justOrEmpty(toRecord(rows.get(hit.getKey())))
                    .map(record -> new ScoredRecord(record, hit.getValue()))));
    }

    private Optional<MemoryRecord> toRecord(MemoryMetadataRow row) {
        Embedding embedding = mirror.get(row.getRecordId());
        if (embedding == null) {
            return Optional.empty();
        }
        return Optional.of(new MemoryRecord(
            row.getRecordId(),
            embedding,
            row.getSummary(),
            row.getAgentId(),
            EventKind.valueOf(row.getEventKind()),
            row.getImportance(),
            Instant.ofEpochMilli(row.getCreatedAt()),
            row.getOutcomeLabel() == null ? null : OutcomeLabel.valueOf(row.getOutcomeLabel()),
            row.getSymbol()));
    }

    private static MemoryMetadataRow toRow(MemoryRecord record) {
        return new MemoryMetadataRow(
            record.recordId(),
            record.agentId(),
            record.eventKind().name(),
            record.summary(),
            record.importance(),
            record.createdAt().toEpochMilli(),
            record.outcomeLabel() == null ? null : record.outcomeLabel().name(),
            record.symbol());
    }

    private void validate(MemoryRecord record) {
        ValidationException.require(record != null, "record must not be null");
        ValidationException.require(!record.embedding().isEmpty(), "embedding must not be empty");
        ValidationException.require(record.embedding().dimension() == dimension,
            "embedding dimension " + record.embedding().dimension() + " does not match store dimension " + dimension);
        ValidationException.require(record.summary() != null && !record.summary().isBlank(),
            "summary must not be blank");
        ValidationException.requireUnitInterval(record.importance(), "importance");
    }

    private void requireWritable() {
        StoreMode current = mode.get();
        if (current != StoreMode.READY) {
            throw new DegradedDependencyException(DEPENDENCY, "store is " + current + ", writes are refused");
        }
    }
}
