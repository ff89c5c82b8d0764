package com.trademind.memory.store;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

public class R2dbcMetadataTable implements MetadataTable {

    private static final String DDL = """
        CREATE TABLE IF NOT EXISTS memory_metadata (
            record_id     VARCHAR(64)      PRIMARY KEY,
            agent_id      VARCHAR(128),
            event_kind    VARCHAR(16)      NOT NULL,
            summary       VARCHAR(4000)    NOT NULL,
            importance    DOUBLE PRECISION NOT NULL,
            created_at    BIGINT           NOT NULL,
            outcome_label VARCHAR(16),
            symbol        VARCHAR(32)
        )
        """;

    private static final String CREATED_AT_INDEX =
        "CREATE INDEX IF NOT EXISTS idx_memory_metadata_created_at ON memory_metadata (created_at)";

    private final R2dbcEntityTemplate template;

    public R2dbcMetadataTable(R2dbcEntityTemplate template) {
        this.template = template;
    }

    @Override
    public Mono<Void> initialize() {
        return template.getDatabaseClient().sql(DDL).then()
            .then(template.getDatabaseClient().sql(CREATED_AT_INDEX).then());
    }

    @Override
    public Mono<Void> insert(MemoryMetadataRow row) {
        return template.insert(row).then();
    }

    @Override
    public Mono<MemoryMetadataRow> findById(String recordId) {
        return template.select(MemoryMetadataRow.class)
            .matching(query(where("record_id").is(recordId)))
            .one();
    }

    @Override
    public Flux<MemoryMetadataRow> findByIds(Collection<String> recordIds) {
        if (recordIds.isEmpty()) return Flux.empty();
        return template.select(MemoryMetadataRow.class)
            .matching(query(where("record_id").in(recordIds)))
            .all();
    }

    @Override
    public Mono<Long> updateOutcome(String recordId, String outcomeLabel) {
        return template.update(MemoryMetadataRow.class)
            .matching(query(where("record_id").is(recordId)))
            .apply(Update.update("outcome_label", outcomeLabel));
    }

    @Override
    public Flux<String> findIdsCreatedBefore(long epochMillis) {
        return template.select(MemoryMetadataRow.class)
            .matching(query(where("created_at").lessThan(epochMillis)))
            .all()
            .map(MemoryMetadataRow::getRecordId);
    }

    @Override
    public Mono<Long> delete(Collection<String> recordIds) {
        if (recordIds.isEmpty()) return Mono.just(0L);
        return template.delete(MemoryMetadataRow.class)
            .matching(query(where("record_id").in(recordIds)))
            .all();
    }
}
