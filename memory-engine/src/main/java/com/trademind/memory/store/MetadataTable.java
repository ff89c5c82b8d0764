package com.trademind.memory.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/** Durable half of the store holding the descriptive columns of each record. */
public interface MetadataTable {

    Mono<Void> initialize();

    Mono<Void> insert(MemoryMetadataRow row);

    Mono<MemoryMetadataRow> findById(String recordId);

    Flux<MemoryMetadataRow> findByIds(Collection<String> recordIds);

    /** @return rows changed; zero when the id is unknown */
    Mono<Long> updateOutcome(String recordId, String outcomeLabel);

    Flux<String> findIdsCreatedBefore(long epochMillis);

    Mono<Long> delete(Collection<String> recordIds);
}
