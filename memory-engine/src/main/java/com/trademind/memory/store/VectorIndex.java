package com.trademind.memory.store;

import com.trademind.common.model.Embedding;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/** Durable half of the store holding one vector per record id. */
public interface VectorIndex {

    Mono<Void> initialize();

    Mono<Void> insert(String recordId, Embedding embedding);

    Mono<Long> delete(Collection<String> recordIds);

    /** Streams every stored vector; used to rebuild the in-process mirror at startup. */
    Flux<Map.Entry<String, Embedding>> loadAll();
}
