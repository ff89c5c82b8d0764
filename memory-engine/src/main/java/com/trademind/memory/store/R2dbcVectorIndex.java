package com.trademind.memory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trademind.common.model.Embedding;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.Map;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

public class R2dbcVectorIndex implements VectorIndex {

    private static final String DDL = """
        CREATE TABLE IF NOT EXISTS memory_vector (
            record_id   VARCHAR(64)    PRIMARY KEY,
            dimension   INT            NOT NULL,
            vector_json VARCHAR(65535) NOT NULL
        )
        """;

    private final R2dbcEntityTemplate template;
    private final ObjectMapper objectMapper;

    public R2dbcVectorIndex(R2dbcEntityTemplate template, ObjectMapper objectMapper) {
        this.template = template;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> initialize() {
        return template.getDatabaseClient().sql(DDL).then();
    }

    @Override
    public Mono<Void> insert(String recordId, Embedding embedding) {
        return Mono.fromCallable(() -> new MemoryVectorRow(recordId, embedding.dimension(), toJson(embedding)))
            .flatMap(template::insert)
            .then();
    }

    @Override
    public Mono<Long> delete(Collection<String> recordIds) {
        if (recordIds.isEmpty()) return Mono.just(0L);
        return template.delete(MemoryVectorRow.class)
            .matching(query(where("record_id").in(recordIds)))
            .all();
    }

    @Override
    public Flux<Map.Entry<String, Embedding>> loadAll() {
        return template.select(MemoryVectorRow.class)
            .all()
            .map(row -> new AbstractMap.SimpleImmutableEntry<>(row.getRecordId(), fromJson(row.getVectorJson())));
    }

    private String toJson(Embedding embedding) throws JsonProcessingException {
        return objectMapper.writeValueAsString(embedding.values());
    }

    private Embedding fromJson(String json) {
        try {
            return new Embedding(objectMapper.readValue(json, float[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt vector payload", e);
        }
    }
}
