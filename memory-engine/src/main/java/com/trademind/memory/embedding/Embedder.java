package com.trademind.memory.embedding;

import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.Embedding;
import reactor.core.publisher.Mono;

/**
 * Turns events and free text into fixed-dimension vectors. Identical input yields an
 * identical vector for a given model version.
 */
public interface Embedder {

    int dimension();

    /**
     * @return the event's embedding; errors with {@code ValidationException} when the
     *         event has no summary
     */
    Mono<Embedding> embed(AgentEvent event);

    Mono<Embedding> embedText(String text);

    EmbedderStatus status();
}
