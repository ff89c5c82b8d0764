package com.trademind.memory.embedding;

import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.Embedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remote embedder with a hashing fallback. Any backend failure (unreachable, slow,
 * wrong dimension) is logged at WARN and answered by {@link HashingEmbedder}; the caller
 * never sees the backend error.
 *
 * <p>Empty input still fails with {@code ValidationException}: it is rejected before the
 * backend is called.
 */
public class ResilientEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(ResilientEmbedder.class);

    private final RemoteEmbeddingClient remote;
    private final HashingEmbedder fallback;
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicLong fallbackCount = new AtomicLong();

    public ResilientEmbedder(RemoteEmbeddingClient remote, HashingEmbedder fallback) {
        this.remote = remote;
        this.fallback = fallback;
    }

    @Override
    public int dimension() {
        return fallback.dimension();
    }

    @Override
    public Mono<Embedding> embed(AgentEvent event) {
        return Mono.fromCallable(() -> EventSummarizer.textFor(event))
            .flatMap(this::encodeWithFallback);
    }

    @Override
    public Mono<Embedding> embedText(String text) {
        return Mono.fromCallable(() -> {
                String normalized = EventSummarizer.normalize(text);
                if (normalized.isEmpty()) {
                    throw new ValidationException("text to embed must not be empty");
                }
                return normalized;
            })
            .flatMap(this::encodeWithFallback);
    }

    @Override
    public EmbedderStatus status() {
        return new EmbedderStatus("remote", available.get(), fallbackCount.get(), dimension());
    }

    private Mono<Embedding> encodeWithFallback(String text) {
        return remote.embed(text)
            .doOnNext(v -> {
                if (available.compareAndSet(false, true)) {
                    log.info("[Embedder] Backend recovered. model={}", remote.model());
                }
            })
            .onErrorResume(e -> {
                available.set(false);
                long count = fallbackCount.incrementAndGet();
                log.warn("[Embedder] Backend unavailable, using hashing fallback. model={} fallbackCount={} reason={}",
                         remote.model(), count, e.getMessage());
                return Mono.fromCallable(() -> fallback.encode(text));
            });
    }
}
