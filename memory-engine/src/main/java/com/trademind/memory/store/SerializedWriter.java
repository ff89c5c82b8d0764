package com.trademind.memory.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-writer queue. Submitted units of work run strictly one after another in
 * submission order; each caller gets its own result back.
 */
final class SerializedWriter {

    private static final Logger log = LoggerFactory.getLogger(SerializedWriter.class);

    private final Sinks.Many<Mono<Void>> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable drain;

    SerializedWriter() {
        this.drain = queue.asFlux()
            .concatMap(task -> task)
            .subscribe(null, e -> log.error("[MemoryWriter] Writer queue terminated. reason={}", e.getMessage()));
    }

    <T> Mono<T> submit(Mono<T> work) {
        return Mono.defer(() -> {
            Sinks.One<T> result = Sinks.one();
            Mono<Void> task = work
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .doOnNext(value -> value.ifPresentOrElse(result::tryEmitValue, result::tryEmitEmpty))
                .doOnError(result::tryEmitError)
                .onErrorResume(e -> Mono.empty())
                .then();
            queue.emitNext(task, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
            return result.asMono();
        });
    }

    void shutdown() {
        queue.tryEmitComplete();
        drain.dispose();
    }
}
