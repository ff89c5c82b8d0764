package com.trademind.orchestrator.controller;

import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.QueryType;
import com.trademind.memory.routing.AgentInputRouter;
import com.trademind.orchestrator.dto.MemoryHitDTO;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/** Read-only similarity search over the memory store, for operators. */
@RestController
@RequestMapping("/api/v1/memory")
public class MemoryController {

    static final String CALLER_ID = "snapshot-api";
    static final int MAX_K = 50;

    private final AgentInputRouter inputRouter;

    public MemoryController(AgentInputRouter inputRouter) {
        this.inputRouter = inputRouter;
    }

    @GetMapping("/query")
    public Mono<ResponseEntity<List<MemoryHitDTO>>> query(
            @RequestParam(value = "text", required = false) String text,
            @RequestParam(value = "type", defaultValue = "GENERAL") String type,
            @RequestParam(value = "symbol", required = false) String symbol,
            @RequestParam(value = "k", defaultValue = "5") int k,
            @RequestParam(value = "includeFailures", defaultValue = "false") boolean includeFailures) {
        if (text == null || text.isBlank() || k < 1) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        QueryType queryType;
        try {
            queryType = QueryType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        String normalisedSymbol = symbol == null || symbol.isBlank() ? null : symbol.trim().toUpperCase(Locale.ROOT);
        MemoryQuery query = MemoryQuery.of(text.trim(), queryType, normalisedSymbol, Math.min(k, MAX_K));
        if (includeFailures) query = query.includingFailures();

        return inputRouter.retrieve(CALLER_ID, query)
            .map(hits -> hits.stream().map(MemoryHitDTO::from).toList())
            .map(ResponseEntity::ok);
    }
}
