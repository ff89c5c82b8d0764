package com.trademind.orchestrator.service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Approved decisions keyed by decision id. Removal is the only way to resolve one. */
public class PendingDecisionTable {

    private final Map<String, PendingDecision> pending = new ConcurrentHashMap<>();

    public void put(PendingDecision decision) {
        pending.put(decision.decisionId(), decision);
    }

    /** Atomically claims the entry; a second call for the same id is empty. */
    public Optional<PendingDecision> remove(String decisionId) {
        return decisionId == null ? Optional.empty() : Optional.ofNullable(pending.remove(decisionId));
    }

    public boolean contains(String decisionId) {
        return pending.containsKey(decisionId);
    }

    /** Entries registered before {@code cutoff}, oldest first. */
    public List<PendingDecision> registeredBefore(Instant cutoff) {
        return pending.values().stream()
            .filter(p -> p.registeredAt().isBefore(cutoff))
            .sorted(Comparator.comparing(PendingDecision::registeredAt))
            .toList();
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
