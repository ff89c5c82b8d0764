package com.trademind.orchestrator.service;

import com.trademind.common.model.OutcomeLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Outcome resolutions whose memory write failed, waiting for a retry. */
public class LearningBacklog {

    public record Parked(PendingDecision pending, OutcomeLabel label, double pnl, int attempts) {
        public Parked retried() {
            return new Parked(pending, label, pnl, attempts + 1);
        }
    }

    private final Queue<Parked> queue = new ConcurrentLinkedQueue<>();
    private final int maxAttempts;

    public LearningBacklog(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    /** @return {@code false} when the entry has used up its attempts and was dropped */
    public boolean park(Parked entry) {
        if (entry.attempts() >= maxAttempts) return false;
        queue.add(entry);
        return true;
    }

    public List<Parked> drain() {
        List<Parked> out = new ArrayList<>();
        Parked next;
        while ((next = queue.poll()) != null) out.add(next);
        return out;
    }

    public int size() {
        return queue.size();
    }
}
