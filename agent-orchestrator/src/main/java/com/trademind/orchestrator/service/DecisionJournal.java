package com.trademind.orchestrator.service;

import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.OutcomeLabel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/** Bounded in-memory history of decisions, newest first, backing the snapshot API. */
public class DecisionJournal {

    private final int capacity;
    private final LinkedList<CoordinationDecision> entries = new LinkedList<>();

    public DecisionJournal(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void record(CoordinationDecision decision) {
        entries.addFirst(decision);
        while (entries.size() > capacity) entries.removeLast();
    }

    /** Replaces the journal copy of {@code decisionId} with its resolved outcome. */
    public synchronized boolean resolve(String decisionId, OutcomeLabel label) {
        ListIterator<CoordinationDecision> it = entries.listIterator();
        while (it.hasNext()) {
            CoordinationDecision d = it.next();
            if (d.decisionId().equals(decisionId)) {
                it.set(d.withOutcome(label));
                return true;
            }
        }
        return false;
    }

    public synchronized List<CoordinationDecision> recent(int limit) {
        List<CoordinationDecision> out = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<CoordinationDecision> it = entries.iterator();
        while (it.hasNext() && out.size() < limit) out.add(it.next());
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }
}
