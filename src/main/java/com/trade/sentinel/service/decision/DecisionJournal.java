package com.trade.sentinel.service.decision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory history of recent decisions, plus a separate log of vetoed ones.
 * Oldest entries fall off once a log is full. Nothing is persisted.
 */
public class DecisionJournal {

    private final int capacity;
    private final Deque<FinalDecision> history;
    private final Deque<FinalDecision> vetoes;

    public DecisionJournal(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.history = new ArrayDeque<>(this.capacity);
        this.vetoes = new ArrayDeque<>(this.capacity);
    }

    public synchronized void record(FinalDecision decision) {
        append(history, decision);
        if (decision.isVetoed()) append(vetoes, decision);
    }

    /**
     * Newest first, at most {@code limit} entries.
     */
    public synchronized List<FinalDecision> recent(int limit) {
        return newestFirst(history, limit);
    }

    /**
     * Newest first, at most {@code limit} vetoed decisions.
     */
    public synchronized List<FinalDecision> recentVetoes(int limit) {
        return newestFirst(vetoes, limit);
    }

    public synchronized int size() {
        return history.size();
    }

    private void append(Deque<FinalDecision> log, FinalDecision decision) {
        if (log.size() == capacity) log.removeFirst();
        log.addLast(decision);
    }

    private static List<FinalDecision> newestFirst(Deque<FinalDecision> log, int limit) {
        int n = Math.max(0, Math.min(limit, log.size()));
        List<FinalDecision> out = new ArrayList<>(n);
        Iterator<FinalDecision> it = log.descendingIterator();
        while (it.hasNext() && out.size() < n) out.add(it.next());
        return out;
    }
}
