package com.bko.team.agent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bounded, thread-safe conversation log. Once full, the oldest entry is evicted for each new one.
 */
public class ConversationHistory {

    private final int maxMessages;
    private final Deque<ConversationEntry> entries = new ArrayDeque<>();

    public ConversationHistory(int maxMessages) {
        this.maxMessages = Math.max(1, maxMessages);
    }

    /**
     * Appends an entry, trims the log and returns a snapshot of what is kept.
     */
    public synchronized List<ConversationEntry> append(ConversationEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxMessages) {
            entries.removeFirst();
        }
        return List.copyOf(entries);
    }

    /**
     * Appends an entry and hands the resulting snapshot to {@code listener} while still holding
     * the lock, so listeners observe snapshots in append order.
     */
    public synchronized List<ConversationEntry> append(ConversationEntry entry, Consumer<List<ConversationEntry>> listener) {
        List<ConversationEntry> snapshot = append(entry);
        listener.accept(snapshot);
        return snapshot;
    }

    public synchronized List<ConversationEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
