package com.sretoolbox.probe;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProbeHistoryStore implements ProbeHistoryStore {
    private final ConcurrentHashMap<String, Deque<ProbeHistoryEntry>> history = new ConcurrentHashMap<>();

    @Override
    public void record(ProbeHistoryEntry entry) {
        Deque<ProbeHistoryEntry> entries = history.computeIfAbsent(entry.getTemplateId(), k -> new LinkedList<>());
        synchronized (entries) {
            entries.addFirst(entry);
            while (entries.size() > MAX_ENTRIES) {
                entries.removeLast();
            }
        }
    }

    @Override
    public Optional<ProbeHistoryEntry> latest(String templateId) {
        Deque<ProbeHistoryEntry> entries = history.get(templateId);
        if (entries == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            return Optional.ofNullable(entries.peekFirst());
        }
    }

    @Override
    public List<ProbeHistoryEntry> list(String templateId, int limit) {
        Deque<ProbeHistoryEntry> entries = history.get(templateId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            List<ProbeHistoryEntry> out = new ArrayList<>(entries);
            return List.copyOf(out.subList(0, Math.min(Math.max(limit, 0), out.size())));
        }
    }
}
