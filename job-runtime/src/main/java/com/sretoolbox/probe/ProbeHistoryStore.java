package com.sretoolbox.probe;

import java.util.List;
import java.util.Optional;

/**
 * Past probe executions per template, newest first. Keeps at most {@link #MAX_ENTRIES} per template.
 */
public interface ProbeHistoryStore {
    int MAX_ENTRIES = 96;

    void record(ProbeHistoryEntry entry);

    Optional<ProbeHistoryEntry> latest(String templateId);

    List<ProbeHistoryEntry> list(String templateId, int limit);
}
