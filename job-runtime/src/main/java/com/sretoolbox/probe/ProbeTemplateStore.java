package com.sretoolbox.probe;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persistence for probe templates.
 * <p>
 * {@link #update} writes the admin-owned fields only. {@code next_run_at} moves through
 * {@link #compareAndSetNextRun} (scheduler) or {@link #rescheduleNextRun} (interval change).
 */
public interface ProbeTemplateStore {

    /** Fails with IllegalStateException if the id is already taken. */
    void create(ProbeTemplate template);

    Optional<ProbeTemplate> get(String templateId);

    /** All templates, ascending by id. */
    List<ProbeTemplate> list();

    /** Returns false for unknown ids. */
    boolean update(ProbeTemplate template);

    boolean delete(String templateId);

    /**
     * Advances {@code next_run_at} iff it still equals {@code expected}. Exactly one of several concurrent
     * callers presenting the same {@code expected} value wins.
     */
    boolean compareAndSetNextRun(String templateId, Instant expected, Instant next);

    void rescheduleNextRun(String templateId, Instant next);

    /** Templates with {@code next_run_at <= now}, ascending by id. */
    default List<ProbeTemplate> findDue(Instant now) {
        return list().stream()
                .filter(t -> t.isDue(now))
                .sorted(Comparator.comparing(ProbeTemplate::getId))
                .collect(Collectors.toList());
    }
}
