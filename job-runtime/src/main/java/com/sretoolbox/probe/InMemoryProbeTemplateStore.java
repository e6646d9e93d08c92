package com.sretoolbox.probe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryProbeTemplateStore implements ProbeTemplateStore {
    private final ConcurrentSkipListMap<String, ProbeTemplate> templates = new ConcurrentSkipListMap<>();

    @Override
    public void create(ProbeTemplate template) {
        if (templates.putIfAbsent(template.getId(), template) != null) {
            throw new IllegalStateException("probe template " + template.getId() + " already exists");
        }
    }

    @Override
    public Optional<ProbeTemplate> get(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    @Override
    public List<ProbeTemplate> list() {
        return new ArrayList<>(templates.values());
    }

    @Override
    public boolean update(ProbeTemplate template) {
        return templates.computeIfPresent(template.getId(),
                (id, current) -> template.toBuilder().nextRunAt(current.getNextRunAt()).build()) != null;
    }

    @Override
    public boolean delete(String templateId) {
        return templates.remove(templateId) != null;
    }

    @Override
    public boolean compareAndSetNextRun(String templateId, Instant expected, Instant next) {
        AtomicBoolean applied = new AtomicBoolean(false);
        templates.computeIfPresent(templateId, (id, current) -> {
            // may be re-applied on contention; only the last invocation counts
            boolean matches = Objects.equals(current.getNextRunAt(), expected);
            applied.set(matches);
            return matches ? current.toBuilder().nextRunAt(next).build() : current;
        });
        return applied.get();
    }

    @Override
    public void rescheduleNextRun(String templateId, Instant next) {
        templates.computeIfPresent(templateId, (id, current) -> current.toBuilder().nextRunAt(next).build());
    }
}
