package com.sretoolbox.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobService;
import com.sretoolbox.jobs.errors.NotFoundException;
import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.NotificationThreshold;
import com.sretoolbox.probe.ProbeHistoryEntry;
import com.sretoolbox.probe.ProbeHistoryStore;
import com.sretoolbox.probe.ProbeTemplate;
import com.sretoolbox.probe.ProbeTemplateStore;
import com.sretoolbox.scheduler.api.ProbeTemplateRequest;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Template administration: validated CRUD, run-now and execution history.
 */
@Slf4j
public class ProbeTemplateService {
    static final int MAX_NAME = 120;
    static final int MAX_DESCRIPTION = 500;
    static final int MAX_SLA_MS = 60_000;
    static final int MIN_INTERVAL = 30;
    static final int MAX_INTERVAL = 3600;
    static final int DEFAULT_HISTORY_LIMIT = 10;
    private static final Set<String> METHODS = Set.of("GET", "HEAD", "POST");

    private final ProbeTemplateStore templates;
    private final ProbeHistoryStore history;
    private final JobService jobs;
    private final ObjectMapper mapper;
    private final int defaultIntervalSeconds;
    private final Clock clock;
    private final Supplier<String> ids;

    public ProbeTemplateService(ProbeTemplateStore templates, ProbeHistoryStore history, JobService jobs,
            ObjectMapper mapper, int defaultIntervalSeconds, Clock clock) {
        this(templates, history, jobs, mapper, defaultIntervalSeconds, clock, () -> UUID.randomUUID().toString());
    }

    public ProbeTemplateService(ProbeTemplateStore templates, ProbeHistoryStore history, JobService jobs,
            ObjectMapper mapper, int defaultIntervalSeconds, Clock clock, Supplier<String> ids) {
        this.templates = templates;
        this.history = history;
        this.jobs = jobs;
        this.mapper = mapper;
        this.defaultIntervalSeconds = defaultIntervalSeconds;
        this.clock = clock;
        this.ids = ids;
    }

    /** New templates are due on the next tick. */
    public ProbeTemplate create(ProbeTemplateRequest req) {
        Instant now = clock.instant();
        ProbeTemplate template = validated(req, ProbeTemplate.builder().id(ids.get()))
                .nextRunAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        templates.create(template);
        log.info("Probe template {} ('{}') created, every {}s", template.getId(), template.getName(),
                template.getIntervalSeconds());
        return template;
    }

    public ProbeTemplate get(String id) {
        return templates.get(id).orElseThrow(() -> new NotFoundException("probe template", id));
    }

    public List<ProbeTemplate> list() {
        return templates.list();
    }

    /**
     * Replaces the admin-owned fields. {@code next_run_at} only moves when the interval changes, to now + interval.
     */
    public ProbeTemplate update(String id, ProbeTemplateRequest req) {
        ProbeTemplate current = get(id);
        Instant now = clock.instant();
        ProbeTemplate updated = validated(req, current.toBuilder()).updatedAt(now).build();
        if (!templates.update(updated)) {
            throw new NotFoundException("probe template", id);
        }
        if (updated.getIntervalSeconds() != current.getIntervalSeconds()) {
            templates.rescheduleNextRun(id, now.plusSeconds(updated.getIntervalSeconds()));
            log.info("Probe template {} interval changed {}s -> {}s", id, current.getIntervalSeconds(),
                    updated.getIntervalSeconds());
        }
        return get(id);
    }

    public void delete(String id) {
        if (!templates.delete(id)) {
            throw new NotFoundException("probe template", id);
        }
        log.info("Probe template {} deleted", id);
    }

    /** Enqueues a probe from the current template without touching its schedule. */
    public String runNow(String id) {
        ProbeTemplate template = get(id);
        String jobId = jobs.submit(ProbeScheduler.submissionFor(template, mapper));
        log.info("Probe template {} run on demand as job {}", id, jobId);
        return jobId;
    }

    public List<ProbeHistoryEntry> history(String id, Integer limit) {
        get(id);
        int n = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
        if (n < 1 || n > ProbeHistoryStore.MAX_ENTRIES) {
            throw new IllegalArgumentException("limit must be between 1 and " + ProbeHistoryStore.MAX_ENTRIES);
        }
        return history.list(id, n);
    }

    private ProbeTemplate.ProbeTemplateBuilder validated(ProbeTemplateRequest req,
            ProbeTemplate.ProbeTemplateBuilder builder) {
        if (req == null) {
            throw new IllegalArgumentException("request body is required");
        }
        String name = trimToNull(req.getName());
        if (name == null || name.length() > MAX_NAME) {
            throw new IllegalArgumentException("name must be 1.." + MAX_NAME + " characters");
        }
        String description = trimToNull(req.getDescription());
        if (description != null && description.length() > MAX_DESCRIPTION) {
            throw new IllegalArgumentException("description must be at most " + MAX_DESCRIPTION + " characters");
        }
        String method = req.getMethod() == null ? "GET" : req.getMethod().trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new IllegalArgumentException("method must be one of GET, HEAD, POST");
        }
        if (req.getSlaMs() == null || req.getSlaMs() < 1 || req.getSlaMs() > MAX_SLA_MS) {
            throw new IllegalArgumentException("sla_ms must be between 1 and " + MAX_SLA_MS);
        }
        int interval = req.getIntervalSeconds() == null ? defaultIntervalSeconds : req.getIntervalSeconds();
        if (interval < MIN_INTERVAL || interval > MAX_INTERVAL) {
            throw new IllegalArgumentException("interval_seconds must be between " + MIN_INTERVAL + " and "
                    + MAX_INTERVAL);
        }
        return builder
                .name(name)
                .description(description)
                .url(validUrl(req.getUrl()))
                .method(method)
                .slaMs(req.getSlaMs())
                .intervalSeconds(interval)
                .notificationRules(validRules(req.getNotificationRules()))
                .tags(distinctTags(req.getTags()));
    }

    private static String validUrl(String raw) {
        String url = trimToNull(raw);
        if (url == null) {
            throw new IllegalArgumentException("url is required");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not a valid URI: " + url);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL");
        }
        return url;
    }

    private static List<NotificationRule> validRules(List<NotificationRule> rules) {
        if (rules == null) {
            return List.of();
        }
        List<NotificationRule> out = new ArrayList<>();
        for (NotificationRule rule : rules) {
            if (rule == null || rule.getChannel() == null) {
                throw new IllegalArgumentException("notification rule channel is required");
            }
            String target = trimToNull(rule.getTarget());
            if (target == null) {
                throw new IllegalArgumentException("notification rule target is required");
            }
            out.add(NotificationRule.builder()
                    .channel(rule.getChannel())
                    .target(target)
                    .threshold(rule.getThreshold() == null ? NotificationThreshold.BREACH : rule.getThreshold())
                    .build());
        }
        return List.copyOf(out);
    }

    private static List<String> distinctTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String tag : tags) {
            String t = trimToNull(tag);
            if (t != null) {
                seen.add(t);
            }
        }
        return List.copyOf(seen);
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
