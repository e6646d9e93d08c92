package com.sretoolbox.worker.notify;

import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.probe.NotificationChannel;
import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.NotificationThreshold;
import com.sretoolbox.probe.ProbeExecutionSummary;
import com.sretoolbox.probe.ProbeHistoryEntry;
import com.sretoolbox.probe.ProbeHistoryStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decides which rules fire for a finished probe, delivers them, and records the execution as the
 * template's last-known result.
 * <p>
 * {@code recovery} is edge-triggered: it fires only when this run met the SLA and the previous recorded
 * run for the same template did not. Delivery is best-effort; failures are reported to the job log and the
 * channel is left out of {@code notified_channels}.
 */
@Slf4j
public class NotificationDispatcher {
    private final ProbeHistoryStore history;
    private final Map<NotificationChannel, NotificationSender> senders;
    private final NotificationSender fallback;
    private final Clock clock;

    public NotificationDispatcher(ProbeHistoryStore history, Map<NotificationChannel, NotificationSender> senders,
            NotificationSender fallback, Clock clock) {
        this.history = history;
        this.senders = senders.isEmpty() ? new EnumMap<>(NotificationChannel.class) : new EnumMap<>(senders);
        this.fallback = fallback;
        this.clock = clock;
    }

    public ProbeExecutionSummary dispatch(String jobId, List<NotificationRule> rules, ProbeExecutionSummary summary,
            Consumer<String> jobLog) {
        String templateId = summary.getTemplateId();
        Optional<ProbeHistoryEntry> previous = templateId == null ? Optional.empty() : history.latest(templateId);

        List<NotificationChannel> notified = new ArrayList<>();
        for (NotificationRule rule : rules == null ? List.<NotificationRule>of() : rules) {
            if (!shouldNotify(rule.getThreshold(), summary, previous)) {
                continue;
            }
            NotificationChannel channel = rule.getChannel();
            try {
                senders.getOrDefault(channel, fallback).send(rule, summary);
                if (!notified.contains(channel)) {
                    notified.add(channel);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                jobLog.accept("Notification to " + channel.wireName() + " failed: interrupted");
                break;
            } catch (Exception e) {
                log.warn("Notification to {} ({}) failed for job {}: {}", channel.wireName(), rule.getTarget(), jobId,
                        e.getMessage());
                jobLog.accept("Notification to " + channel.wireName() + " failed: " + e.getMessage());
            }
        }

        ProbeExecutionSummary result = summary.toBuilder().notifiedChannels(List.copyOf(notified)).build();
        if (templateId != null) {
            try {
                history.record(ProbeHistoryEntry.builder()
                        .templateId(templateId)
                        .jobId(jobId)
                        .recordedAt(clock.instant())
                        .summary(result)
                        .build());
            } catch (ProgressStoreException e) {
                log.warn("Could not record probe history for template {}: {}", templateId, e.getMessage());
                jobLog.accept("Probe history not recorded: " + e.getMessage());
            }
        }
        return result;
    }

    static boolean shouldNotify(NotificationThreshold threshold, ProbeExecutionSummary summary,
            Optional<ProbeHistoryEntry> previous) {
        return switch (threshold == null ? NotificationThreshold.BREACH : threshold) {
            case ALWAYS -> true;
            case BREACH -> summary.getBreachCount() > 0;
            case RECOVERY -> summary.isMetSla() && previous.isPresent() && !previous.get().isMetSla();
        };
    }
}
