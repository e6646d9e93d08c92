package com.sretoolbox.worker.notify;

import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.ProbeExecutionSummary;
import lombok.extern.slf4j.Slf4j;

/**
 * Default sender for channels without a delivery integration: the alert is written to the worker log.
 */
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(NotificationRule rule, ProbeExecutionSummary summary) {
        log.info("[{}] probe alert for '{}' -> {}: breach_count={} met_sla={} average_latency_ms={}",
                rule.getChannel().wireName(), summary.getTemplateName(), rule.getTarget(), summary.getBreachCount(),
                summary.isMetSla(), summary.getAverageLatencyMs());
    }
}
