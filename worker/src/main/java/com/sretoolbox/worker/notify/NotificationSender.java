package com.sretoolbox.worker.notify;

import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.ProbeExecutionSummary;

import java.io.IOException;

public interface NotificationSender {
    void send(NotificationRule rule, ProbeExecutionSummary summary) throws IOException, InterruptedException;
}
