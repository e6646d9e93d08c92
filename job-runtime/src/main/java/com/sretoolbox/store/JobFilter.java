package com.sretoolbox.store;

import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

@Value
@Builder
public class JobFilter {
    public static final JobFilter ALL = JobFilter.builder().build();

    @Builder.Default
    Set<String> toolkits = Set.of();
    @Builder.Default
    Set<JobStatus> statuses = Set.of();
    Integer limit;
    int offset;

    public boolean matches(JobRecord record) {
        if (!statuses.isEmpty() && !statuses.contains(record.getStatus())) {
            return false;
        }
        if (!toolkits.isEmpty()) {
            String toolkit = record.getToolkit() == null ? "" : record.getToolkit().toLowerCase(Locale.ROOT);
            return toolkits.stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).equals(toolkit));
        }
        return true;
    }
}
