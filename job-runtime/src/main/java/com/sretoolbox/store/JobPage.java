package com.sretoolbox.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sretoolbox.jobs.JobRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobPage {
    List<JobRecord> jobs;
    int total;

    static JobPage of(List<JobRecord> matching, JobFilter filter) {
        List<JobRecord> sorted = matching.stream()
                .sorted(Comparator.comparing(JobRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(JobRecord::getId))
                .collect(Collectors.toList());
        int from = Math.min(Math.max(filter.getOffset(), 0), sorted.size());
        int to = filter.getLimit() == null ? sorted.size() : Math.min(sorted.size(), from + Math.max(filter.getLimit(), 0));
        return new JobPage(List.copyOf(sorted.subList(from, to)), sorted.size());
    }
}
