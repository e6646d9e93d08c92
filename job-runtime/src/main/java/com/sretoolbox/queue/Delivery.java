package com.sretoolbox.queue;

import com.sretoolbox.jobs.JobDescriptor;
import lombok.Value;

import java.time.Instant;

@Value
public class Delivery {
    JobDescriptor descriptor;
    int bucketId;
    Instant enqueuedAt;
    Instant leaseExpiresAt;

    public String getJobId() {
        return descriptor.getJobId();
    }
}
