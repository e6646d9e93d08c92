package com.sretoolbox.queue;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.QueueUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;

public class InMemoryTaskQueueTest {

    private static JobDescriptor descriptor(String id) {
        return JobDescriptor.builder().jobId(id).operation("probe").build();
    }

    @Test
    public void deliversInEnqueueOrder() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        queue.enqueue(descriptor("a"));
        queue.enqueue(descriptor("b"));
        assertThat(queue.dequeue().orElseThrow().getJobId(), is("a"));
        assertThat(queue.dequeue().orElseThrow().getJobId(), is("b"));
        assertThat(queue.inFlightCount(), is(2));
    }

    @Test
    public void unackedDeliveryIsRedeliveredAfterLeaseLapses() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue(Duration.ZERO, Duration.ofMillis(10), Clock.systemUTC());
        queue.enqueue(descriptor("a"));
        queue.enqueue(descriptor("b"));
        Delivery first = queue.dequeue().orElseThrow();
        Delivery again = queue.dequeue().orElseThrow();
        assertThat(first.getJobId(), is("a"));
        assertThat(again.getJobId(), is("a"));
    }

    @Test
    public void ackedDeliveryIsNotRedelivered() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue(Duration.ZERO, Duration.ofMillis(10), Clock.systemUTC());
        queue.enqueue(descriptor("a"));
        queue.ack(queue.dequeue().orElseThrow());
        queue.enqueue(descriptor("b"));
        assertThat(queue.dequeue().orElseThrow().getJobId(), is("b"));
    }

    @Test
    public void closeReleasesBlockedConsumer() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        AtomicReference<Optional<Delivery>> got = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                got.set(queue.dequeue());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        Thread.sleep(100);
        queue.close();
        consumer.join(2000);
        assertThat(consumer.isAlive(), is(false));
        assertThat(got.get().isPresent(), is(false));
    }

    @Test(expected = QueueUnavailableException.class)
    public void enqueueAfterCloseIsQueueUnavailable() {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        queue.close();
        queue.enqueue(descriptor("late"));
    }

    @Test
    public void pendingCoversWaitingAndLeasedDescriptors() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        queue.enqueue(descriptor("a"));
        queue.enqueue(descriptor("b"));
        Delivery a = queue.dequeue().orElseThrow();

        assertThat(queue.isPending("a"), is(true));
        assertThat(queue.isPending("b"), is(true));
        assertThat(queue.isPending("c"), is(false));
        queue.ack(a);
        assertThat(queue.isPending("a"), is(false));
    }
}
