package io.kairos.core.bus;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity event queue. Publishing never blocks: when the queue is full the oldest pending
 * event is dropped and counted.
 */
public final class BoundedJobEventBus implements JobEventBus {
    private static final Logger LOG = LoggerFactory.getLogger(BoundedJobEventBus.class);

    private final int capacity;
    private final ArrayDeque<JobEvent> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private long dropped;

    public BoundedJobEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    @Override
    public void publish(JobEvent event) {
        lock.lock();
        try {
            if (queue.size() == capacity) {
                JobEvent evicted = queue.pollFirst();
                dropped++;
                LOG.debug("Event buffer full, dropped {} event for job {}", evicted.type(), evicted.jobId());
            }
            queue.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobEvent> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<JobEvent> recent(int limit) {
        lock.lock();
        try {
            List<JobEvent> result = new ArrayList<>();
            Iterator<JobEvent> newestFirst = queue.descendingIterator();
            while (newestFirst.hasNext() && result.size() < Math.max(0, limit)) {
                result.add(newestFirst.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
