package io.kairos.core.observability;

import io.kairos.core.job.Job;
import io.kairos.core.scheduler.ExecutionResult;
import io.kairos.core.scheduler.SchedulerListener;
import java.util.List;

/**
 * Recent executions of the running daemon, held in memory and lost on restart.
 */
public final class ExecutionHistory implements SchedulerListener {
    private final RingBuffer<ExecutionRecord> records;
    private long total;
    private long failed;

    public ExecutionHistory(int capacity) {
        this.records = new RingBuffer<>(capacity);
    }

    @Override
    public synchronized void onFinished(Job job, ExecutionResult result, boolean forced) {
        records.add(ExecutionRecord.of(result, forced));
        total++;
        if (!result.succeeded()) {
            failed++;
        }
    }

    public synchronized List<ExecutionRecord> recent(int limit) {
        return records.newest(limit);
    }

    public synchronized List<ExecutionRecord> recentFor(String jobId, int limit) {
        return records.newest(records.size()).stream()
            .filter(record -> record.jobId().equals(jobId))
            .limit(Math.max(0, limit))
            .toList();
    }

    public synchronized Summary summary() {
        return new Summary(total, failed, records.size(), records.capacity());
    }

    public record Summary(long totalExecutions, long failedExecutions, int retained, int capacity) {
    }
}
