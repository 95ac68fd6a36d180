package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.job.JobType;
import lombok.Getter;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live handle of one scheduled (tenant, job type) callback. Owned exclusively by
 * {@link SchedulingManager}; a schedule change replaces the instance, so the
 * timer id identifies one continuous run of the schedule.
 */
public class ActiveTimer {

    @Getter
    private final String tenantId;

    @Getter
    private final JobType jobType;

    @Getter
    private final String scheduleExpression;

    @Getter
    private final String timerId = UUID.randomUUID().toString();

    @Getter
    private final Instant createdAt;

    private final Runnable tickHandler;
    private final AtomicLong ticks = new AtomicLong();

    private volatile ScheduledFuture<?> future;
    private volatile boolean stopped;

    ActiveTimer(String tenantId, JobType jobType, String scheduleExpression, Instant createdAt,
                Runnable tickHandler) {
        this.tenantId = tenantId;
        this.jobType = jobType;
        this.scheduleExpression = scheduleExpression;
        this.createdAt = createdAt;
        this.tickHandler = tickHandler;
    }

    void start(TaskScheduler scheduler, Trigger trigger) {
        ScheduledFuture<?> scheduled = scheduler.schedule(this::fire, trigger);
        if (scheduled == null) {
            throw new IllegalStateException("Schedule " + scheduleExpression + " never fires");
        }
        this.future = scheduled;
    }

    void fire() {
        if (stopped) {
            return;
        }
        ticks.incrementAndGet();
        tickHandler.run();
    }

    /**
     * Cancels future fires. A tick that is already running is allowed to finish.
     */
    void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }

    public boolean isRunning() {
        return !stopped && future != null;
    }

    /** Number of times the timer has fired. */
    public long getTicks() {
        return ticks.get();
    }
}
