package com.insightops.dashboard.scheduling;

import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of an {@link ActiveTimer} for the status surface.
 */
@Value
public class TimerStatus {

    String timerId;
    String schedule;
    boolean running;
    long ticks;
    Instant createdAt;

    public static TimerStatus of(ActiveTimer timer) {
        return new TimerStatus(timer.getTimerId(), timer.getScheduleExpression(), timer.isRunning(),
                timer.getTicks(), timer.getCreatedAt());
    }
}
