package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.job.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static job type to task dispatch table, built once from every {@link PollingTask} bean.
 */
@Slf4j
@Component
public class TaskRegistry {

    private final Map<JobType, PollingTask> tasks = new EnumMap<>(JobType.class);

    public TaskRegistry(List<PollingTask> pollingTasks) {
        for (PollingTask task : pollingTasks) {
            PollingTask previous = tasks.put(task.jobType(), task);
            if (previous != null) {
                throw new IllegalStateException("Two polling tasks registered for job type "
                        + task.jobType().getKey() + ": " + previous.getClass().getSimpleName()
                        + " and " + task.getClass().getSimpleName());
            }
        }
        for (JobType jobType : JobType.values()) {
            if (!tasks.containsKey(jobType)) {
                throw new IllegalStateException("No polling task registered for job type " + jobType.getKey());
            }
        }
        log.info("Registered polling tasks for {}", tasks.keySet());
    }

    public PollingTask taskFor(JobType jobType) {
        return tasks.get(jobType);
    }
}
