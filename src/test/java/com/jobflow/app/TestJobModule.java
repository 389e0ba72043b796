package com.jobflow.app;

import com.jobflow.core.JobConfig;
import com.jobflow.core.JobRegistry;
import com.jobflow.core.QueueBinding;
import com.jobflow.scheduling.SchedulerRegistry;
import com.jobflow.scheduling.StaticSchedulerConfig;

/**
 * Module discovered through META-INF/services in tests.
 */
public class TestJobModule implements JobModule {

    public static final QueueBinding PINGS = QueueBinding.builder("pings").concurrency(2).build();

    @Override
    public void register(JobRegistry jobs, SchedulerRegistry schedulers) {
        jobs.job("ping", payload -> payload, JobConfig.on(PINGS).attempts(1).build(),
                (payload, context) -> "pong");
        schedulers.addStatic(StaticSchedulerConfig.builder("hourly-ping", "pings", "0 * * * *")
                .jobName("ping")
                .build());
    }
}
