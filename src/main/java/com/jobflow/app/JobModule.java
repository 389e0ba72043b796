package com.jobflow.app;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import com.jobflow.core.JobRegistry;
import com.jobflow.scheduling.SchedulerRegistry;

/**
 * A set of jobs and schedulers contributed to the worker process.
 *
 * <p>Implementations are discovered with {@link ServiceLoader}: list the implementing class in
 * {@code META-INF/services/com.jobflow.app.JobModule} of the jar that ships the handlers.</p>
 *
 * <pre>{@code
 * public class EmailJobs implements JobModule {
 *     public void register(JobRegistry jobs, SchedulerRegistry schedulers) {
 *         jobs.job("send-invite", JobSchema.of(Invite.class), JobConfig.on(EMAIL).build(), new SendInvite());
 *     }
 * }
 * }</pre>
 */
public interface JobModule {

    /**
     * Register job definitions, static schedulers and scheduler templates.
     */
    void register(JobRegistry jobs, SchedulerRegistry schedulers);

    /**
     * Every module visible to {@code classLoader}, in discovery order.
     */
    static List<JobModule> load(ClassLoader classLoader) {
        List<JobModule> modules = new ArrayList<>();
        for (JobModule module : ServiceLoader.load(JobModule.class, classLoader)) {
            modules.add(module);
        }
        return modules;
    }
}
