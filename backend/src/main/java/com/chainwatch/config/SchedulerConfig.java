package com.chainwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Scheduler pool for watcher timers: connect timeouts, retry delays, poll and heartbeat intervals.
 * Exposed to Reactor as a Scheduler backed by the same threads.
 */
@Configuration
public class SchedulerConfig {

    public static final String WATCHER_SCHEDULER_POOL = "watcher-scheduler-pool";
    public static final String WATCHER_SCHEDULER = "watcher-scheduler";

    @Bean(name = WATCHER_SCHEDULER_POOL)
    public ThreadPoolTaskScheduler watcherSchedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("watcher-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }

    @Bean(name = WATCHER_SCHEDULER, destroyMethod = "dispose")
    public Scheduler watcherScheduler(ThreadPoolTaskScheduler watcherSchedulerPool) {
        return Schedulers.fromExecutorService(watcherSchedulerPool.getScheduledExecutor(), "watcher");
    }
}
