package com.xendex.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
@EnableAsync
public class SchedulingConfig implements AsyncConfigurer {

    private final TaskSchedulerProperties taskProperties;

    public SchedulingConfig(TaskSchedulerProperties taskProperties) {
        this.taskProperties = taskProperties;
    }

    /**
     * Worker pool that runs claimed sequence tasks
     */
    @Bean(name = "sequenceTaskExecutor")
    public ThreadPoolTaskExecutor sequenceTaskExecutor() {
        TaskSchedulerProperties.Worker worker = taskProperties.worker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.corePoolSize());
        executor.setMaxPoolSize(worker.maxPoolSize());
        executor.setQueueCapacity(worker.queueCapacity());
        executor.setThreadNamePrefix("sequence-worker-");
        // Saturation pushes work back onto the poller thread, which slows claiming
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return sequenceTaskExecutor();
    }
}
