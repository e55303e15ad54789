package com.swarmnet.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by AgentExecutor.
 *
 * roleWorkerPool    - runs individual collaborator invocations. No queue: an
 *                     idle thread takes the call or a new one is started, up
 *                     to swarmnet.executor.role.max-pool-size.
 * orchestrationPool - the shared batch substrate for FULL_ORCHESTRATION.
 *                     Fixed at swarmnet.executor.pool-size threads with a
 *                     bounded queue; once both are full the pool rejects the
 *                     batch and AgentExecutor falls back to HIERARCHICAL.
 *
 * The two must stay separate: a batch task on orchestrationPool blocks on
 * a role invocation running on roleWorkerPool.
 *
 * Neither pool sets a rejection handler, so the default AbortPolicy applies
 * and a saturated pool throws RejectedExecutionException.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "roleWorkerPool")
    public ThreadPoolTaskExecutor roleWorkerPool(
            @Value("${swarmnet.executor.role.core-pool-size:8}") int corePoolSize,
            @Value("${swarmnet.executor.role.max-pool-size:64}") int maxPoolSize
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, corePoolSize));
        executor.setMaxPoolSize(Math.max(Math.max(1, corePoolSize), maxPoolSize));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("swarm-role-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "orchestrationPool")
    public ThreadPoolTaskExecutor orchestrationPool(
            @Value("${swarmnet.executor.pool-size:4}")      int poolSize,
            @Value("${swarmnet.executor.queue-capacity:8}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, poolSize));
        executor.setMaxPoolSize(Math.max(1, poolSize));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix("swarm-batch-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
