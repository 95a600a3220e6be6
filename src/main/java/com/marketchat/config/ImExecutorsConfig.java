package com.marketchat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ImExecutorProperties.class)
public class ImExecutorsConfig {

    @Bean("imDbExecutor")
    @Primary
    public Executor imDbExecutor(ImExecutorProperties props) {
        return build("im-db-", props.dbEffective());
    }

    @Bean("imPushExecutor")
    public Executor imPushExecutor(ImExecutorProperties props) {
        return build("im-push-", props.pushEffective());
    }

    private static ThreadPoolTaskExecutor build(String prefix, ImExecutorProperties.Pool pool) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(pool.corePoolSizeEffective());
        executor.setMaxPoolSize(pool.maxPoolSizeEffective());
        executor.setQueueCapacity(pool.queueCapacityEffective());
        // 队列满直接拒绝：调用方回 server_busy，而不是在 eventLoop 上阻塞
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
