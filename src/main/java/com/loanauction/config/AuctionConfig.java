package com.loanauction.config;

import com.loanauction.time.SystemTimeSource;
import com.loanauction.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(AuctionProperties.class)
public class AuctionConfig {

    private static final Logger log = LoggerFactory.getLogger(AuctionConfig.class);

    @Bean
    public TimeSource timeSource() {
        return new SystemTimeSource();
    }

    /**
     * Executor for audit records. Audit runs after the auction state change
     * is published and never holds an auction lock. A full queue drops the
     * record with a warning instead of failing the request that produced it.
     */
    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor(AuctionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAudit().getPoolSize());
        executor.setMaxPoolSize(properties.getAudit().getPoolSize());
        executor.setQueueCapacity(properties.getAudit().getQueueCapacity());
        executor.setThreadNamePrefix("audit-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Audit queue full ({} queued, {} active), audit record dropped",
                        pool.getQueue().size(), pool.getActiveCount()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
