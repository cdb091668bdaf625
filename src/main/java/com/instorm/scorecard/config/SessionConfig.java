package com.instorm.scorecard.config;

import com.instorm.scorecard.storage.FileKeyValueStore;
import com.instorm.scorecard.storage.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class SessionConfig {

    private static final Logger logger = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    public KeyValueStore keyValueStore(
            @Value("${scorecard.session.store-path:${user.home}/.scorecard/session.properties}") Path storePath) {
        logger.info("Persisting session state in {}", storePath.toAbsolutePath());
        return new FileKeyValueStore(storePath);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Dashboard loads run one at a time, in the order their role changes arrived.
     */
    @Bean
    @Qualifier("dashboardExecutor")
    public Executor dashboardExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("dashboard-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
