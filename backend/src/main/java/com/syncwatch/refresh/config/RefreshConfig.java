package com.syncwatch.refresh.config;

import com.syncwatch.common.PollBackoff;
import com.syncwatch.refresh.tracking.RefreshJobManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the refresh job registry and poll schedule from {@link RefreshProperties}.
 */
@Configuration
@EnableConfigurationProperties(RefreshProperties.class)
public class RefreshConfig {

    public static final String REFRESH_CLOCK = "refreshClock";

    @Bean(name = REFRESH_CLOCK)
    public Clock refreshClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PollBackoff refreshPollBackoff(RefreshProperties properties) {
        return new PollBackoff(
                properties.getInitialInterval(),
                properties.getBackoffFactor(),
                properties.getMaxInterval(),
                properties.getGrowthEveryChecks());
    }

    @Bean
    public RefreshJobManager refreshJobManager(@Qualifier(REFRESH_CLOCK) Clock refreshClock) {
        return new RefreshJobManager(refreshClock);
    }
}
