package org.quarry.history.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class HistoryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock historyClock() {
        return Clock.systemUTC();
    }
}
