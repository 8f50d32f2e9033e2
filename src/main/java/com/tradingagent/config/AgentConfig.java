package com.tradingagent.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentConfig {

    /** Single time source so retry ages, ledger timestamps and file suffixes agree. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
