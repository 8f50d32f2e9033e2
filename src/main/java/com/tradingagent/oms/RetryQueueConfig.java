package com.tradingagent.oms;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Prefix: {@code agent.retry-queue.*}. */
@Data
@Component
@ConfigurationProperties(prefix = "agent.retry-queue")
public class RetryQueueConfig {

    /** Entries that have been attempted this many times are dropped. */
    private int maxRetries = 10;

    /** Entries older than this are dropped without another attempt. */
    private Duration maxQueueAge = Duration.ofSeconds(600);
}
