package com.example.oralexam.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.retry.annotation.EnableRetry;

@Configuration
@EnableRetry
public class AssignmentConfig {

    private static final Logger log = LoggerFactory.getLogger(AssignmentConfig.class);

    @Value("${oralexam.assignment.lock-timeout-ms}")
    private long lockTimeoutMs;

    @Value("${oralexam.assignment.exclude-group-history:false}")
    private boolean excludeGroupHistory;

    @Value("${oralexam.student-view.refresh-interval-ms}")
    private long refreshIntervalMs;

    @Value("${oralexam.api.concurrency-retries:2}")
    private int concurrencyRetries;

    @EventListener(ApplicationReadyEvent.class)
    public void logSettings() {
        log.info("event=assignment_config lockTimeoutMs={} excludeGroupHistory={} refreshIntervalMs={} concurrencyRetries={}",
                lockTimeoutMs, excludeGroupHistory, refreshIntervalMs, concurrencyRetries);
    }
}
