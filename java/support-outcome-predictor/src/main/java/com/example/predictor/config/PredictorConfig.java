package com.example.predictor.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class PredictorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    Scheduler analyticsScheduler(AnalyticsProperties properties) {
        return Schedulers.newBoundedElastic(
            properties.publisherThreads(), properties.publisherQueueCapacity(), "analytics");
    }
}
