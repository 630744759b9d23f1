package com.example.predictor.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.predictor.insights.InsightsGenerator;
import com.example.predictor.model.InsightReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/insights")
public class InsightsController {

    private final InsightsGenerator generator;

    public InsightsController(InsightsGenerator generator) {
        this.generator = generator;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record InsightReportDto(
        String generatedAt,
        String summaryText,
        List<String> recommendations,
        List<String> alerts,
        int basedOnBucketCount,
        long dataPoints,
        String severity,
        String source,
        boolean degraded
    ) {
        static InsightReportDto from(InsightReport r) {
            return new InsightReportDto(r.generatedAt().toString(), r.summaryText(),
                r.recommendations(), r.alerts(), r.basedOnBucketCount(), r.dataPoints(),
                r.severity().wireName(), r.source(), r.degraded());
        }
    }

    @GetMapping
    public Mono<InsightReportDto> latest() {
        return Mono.fromSupplier(generator::latest).map(InsightReportDto::from);
    }

    @PostMapping("/refresh")
    public Mono<InsightReportDto> refresh() {
        return Mono.fromCallable(generator::refresh)
            .subscribeOn(Schedulers.boundedElastic())
            .map(InsightReportDto::from);
    }
}
