package com.example.predictor.controller;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.predictor.analytics.AnalyticsAggregator;
import com.example.predictor.analytics.MetricsOverview;
import com.example.predictor.exception.ErrorCode;
import com.example.predictor.exception.ValidationException;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private final AnalyticsAggregator aggregator;

    public MetricsController(AnalyticsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record OverviewDto(
        long totalPredictions,
        long highPriority,
        long lowSatisfaction,
        long negativeSentiment,
        double avgConfidence,
        double avgLatencyMs,
        String topIssueType,
        Map<String, Long> satisfactionDistribution,
        Map<String, Long> priorityDistribution,
        Map<String, Long> issueTypeDistribution,
        Map<String, Long> sentimentDistribution
    ) {
        static OverviewDto from(MetricsOverview o) {
            return new OverviewDto(o.totalPredictions(), o.highPriority(), o.lowSatisfaction(),
                o.negativeSentiment(), o.avgConfidence(), o.avgLatencyMs(),
                o.topIssueType() != null ? o.topIssueType().wireName() : null,
                wire(o.satisfactionDistribution()), wire(o.priorityDistribution()),
                wire(o.issueTypeDistribution()), wire(o.sentimentDistribution()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record BucketDto(
        String windowStart,
        long windowSeconds,
        long count,
        Map<String, Long> satisfactionHistogram,
        Map<String, Long> priorityHistogram,
        Map<String, Long> issueTypeHistogram,
        Map<String, Long> sentimentHistogram,
        double avgConfidence,
        double avgLatencyMs
    ) {
        static BucketDto from(MetricBucket b) {
            return new BucketDto(b.windowStart().toString(), b.windowWidth().toSeconds(), b.count(),
                wire(b.satisfactionHistogram()), wire(b.priorityHistogram()),
                wire(b.issueTypeHistogram()), wire(b.sentimentHistogram()),
                b.avgConfidence(), b.avgLatencyMs());
        }
    }

    public record MetricsResponse(OverviewDto overview, List<BucketDto> buckets) {}

    @GetMapping
    public Mono<MetricsResponse> metrics(
        @RequestParam(name = "window_minutes", required = false) Integer windowMinutes
    ) {
        if (windowMinutes != null && windowMinutes <= 0) {
            return Mono.error(new ValidationException(ErrorCode.INVALID_PARAMETER,
                "window_minutes must be positive"));
        }
        Duration window = windowMinutes != null ? Duration.ofMinutes(windowMinutes) : null;
        List<MetricBucket> snapshot = aggregator.snapshot(window);
        return Mono.just(new MetricsResponse(
            OverviewDto.from(MetricsOverview.from(snapshot)),
            snapshot.stream().map(BucketDto::from).toList()));
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> reset() {
        aggregator.reset();
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static Map<String, Long> wire(Map<?, Long> histogram) {
        Map<String, Long> out = new LinkedHashMap<>();
        histogram.forEach((k, v) -> out.put(wireName(k), v));
        return out;
    }

    private static String wireName(Object key) {
        if (key instanceof IssueType t) return t.wireName();
        if (key instanceof SatisfactionLevel s) return s.wireName();
        if (key instanceof Priority p) return p.wireName();
        return String.valueOf(key);
    }
}
