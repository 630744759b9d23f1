package com.example.predictor.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.predictor.config.ProxyProperties;
import com.example.predictor.controller.ApiExceptionHandler.ErrorBody;
import com.example.predictor.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

/**
 * Cross-origin relay for browser clients. Forwards {@code /relay/predict} and
 * {@code /relay/health} to the gateway once, without retry, and hands back the upstream status
 * and body untouched. Only an unreachable or slow upstream produces a response of its own.
 */
@RestController
@RequestMapping("/relay")
@CrossOrigin(origins = "*", allowedHeaders = "Content-Type",
    methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
@ConditionalOnProperty(prefix = "app.proxy", name = "enabled", havingValue = "true")
public class RoutingProxyController {

    private static final Logger log = LoggerFactory.getLogger(RoutingProxyController.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final WebClient webClient;
    private final ProxyProperties properties;

    public RoutingProxyController(WebClient.Builder webClientBuilder, ProxyProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.upstreamUrl()).build();
        this.properties = properties;
        log.info("Routing proxy enabled: upstream={} timeout={}ms",
            properties.upstreamUrl(), properties.timeout().toMillis());
    }

    @PostMapping("/predict")
    public Mono<ResponseEntity<String>> predict(@RequestBody(required = false) String body) {
        return relay(HttpMethod.POST, "/predict", body);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return relay(HttpMethod.GET, "/health", null);
    }

    Mono<ResponseEntity<String>> relay(HttpMethod method, String path, String body) {
        WebClient.RequestBodySpec request = webClient.method(method).uri(path);
        WebClient.RequestHeadersSpec<?> spec = body != null
            ? request.contentType(MediaType.APPLICATION_JSON).bodyValue(body)
            : request;

        return spec.exchangeToMono(response -> response.toEntity(String.class))
            .timeout(properties.timeout())
            .map(upstream -> {
                HttpHeaders headers = corsHeaders();
                MediaType contentType = upstream.getHeaders().getContentType();
                if (contentType != null) {
                    headers.setContentType(contentType);
                }
                log.debug("Relayed {} {} -> {}", method, path, upstream.getStatusCode().value());
                return ResponseEntity.status(upstream.getStatusCode())
                    .headers(headers)
                    .body(upstream.getBody() != null ? upstream.getBody() : "");
            })
            .onErrorResume(e -> {
                log.warn("Upstream {} {} unavailable: {}", method, path, e.toString());
                HttpHeaders headers = corsHeaders();
                headers.setContentType(MediaType.APPLICATION_JSON);
                return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .headers(headers)
                    .body(errorJson("Upstream service unavailable: " + path)));
            });
    }

    static HttpHeaders corsHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS");
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
        return headers;
    }

    private static String errorJson(String message) {
        try {
            return mapper.writeValueAsString(new ErrorBody(ErrorCode.UPSTREAM_UNAVAILABLE, message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize error body", e);
        }
    }
}
