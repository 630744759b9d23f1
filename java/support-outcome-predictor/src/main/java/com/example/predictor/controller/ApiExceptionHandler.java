package com.example.predictor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import com.example.predictor.exception.ErrorCode;
import com.example.predictor.exception.PredictionUnavailableException;
import com.example.predictor.exception.ValidationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Every failure leaves as {@code {error_code, message}}. Stack traces stay in the log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ErrorBody(ErrorCode errorCode, String message) {}

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorBody> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> unreadableInput(ServerWebInputException e) {
        MethodParameter parameter = e.getMethodParameter();
        if (parameter != null && !parameter.hasParameterAnnotation(RequestBody.class)) {
            return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER,
                "Invalid value for parameter '" + parameter.getParameterName() + "'");
        }
        log.debug("Unreadable request body: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.MALFORMED_JSON, "Request body is not valid JSON");
    }

    /** Framework rejections (415, 405, 404, ...) keep their status. */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> rejected(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", status, e);
            return body(status, ErrorCode.INTERNAL_ERROR, "Internal server error");
        }
        log.debug("Rejected request: {}", e.getMessage());
        String reason = e.getReason() != null ? e.getReason() : "Request rejected";
        return body(status, codeFor(status), reason);
    }

    @ExceptionHandler(PredictionUnavailableException.class)
    public ResponseEntity<ErrorBody> unavailable(PredictionUnavailableException e) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> unexpected(Exception e) {
        log.error("Unhandled error serving request", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, "Internal server error");
    }

    private static ErrorCode codeFor(HttpStatusCode status) {
        if (status.value() == HttpStatus.UNSUPPORTED_MEDIA_TYPE.value()) return ErrorCode.UNSUPPORTED_MEDIA_TYPE;
        if (status.value() == HttpStatus.METHOD_NOT_ALLOWED.value()) return ErrorCode.METHOD_NOT_ALLOWED;
        if (status.value() == HttpStatus.NOT_FOUND.value()) return ErrorCode.NOT_FOUND;
        return ErrorCode.INVALID_REQUEST;
    }

    private static ResponseEntity<ErrorBody> body(HttpStatusCode status, ErrorCode code, String message) {
        return ResponseEntity.status(status).body(new ErrorBody(code, message));
    }
}
