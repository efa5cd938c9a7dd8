package com.mathide.controller;

import com.mathide.exception.CompletionException;
import com.mathide.exception.HistoryImportException;
import com.mathide.exception.MathIdeErrorCode;
import com.mathide.exception.MathIdeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions that escape the orchestrator to HTTP responses.
 *
 * Transient model failures (rate limiting, connection) answer 503 so clients retry;
 * other model failures answer 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> completionFailed(CompletionException e) {
        HttpStatus status = e.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        log.warn("[Api] Model call failed ({}): {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(status).body(body(e));
    }

    @ExceptionHandler(HistoryImportException.class)
    public ResponseEntity<Map<String, Object>> importRejected(HistoryImportException e) {
        log.info("[Api] History import rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(body(e));
    }

    @ExceptionHandler(MathIdeException.class)
    public ResponseEntity<Map<String, Object>> failed(MathIdeException e) {
        if (e.getCode() == MathIdeErrorCode.INVALID_ARGUMENT) {
            return ResponseEntity.badRequest().body(body(e));
        }
        log.error("[Api] Unhandled failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(e));
    }

    private static Map<String, Object> body(MathIdeException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getCode().name());
        body.put("message", e.getMessage());
        if (!e.getContext().isEmpty()) {
            body.put("context", e.getContext());
        }
        return body;
    }
}
