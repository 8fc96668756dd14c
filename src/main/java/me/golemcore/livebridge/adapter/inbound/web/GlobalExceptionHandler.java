package me.golemcore.livebridge.adapter.inbound.web;

import me.golemcore.livebridge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.livebridge.domain.exception.LiveApiException;
import me.golemcore.livebridge.domain.exception.LiveConfigException;
import me.golemcore.livebridge.domain.exception.LiveConnectException;
import me.golemcore.livebridge.domain.exception.LiveSessionActiveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps live exceptions to HTTP responses for the REST controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.livebridge.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null);
    }

    @ExceptionHandler(LiveSessionActiveException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleActive(LiveSessionActiveException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(LiveConfigException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConfig(LiveConfigException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(LiveApiException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleApi(LiveApiException ex) {
        log.warn("[API] Open platform error {}: {}", ex.getCode(), ex.getMessage());
        Integer code = ex.getCode() != LiveApiException.NO_CODE ? ex.getCode() : null;
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), code);
    }

    @ExceptionHandler(LiveConnectException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConnect(LiveConnectException ex) {
        log.warn("[API] Push socket unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message, Integer code) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .code(code)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
