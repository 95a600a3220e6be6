package com.marketchat.common.web;

import com.marketchat.common.api.ApiCodes;
import com.marketchat.common.api.Result;
import com.marketchat.common.error.ChatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理：把异常“翻译”为统一的 Result JSON，HTTP 状态码同时设置。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Result<Void>> handleChat(ChatException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? e.getErrorCode().getCode() : e.getMessage();
        return switch (e.getErrorCode()) {
            case UNAUTHORIZED -> ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Result.fail(ApiCodes.FORBIDDEN, msg));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Result.fail(ApiCodes.NOT_FOUND, msg));
            case INVALID_PAYLOAD -> ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
            default -> {
                log.error("chat request failed: code={}, msg={}", e.getErrorCode(), msg, e);
                yield ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(Result.fail(ApiCodes.PERSISTENCE_FAILURE, msg));
            }
        };
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
