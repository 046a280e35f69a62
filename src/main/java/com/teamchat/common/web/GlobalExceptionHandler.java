package com.teamchat.common.web;

import com.teamchat.common.api.ApiCodes;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChatException;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理：把常见异常“翻译”为统一的 Result JSON。
 *
 * <p>HTTP 状态码仍然会设置（400/401/403/404/503/500），但响应体结构始终一致。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 消息核心的业务异常：错误码与状态由异常自身携带。
     */
    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Result<Void>> handleChat(ChatException e) {
        if (e.getStatus().is5xxServerError()) {
            log.warn("chat request failed: code={}, msg={}, cause={}", e.getCode(), e.getMessage(),
                    e.getCause() == null ? null : e.getCause().toString());
        }
        return ResponseEntity.status(e.getStatus())
                .body(Result.fail(e.getCode(), e.getMessage()));
    }

    /**
     * Spring Validation（@Valid）触发的参数错误。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
            ? "invalid_request"
            : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 业务校验失败（service 层用 IllegalArgumentException 表达的简单参数错误）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * JWT 解析失败：通常算未授权。
     */
    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Result<Void>> handleJwt(JwtException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "invalid_token" : e.getMessage();
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, msg));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled request error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
