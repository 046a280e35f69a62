package com.teamchat.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 消息核心的业务异常基类：携带错误码与 HTTP 状态，由 GlobalExceptionHandler 统一翻译。
 */
@Getter
public abstract class ChatException extends RuntimeException {

    private final int code;
    private final HttpStatus status;

    protected ChatException(int code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected ChatException(int code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
