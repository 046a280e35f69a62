package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import org.springframework.http.HttpStatus;

/**
 * 存储抖动导致的写失败。服务端不自动重试消息发送（避免重复落库），由客户端决定是否重发。
 */
public class TransientWriteFailureException extends ChatException {

    public TransientWriteFailureException(String message, Throwable cause) {
        super(ApiCodes.TRANSIENT_WRITE_FAILURE, HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
