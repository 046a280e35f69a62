package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * subject 无法映射到任何用户记录。调用方不得回退到其他 id 空间。
 */
@Getter
public class UnknownIdentityException extends ChatException {

    private final String subject;

    public UnknownIdentityException(String subject) {
        super(ApiCodes.UNKNOWN_IDENTITY, HttpStatus.UNAUTHORIZED, "unknown_identity");
        this.subject = subject;
    }
}
