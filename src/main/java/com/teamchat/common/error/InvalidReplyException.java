package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidReplyException extends ChatException {

    private final long channelId;
    private final long replyToId;

    public InvalidReplyException(long channelId, long replyToId) {
        super(ApiCodes.INVALID_REPLY, HttpStatus.BAD_REQUEST, "invalid_reply");
        this.channelId = channelId;
        this.replyToId = replyToId;
    }
}
