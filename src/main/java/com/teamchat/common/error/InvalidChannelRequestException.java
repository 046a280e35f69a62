package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import org.springframework.http.HttpStatus;

public class InvalidChannelRequestException extends ChatException {

    public InvalidChannelRequestException(String reason) {
        super(ApiCodes.INVALID_CHANNEL_REQUEST, HttpStatus.BAD_REQUEST, reason);
    }
}
