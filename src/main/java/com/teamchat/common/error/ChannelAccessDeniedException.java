package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import org.springframework.http.HttpStatus;

public class ChannelAccessDeniedException extends ChatException {

    public ChannelAccessDeniedException() {
        super(ApiCodes.FORBIDDEN, HttpStatus.FORBIDDEN, "channel_access_denied");
    }
}
