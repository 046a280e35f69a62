package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ChannelNotFoundException extends ChatException {

    private final long channelId;

    public ChannelNotFoundException(long channelId) {
        super(ApiCodes.CHANNEL_NOT_FOUND, HttpStatus.NOT_FOUND, "channel_not_found");
        this.channelId = channelId;
    }
}
