package com.teamchat.gateway.fanout;

import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.model.UserRef;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingOfflineNotifier implements OfflineNotifier {

    @Override
    public void notifyOffline(UserRef recipient, MessageView message) {
        log.info("offline notify: recipient={}, channelId={}, msgId={}, from={}",
                recipient, message.getChannelId(), message.getId(),
                message.getSender() == null ? null : message.getSender().getRef());
    }
}
