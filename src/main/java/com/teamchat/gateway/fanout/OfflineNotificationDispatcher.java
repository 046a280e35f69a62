package com.teamchat.gateway.fanout;

import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.UserRef;
import com.teamchat.gateway.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 私聊消息写入后：对端没有任何在线连接时，异步发一次离线通知。公共频道不通知。
 */
@Slf4j
@Component
public class OfflineNotificationDispatcher {

    private final SessionRegistry sessionRegistry;
    private final OfflineNotifier notifier;
    private final Executor notifyExecutor;

    public OfflineNotificationDispatcher(SessionRegistry sessionRegistry,
                                         OfflineNotifier notifier,
                                         @Qualifier("chatNotifyExecutor") Executor notifyExecutor) {
        this.sessionRegistry = sessionRegistry;
        this.notifier = notifier;
        this.notifyExecutor = notifyExecutor;
    }

    public void dispatch(ChannelEntity channel, UserRef sender, MessageView message) {
        if (channel == null || !channel.isDirect()) {
            return;
        }
        CanonicalPair pair = channel.pair();
        if (pair == null || !pair.contains(sender)) {
            return;
        }
        UserRef recipient = pair.peerOf(sender);
        try {
            notifyExecutor.execute(() -> notifyIfOffline(recipient, message));
        } catch (RejectedExecutionException e) {
            log.warn("offline notify rejected: recipient={}, msgId={}", recipient, message.getId());
        }
    }

    private void notifyIfOffline(UserRef recipient, MessageView message) {
        try {
            if (sessionRegistry.isOnline(recipient)) {
                return;
            }
            notifier.notifyOffline(recipient, message);
        } catch (Exception e) {
            log.warn("offline notify failed: recipient={}, msgId={}, err={}", recipient, message.getId(), e.toString());
        }
    }
}
