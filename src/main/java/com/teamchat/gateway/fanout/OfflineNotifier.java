package com.teamchat.gateway.fanout;

import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.model.UserRef;

/**
 * 离线通知出口（邮件/推送等），fire-and-forget。
 */
public interface OfflineNotifier {

    void notifyOffline(UserRef recipient, MessageView message);
}
