package com.teamchat.domain.service;

import com.teamchat.common.error.InvalidReplyException;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.model.NewMessage;
import com.teamchat.domain.model.UserRef;

public interface MessageService {

    /** 预分配消息 id（雪花，时间有序）。 */
    long allocateId();

    /**
     * 追加一条消息并返回规范版本。
     *
     * @throws InvalidReplyException replyToId 不属于同一频道
     */
    MessageView append(long messageId, NewMessage message);

    default MessageView append(NewMessage message) {
        return append(allocateId(), message);
    }

    /** 不存在返回 null。 */
    MessageView getView(long messageId);

    /**
     * 读取历史；viewer 必须能访问该频道。返回的 messages 按 seq 升序。
     *
     * <p>beforeId/afterId 必须是该频道内的消息 id，否则抛 IllegalArgumentException。</p>
     */
    MessagePage listMessages(UserRef viewer, long channelId, MessageCursor cursor);

    /** 频道内 seq 最大那条消息的 id；没有消息返回 null。 */
    Long latestMessageId(long channelId);
}
