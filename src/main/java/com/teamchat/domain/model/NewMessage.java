package com.teamchat.domain.model;

import java.util.List;

/**
 * 一次发送的输入（尚未分配 id）。
 */
public record NewMessage(
        long channelId,
        UserRef senderRef,
        String content,
        Long replyToId,
        List<AttachmentRef> attachments,
        String clientNonce
) {

    public NewMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static NewMessage text(long channelId, UserRef senderRef, String content) {
        return new NewMessage(channelId, senderRef, content, null, null, null);
    }

    public NewMessage replyingTo(Long messageId) {
        return new NewMessage(channelId, senderRef, content, messageId, attachments, clientNonce);
    }
}
