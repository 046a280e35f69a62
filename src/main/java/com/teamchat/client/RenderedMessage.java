package com.teamchat.client;

import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.model.UserRef;

/**
 * 渲染用的一行：pending=true 表示乐观消息（还没有服务端 id）。
 */
public record RenderedMessage(
        Long id,
        String clientNonce,
        UserRef senderRef,
        String senderName,
        String content,
        boolean pending
) {

    static RenderedMessage canonical(MessageView m) {
        UserRef ref = m.getSender() == null ? null : m.getSender().getRef();
        String name = m.getSender() == null ? null : m.getSender().getDisplayName();
        return new RenderedMessage(m.getId(), m.getClientNonce(), ref, name, m.getContent(), false);
    }
}
