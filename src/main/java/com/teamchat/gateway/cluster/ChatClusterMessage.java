package com.teamchat.gateway.cluster;

import com.teamchat.domain.dto.ChatEvent;

/**
 * 跨实例事件：origin 为发布实例，接收方据此跳过自己发出的消息（本机已经投递过）。
 */
public record ChatClusterMessage(
        String origin,
        String topic,
        ChatEvent event,
        Long ts
) {
}
