package com.teamchat.gateway.fanout;

import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.TopicKey;

/**
 * 服务端事件发布入口：只在对应写操作成功之后调用。
 *
 * <p>实现不得抛出到调用方；投递失败只记日志，客户端靠重连补齐。</p>
 */
public interface ChatEventPublisher {

    void publish(TopicKey topic, ChatEventType eventType, ChatEvent payload);
}
