package com.teamchat.client;

import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.model.TopicKey;

import java.util.function.Consumer;

/**
 * 推送事件来源（通常是 WS 连接）。listener 可能在任意线程被回调。
 */
public interface ChatEventSource {

    Subscription subscribe(TopicKey topic, Consumer<ChatEvent> listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
