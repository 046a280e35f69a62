package com.teamchat.gateway.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.gateway.fanout.TopicBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 接收其他实例发布的事件，投递给本机订阅者。
 */
@Slf4j
@Component
public class ChatClusterListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final TopicBroadcaster broadcaster;
    private final ChatClusterBus clusterBus;

    public ChatClusterListener(ObjectMapper objectMapper, TopicBroadcaster broadcaster, ChatClusterBus clusterBus) {
        this.objectMapper = objectMapper;
        this.broadcaster = broadcaster;
        this.clusterBus = clusterBus;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        if (message == null || message.getBody() == null) {
            return;
        }
        ChatClusterMessage msg;
        try {
            msg = objectMapper.readValue(new String(message.getBody(), StandardCharsets.UTF_8), ChatClusterMessage.class);
        } catch (Exception e) {
            log.debug("cluster message parse failed: {}", e.toString());
            return;
        }
        if (msg == null || msg.topic() == null || msg.event() == null) {
            return;
        }
        if (clusterBus.origin().equals(msg.origin())) {
            return;
        }
        TopicKey topic;
        try {
            topic = TopicKey.of(msg.topic());
        } catch (IllegalArgumentException e) {
            log.debug("cluster message with bad topic dropped: topic={}", msg.topic());
            return;
        }
        try {
            broadcaster.deliverLocal(topic, msg.event());
        } catch (Exception e) {
            log.warn("cluster delivery failed: topic={}, origin={}, err={}", topic, msg.origin(), e.toString());
        }
    }
}
