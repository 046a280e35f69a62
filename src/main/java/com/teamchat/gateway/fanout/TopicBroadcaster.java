package com.teamchat.gateway.fanout;

import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.gateway.cluster.ChatClusterBus;
import com.teamchat.gateway.session.TopicSubscriptionRegistry;
import com.teamchat.gateway.ws.WsEnvelope;
import com.teamchat.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 事件扩散：先投递本机订阅者，再经 Redis 发给其他实例（由各实例的 ChatClusterListener 投递各自的订阅者）。
 *
 * <p>除了订阅表本身，这里不持有状态。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopicBroadcaster implements ChatEventPublisher {

    private final TopicSubscriptionRegistry subscriptions;
    private final WsWriter wsWriter;
    private final ChatClusterBus clusterBus;

    @Override
    public void publish(TopicKey topic, ChatEventType eventType, ChatEvent payload) {
        if (topic == null || eventType == null || payload == null) {
            return;
        }
        payload.setEventType(eventType);
        try {
            deliverLocal(topic, payload);
        } catch (Exception e) {
            log.warn("local delivery failed: topic={}, type={}, err={}", topic, eventType, e.toString());
        }
        clusterBus.publish(topic, payload);
    }

    /**
     * 只投递本机订阅者。
     *
     * <p>CHANNEL_JOINED 发到个人 topic：先把该用户的本机连接订阅到新频道，再写事件，
     * 保证后续该频道的 MESSAGE_CREATED 不会漏给这些连接。</p>
     *
     * @return 实际写出的连接数
     */
    public int deliverLocal(TopicKey topic, ChatEvent event) {
        List<Channel> targets = subscriptions.subscribers(topic);
        if (targets.isEmpty()) {
            return 0;
        }
        if (event.getEventType() == ChatEventType.CHANNEL_JOINED && topic.isUserTopic() && event.getChannelId() != null) {
            TopicKey joined = TopicKey.forChannel(event.getChannelId());
            for (Channel ch : targets) {
                subscriptions.subscribe(ch, joined);
            }
        }
        String json = wsWriter.encode(WsEnvelope.event(topic.value(), event));
        int written = 0;
        for (Channel ch : targets) {
            if (ch == null || !ch.isActive()) {
                continue;
            }
            try {
                wsWriter.writeText(ch, json);
                written++;
            } catch (Exception e) {
                log.debug("ws write failed: topic={}, ch={}, err={}", topic, ch.id().asShortText(), e.toString());
            }
        }
        return written;
    }
}
