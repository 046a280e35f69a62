package com.teamchat.gateway.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.gateway.config.FanoutProperties;
import com.teamchat.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class ChatClusterBus {

    /**
     * Redis 故障时 fail-fast：避免每次发布都阻塞在 Redis 超时上。
     */
    static final long REDIS_FAIL_FAST_MS = 10_000;

    private final AtomicLong redisUnavailableUntilMs = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final FanoutProperties fanoutProps;
    private final String origin;

    public ChatClusterBus(StringRedisTemplate redis,
                          ObjectMapper objectMapper,
                          FanoutProperties fanoutProps,
                          GatewayProperties gatewayProps) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.fanoutProps = fanoutProps;
        this.origin = gatewayProps.instanceIdEffective();
    }

    public void publish(TopicKey topic, ChatEvent event) {
        if (topic == null || event == null || !fanoutProps.clusterEnabledEffective()) {
            return;
        }
        if (System.currentTimeMillis() < redisUnavailableUntilMs.get()) {
            log.debug("cluster publish skipped (redis fail-fast): topic={}", topic);
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(
                    new ChatClusterMessage(origin, topic.value(), event, System.currentTimeMillis()));
            redis.convertAndSend(fanoutProps.redisChannelEffective(), json);
        } catch (Exception e) {
            log.warn("cluster publish failed: topic={}, type={}, err={}", topic, event.getEventType(), e.toString());
            markRedisDown();
        }
    }

    public String origin() {
        return origin;
    }

    boolean isFailingFast() {
        return System.currentTimeMillis() < redisUnavailableUntilMs.get();
    }

    private void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        redisUnavailableUntilMs.accumulateAndGet(until, Math::max);
    }
}
