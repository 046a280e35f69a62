package com.teamchat.gateway.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import com.teamchat.gateway.config.FanoutProperties;
import com.teamchat.gateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatClusterBusTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final GatewayProperties gateway = new GatewayProperties(true, "10.0.0.5", 9001, "/ws", null);

    @Test
    void publish_sendsEnvelopeWithOriginOnSharedChannel() throws Exception {
        ChatClusterBus bus = new ChatClusterBus(redis, objectMapper, new FanoutProperties(true, null), gateway);

        bus.publish(TopicKey.forChannel(8L), ChatEvent.typing(8L, UserRef.of("u1"), true, 123L));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redis).convertAndSend(eq(FanoutProperties.DEFAULT_REDIS_CHANNEL), json.capture());
        JsonNode node = objectMapper.readTree(json.getValue());
        assertThat(node.get("origin").asText()).isEqualTo("10.0.0.5:9001");
        assertThat(node.get("topic").asText()).isEqualTo("chat.channel.8");
        assertThat(node.at("/event/actorRef").asText()).isEqualTo("u1");
    }

    @Test
    void publish_redisFailure_failsFastAfterwards() {
        when(redis.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("refused"));
        ChatClusterBus bus = new ChatClusterBus(redis, objectMapper, new FanoutProperties(true, "team:fanout"), gateway);

        bus.publish(TopicKey.forChannel(1L), ChatEvent.typing(1L, UserRef.of("u1"), true, 1L));
        bus.publish(TopicKey.forChannel(1L), ChatEvent.typing(1L, UserRef.of("u1"), false, 2L));

        verify(redis, times(1)).convertAndSend(eq("team:fanout"), anyString());
        assertThat(bus.isFailingFast()).isTrue();
    }

    @Test
    void publish_clusterDisabled_isLocalOnly() {
        ChatClusterBus bus = new ChatClusterBus(redis, objectMapper, new FanoutProperties(false, null), gateway);

        bus.publish(TopicKey.forChannel(1L), ChatEvent.typing(1L, UserRef.of("u1"), true, 1L));

        verifyNoInteractions(redis);
    }
}
