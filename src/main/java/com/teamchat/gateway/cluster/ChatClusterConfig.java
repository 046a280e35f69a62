package com.teamchat.gateway.cluster;

import com.teamchat.gateway.config.FanoutProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.backoff.FixedBackOff;

@Configuration
@ConditionalOnProperty(name = "chat.fanout.cluster-enabled", havingValue = "true", matchIfMissing = true)
public class ChatClusterConfig {

    @Bean
    public RedisMessageListenerContainer chatClusterListenerContainer(RedisConnectionFactory connectionFactory,
                                                                      ChatClusterListener listener,
                                                                      FanoutProperties fanoutProps) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer() {
            @Override
            public boolean isAutoStartup() {
                return false;
            }
        };
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listener, new ChannelTopic(fanoutProps.redisChannelEffective()));
        container.setRecoveryBackoff(new FixedBackOff(1000, FixedBackOff.UNLIMITED_ATTEMPTS));
        return container;
    }

    @Bean
    public ChatClusterListenerStarter chatClusterListenerStarter(RedisMessageListenerContainer chatClusterListenerContainer) {
        return new ChatClusterListenerStarter(chatClusterListenerContainer);
    }
}
