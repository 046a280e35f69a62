package com.teamchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 跨实例事件扩散（Redis Pub/Sub）。
 *
 * @param clusterEnabled 单实例部署可以关掉，只做本机投递
 * @param redisChannel   所有实例共用的一个 Pub/Sub channel
 */
@ConfigurationProperties(prefix = "chat.fanout")
public record FanoutProperties(
        Boolean clusterEnabled,
        String redisChannel
) {

    public static final String DEFAULT_REDIS_CHANNEL = "chat:fanout";

    public boolean clusterEnabledEffective() {
        return clusterEnabled == null || clusterEnabled;
    }

    public String redisChannelEffective() {
        return redisChannel == null || redisChannel.isBlank() ? DEFAULT_REDIS_CHANNEL : redisChannel;
    }
}
