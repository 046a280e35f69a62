package com.teamchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * 消息核心的业务配置。
 *
 * @param publicChannels 启动时确保存在的公共频道名
 */
@ConfigurationProperties(prefix = "chat")
public record ChatProperties(
        List<String> publicChannels
) {

    public List<String> publicChannelsEffective() {
        if (publicChannels == null) {
            return List.of("general", "repairs");
        }
        return publicChannels.stream()
                .filter(n -> n != null && !n.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}
