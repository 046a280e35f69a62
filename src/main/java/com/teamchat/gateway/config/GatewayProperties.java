package com.teamchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param instanceId 实例标识（Redis 路由值、跨实例事件的 origin）；为空时用 host:port
 */
@ConfigurationProperties(prefix = "chat.gateway.ws")
public record GatewayProperties(
        Boolean enabled,
        String host,
        int port,
        String path,
        String instanceId
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public String pathEffective() {
        return path == null || path.isBlank() ? "/ws" : path;
    }

    public String instanceIdEffective() {
        if (instanceId != null && !instanceId.isBlank()) {
            return instanceId.trim();
        }
        return host + ":" + port;
    }
}
