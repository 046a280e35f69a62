package com.teamchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 会话引导/订阅校验等需要查库的任务，不能跑在 Netty eventLoop 上。
 */
@ConfigurationProperties(prefix = "chat.executors.db")
public record ChatDbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }
}
