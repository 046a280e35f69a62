package com.teamchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.executors.notify")
public record ChatNotifyExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 2 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 4 : Math.max(1, maxPoolSize);
    }

    /** 通知丢了可以接受，队列不宜过长。 */
    public int queueCapacityEffective() {
        return queueCapacity == null ? 1_000 : Math.max(0, queueCapacity);
    }
}
