package com.teamchat.common.idempotency;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.idempotency.client-nonce")
public record ClientNonceProperties(
        Boolean enabled,
        Integer initialCapacity,
        Long maximumSize,
        Long expireAfterWriteSeconds
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public int initialCapacityEffective() {
        return initialCapacity == null ? 100 : Math.max(1, initialCapacity);
    }

    public long maximumSizeEffective() {
        return maximumSize == null ? 10_000 : Math.max(1, maximumSize);
    }

    public long expireAfterWriteSecondsEffective() {
        return expireAfterWriteSeconds == null ? 1800 : Math.max(1, expireAfterWriteSeconds);
    }
}
