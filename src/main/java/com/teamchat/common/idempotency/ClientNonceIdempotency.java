package com.teamchat.common.idempotency;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.teamchat.domain.model.UserRef;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 发送幂等：(senderRef, clientNonce) -&gt; 已分配的消息 id。
 *
 * <p>客户端超时重试时带同一个 nonce，第二次直接返回第一次的消息，不会重复落库。
 * 只在本实例内有效；跨实例的重试仍可能产生重复，客户端按 clientNonce 去重兜底。</p>
 */
@Component
@EnableConfigurationProperties(ClientNonceProperties.class)
public class ClientNonceIdempotency {

    private final ClientNonceProperties props;
    private final Cache<String, Long> cache;

    public ClientNonceIdempotency(ClientNonceProperties props) {
        this.props = props;
        this.cache = Caffeine.newBuilder()
                .initialCapacity(props.initialCapacityEffective())
                .maximumSize(props.maximumSizeEffective())
                .expireAfterWrite(Duration.ofSeconds(props.expireAfterWriteSecondsEffective()))
                .build();
    }

    public boolean enabled() {
        return props.enabledEffective();
    }

    public String key(UserRef sender, String clientNonce) {
        return sender.value() + "|" + clientNonce;
    }

    public Long get(String key) {
        return cache.getIfPresent(key);
    }

    /**
     * @return 已存在的消息 id；null 表示本次占位成功
     */
    public Long claim(String key, long messageId) {
        return cache.asMap().putIfAbsent(key, messageId);
    }

    /** 落库失败时释放占位，允许客户端重试。 */
    public void release(String key, long messageId) {
        cache.asMap().remove(key, messageId);
    }
}
