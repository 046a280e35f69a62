package com.teamchat.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 身份提供方签发的 accessToken 校验参数（HMAC 共享密钥 + issuer）。
 *
 * @param accessTokenTtlSeconds 仅供测试/工具签发 token 时使用
 */
@ConfigurationProperties(prefix = "chat.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {

    public long accessTokenTtlSecondsEffective() {
        return accessTokenTtlSeconds <= 0 ? 3600 : accessTokenTtlSeconds;
    }
}
