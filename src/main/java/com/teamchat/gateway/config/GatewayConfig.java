package com.teamchat.gateway.config;

import com.teamchat.gateway.fanout.LoggingOfflineNotifier;
import com.teamchat.gateway.fanout.OfflineNotifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({GatewayProperties.class, FanoutProperties.class})
public class GatewayConfig {

    /**
     * 默认只打日志；接入邮件/推送时提供自己的 OfflineNotifier bean 即可替换。
     */
    @Bean
    @ConditionalOnMissingBean(OfflineNotifier.class)
    public OfflineNotifier offlineNotifier() {
        return new LoggingOfflineNotifier();
    }
}
