package com.teamchat.config;

import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.service.ChannelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时按配置幂等创建公共频道；多实例同时启动也只会有一份（唯一键 + 冲突重读）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublicChannelProvisioner implements ApplicationRunner {

    private final ChatProperties chatProperties;
    private final ChannelService channelService;

    @Override
    public void run(ApplicationArguments args) {
        for (String name : chatProperties.publicChannelsEffective()) {
            try {
                ChannelEntity channel = channelService.provisionPublicChannel(name, null);
                log.info("public channel ready: name={}, id={}", name, channel.getId());
            } catch (RuntimeException e) {
                // 存储暂不可用时不阻断启动
                log.warn("public channel provisioning failed: name={}, err={}", name, e.toString());
            }
        }
    }
}
