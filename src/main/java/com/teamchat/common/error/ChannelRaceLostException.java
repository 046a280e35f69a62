package com.teamchat.common.error;

/**
 * 并发创建频道时输掉了唯一键竞争。
 *
 * <p>仅在存储层与频道服务之间传递：正确的处理是重新读取胜出的那一行，绝不暴露给调用方。</p>
 */
public class ChannelRaceLostException extends RuntimeException {

    public ChannelRaceLostException(String key, Throwable cause) {
        super("channel_race_lost: " + key, cause);
    }
}
