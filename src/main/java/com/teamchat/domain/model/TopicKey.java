package com.teamchat.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 推送订阅 key。纯函数派生，服务端与客户端各自计算结果一致，不落库。
 */
public record TopicKey(String value) {

    private static final String CHANNEL_PREFIX = "chat.channel.";
    private static final String USER_PREFIX = "chat.user.";

    public TopicKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("topic_blank");
        }
    }

    @JsonCreator
    public static TopicKey of(String value) {
        return new TopicKey(value);
    }

    public static TopicKey forChannel(long channelId) {
        if (channelId <= 0) {
            throw new IllegalArgumentException("channel_id_invalid");
        }
        return new TopicKey(CHANNEL_PREFIX + channelId);
    }

    public static TopicKey forUser(UserRef userRef) {
        return new TopicKey(USER_PREFIX + userRef.value());
    }

    public boolean isChannelTopic() {
        return value.startsWith(CHANNEL_PREFIX);
    }

    public boolean isUserTopic() {
        return value.startsWith(USER_PREFIX);
    }

    /**
     * 频道 topic 反解出 channelId；非频道 topic 或格式不对返回 null。
     */
    public Long channelId() {
        if (!isChannelTopic()) {
            return null;
        }
        try {
            long id = Long.parseLong(value.substring(CHANNEL_PREFIX.length()));
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
