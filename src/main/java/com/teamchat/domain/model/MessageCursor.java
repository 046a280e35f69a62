package com.teamchat.domain.model;

/**
 * 历史消息游标：beforeId 向前翻页，afterId 断线重连后补齐；两者同时给出时以 afterId 为准。
 */
public record MessageCursor(Long beforeId, Long afterId, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public MessageCursor {
        if (beforeId != null && beforeId <= 0) {
            beforeId = null;
        }
        if (afterId != null && afterId < 0) {
            afterId = null;
        }
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static MessageCursor latest() {
        return new MessageCursor(null, null, DEFAULT_LIMIT);
    }

    public static MessageCursor of(Long beforeId, Long afterId, Integer limit) {
        return new MessageCursor(beforeId, afterId, limit == null ? DEFAULT_LIMIT : limit);
    }

    public boolean isCatchUp() {
        return afterId != null;
    }
}
