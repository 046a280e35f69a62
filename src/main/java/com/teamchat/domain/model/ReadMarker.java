package com.teamchat.domain.model;

/**
 * 已读游标：seq 用于比较与计数，messageId 是对外展示的那条消息。
 */
public record ReadMarker(long seq, long messageId) {
}
