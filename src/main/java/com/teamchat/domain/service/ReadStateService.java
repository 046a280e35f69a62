package com.teamchat.domain.service;

import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;

import java.util.Collection;
import java.util.Map;

/**
 * 已读状态。游标按频道内 seq 只增不减；未读数不计自己发的消息。
 */
public interface ReadStateService {

    /**
     * 读到频道最新一条。
     *
     * @return 调用后的游标；频道没有消息时为 null
     */
    ReadMarker markRead(UserRef userRef, long channelId);

    /**
     * 读到指定消息（超过最新一条时按最新一条处理）；比现有游标早的请求不生效。
     *
     * @return 调用后的游标（可能就是原来的值）
     * @throws IllegalArgumentException upToMessageId 不在该频道内且不是越界值
     */
    ReadMarker markRead(UserRef userRef, long channelId, Long upToMessageId);

    Long lastReadMessageId(UserRef userRef, long channelId);

    Map<Long, Long> lastReadMessageIds(UserRef userRef, Collection<Long> channelIds);

    long unreadCount(UserRef userRef, long channelId);

    /** 结果包含每一个入参频道（无未读为 0）。 */
    Map<Long, Long> unreadCounts(UserRef userRef, Collection<Long> channelIds);

    /** 用户可访问的所有频道未读合计。 */
    long totalUnread(UserRef userRef);
}
