package com.teamchat.domain.store;

import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;

/**
 * 已读游标存储接口。
 */
public interface ReadStateStore {

    /** 没有记录返回 null。 */
    ReadMarker findLastRead(UserRef userRef, long channelId);

    /** 只返回有记录的频道。 */
    Map<Long, ReadMarker> findLastReadByChannels(UserRef userRef, Collection<Long> channelIds);

    /**
     * 把游标推进到 marker；存储层按 seq 取 greatest，较早的游标不会覆盖较新的值。
     */
    void advance(UserRef userRef, long channelId, ReadMarker marker, LocalDateTime readAt);
}
