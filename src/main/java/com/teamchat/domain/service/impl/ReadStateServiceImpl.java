package com.teamchat.domain.service.impl;

import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.ChannelNotFoundException;
import com.teamchat.common.error.TransientWrites;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ReadStateService;
import com.teamchat.domain.store.ChannelStore;
import com.teamchat.domain.store.MessageStore;
import com.teamchat.domain.store.ReadStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 已读游标：只推进、不回退（存储层按 seq 取 greatest，这里不做读-改-写）。
 *
 * <p>游标和未读数都按频道内 seq 计算。seq 与提交顺序一致，
 * 所以标记已读之后才提交的消息一定排在游标之后，会被计入未读。</p>
 */
@Slf4j
@Service
public class ReadStateServiceImpl implements ReadStateService {

    private final ReadStateStore readStateStore;
    private final MessageStore messageStore;
    private final ChannelStore channelStore;
    private final Clock clock;

    public ReadStateServiceImpl(ReadStateStore readStateStore,
                                MessageStore messageStore,
                                ChannelStore channelStore,
                                Clock clock) {
        this.readStateStore = readStateStore;
        this.messageStore = messageStore;
        this.channelStore = channelStore;
        this.clock = clock;
    }

    @Override
    public ReadMarker markRead(UserRef userRef, long channelId) {
        return markRead(userRef, channelId, null);
    }

    @Override
    public ReadMarker markRead(UserRef userRef, long channelId, Long upToMessageId) {
        requireAccessible(userRef, channelId);
        MessageEntity latest = messageStore.findLatest(channelId);
        if (latest == null) {
            return readStateStore.findLastRead(userRef, channelId);
        }
        ReadMarker target = resolveTarget(channelId, upToMessageId, latest);
        TransientWrites.run(() -> readStateStore.advance(userRef, channelId, target, LocalDateTime.now(clock)));
        ReadMarker after = readStateStore.findLastRead(userRef, channelId);
        log.debug("markRead: user={}, channelId={}, requested={}, marker={}", userRef, channelId, upToMessageId, after);
        return after;
    }

    @Override
    public Long lastReadMessageId(UserRef userRef, long channelId) {
        ReadMarker marker = readStateStore.findLastRead(userRef, channelId);
        return marker == null ? null : marker.messageId();
    }

    @Override
    public Map<Long, Long> lastReadMessageIds(UserRef userRef, Collection<Long> channelIds) {
        Map<Long, Long> out = new HashMap<>();
        readStateStore.findLastReadByChannels(userRef, channelIds)
                .forEach((channelId, marker) -> out.put(channelId, marker.messageId()));
        return out;
    }

    @Override
    public long unreadCount(UserRef userRef, long channelId) {
        return unreadCounts(userRef, List.of(channelId)).getOrDefault(channelId, 0L);
    }

    @Override
    public Map<Long, Long> unreadCounts(UserRef userRef, Collection<Long> channelIds) {
        Map<Long, Long> out = new HashMap<>();
        if (channelIds == null || channelIds.isEmpty()) {
            return out;
        }
        LinkedHashSet<Long> ids = new LinkedHashSet<>(channelIds);
        Map<Long, ReadMarker> markers = readStateStore.findLastReadByChannels(userRef, ids);
        Map<Long, Long> afterSeqs = new HashMap<>();
        for (Long id : ids) {
            ReadMarker marker = markers.get(id);
            afterSeqs.put(id, marker == null ? 0L : marker.seq());
            out.put(id, 0L);
        }
        out.putAll(messageStore.countAfter(afterSeqs, userRef));
        return out;
    }

    @Override
    public long totalUnread(UserRef userRef) {
        List<Long> ids = channelStore.listAccessible(userRef).stream().map(ChannelEntity::getId).toList();
        long total = 0;
        for (Long n : unreadCounts(userRef, ids).values()) {
            total += n;
        }
        return total;
    }

    /**
     * 未指定时读到最新一条；本频道找不到、但 id 不小于最新一条时按越界处理，截到最新一条；
     * 其余情况必须是本频道内的消息。
     */
    private ReadMarker resolveTarget(long channelId, Long upToMessageId, MessageEntity latest) {
        if (upToMessageId == null || upToMessageId <= 0) {
            return markerOf(latest);
        }
        MessageEntity m = messageStore.findById(upToMessageId);
        if (m != null && m.getChannelId() == channelId) {
            return markerOf(m);
        }
        if (upToMessageId >= latest.getId()) {
            return markerOf(latest);
        }
        throw new IllegalArgumentException("read_marker_not_in_channel");
    }

    private static ReadMarker markerOf(MessageEntity m) {
        return new ReadMarker(m.getSeq(), m.getId());
    }

    private void requireAccessible(UserRef userRef, long channelId) {
        ChannelEntity channel = channelStore.findById(channelId);
        if (channel == null) {
            throw new ChannelNotFoundException(channelId);
        }
        if (!channel.allows(userRef)) {
            throw new ChannelAccessDeniedException();
        }
    }
}
