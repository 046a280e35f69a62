package com.teamchat.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.teamchat.domain.entity.ReadStateEntity;
import com.teamchat.domain.mapper.ReadStateMapper;
import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MybatisReadStateStore implements ReadStateStore {

    private final ReadStateMapper readStateMapper;

    @Override
    public ReadMarker findLastRead(UserRef userRef, long channelId) {
        ReadStateEntity row = readStateMapper.selectOne(new LambdaQueryWrapper<ReadStateEntity>()
                .eq(ReadStateEntity::getUserRef, userRef.value())
                .eq(ReadStateEntity::getChannelId, channelId)
                .last("limit 1"));
        return toMarker(row);
    }

    @Override
    public Map<Long, ReadMarker> findLastReadByChannels(UserRef userRef, Collection<Long> channelIds) {
        Map<Long, ReadMarker> out = new HashMap<>();
        if (channelIds == null || channelIds.isEmpty()) {
            return out;
        }
        for (ReadStateEntity row : readStateMapper.selectList(new LambdaQueryWrapper<ReadStateEntity>()
                .eq(ReadStateEntity::getUserRef, userRef.value())
                .in(ReadStateEntity::getChannelId, channelIds))) {
            ReadMarker marker = toMarker(row);
            if (marker != null) {
                out.put(row.getChannelId(), marker);
            }
        }
        return out;
    }

    @Override
    public void advance(UserRef userRef, long channelId, ReadMarker marker, LocalDateTime readAt) {
        readStateMapper.advance(IdWorker.getId(), userRef.value(), channelId,
                marker.seq(), marker.messageId(), readAt);
    }

    private static ReadMarker toMarker(ReadStateEntity row) {
        if (row == null || row.getLastReadSeq() == null || row.getLastReadSeq() <= 0) {
            return null;
        }
        return new ReadMarker(row.getLastReadSeq(), row.getLastReadMsgId() == null ? 0L : row.getLastReadMsgId());
    }
}
