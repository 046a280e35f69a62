package com.teamchat.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.mapper.MessageMapper;
import com.teamchat.domain.model.UserRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MybatisMessageStore implements MessageStore {

    private final MessageMapper messageMapper;
    private final ChannelSeqAllocator channelSeqAllocator;

    /**
     * seq 分配与插入同一事务：频道行锁持有到提交，seq 顺序即提交顺序。
     */
    @Override
    @Transactional
    public void insert(MessageEntity message) {
        message.setSeq(channelSeqAllocator.next(message.getChannelId()));
        messageMapper.insert(message);
    }

    @Override
    public MessageEntity findById(long messageId) {
        return messageMapper.selectById(messageId);
    }

    @Override
    public List<MessageEntity> findByIds(Collection<Long> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            return List.of();
        }
        return messageMapper.selectBatchIds(messageIds);
    }

    @Override
    public List<MessageEntity> listPage(long channelId, Long beforeSeq, Long afterSeq, int limit) {
        LambdaQueryWrapper<MessageEntity> q = new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getChannelId, channelId);
        if (afterSeq != null) {
            q.gt(MessageEntity::getSeq, afterSeq).orderByAsc(MessageEntity::getSeq);
        } else {
            q.lt(beforeSeq != null, MessageEntity::getSeq, beforeSeq).orderByDesc(MessageEntity::getSeq);
        }
        q.last("limit " + limit);
        return messageMapper.selectList(q);
    }

    @Override
    public MessageEntity findLatest(long channelId) {
        return messageMapper.selectOne(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getChannelId, channelId)
                .orderByDesc(MessageEntity::getSeq)
                .last("limit 1"));
    }

    @Override
    public Map<Long, MessageEntity> findLatestByChannels(Collection<Long> channelIds) {
        Map<Long, MessageEntity> out = new HashMap<>();
        if (channelIds == null || channelIds.isEmpty()) {
            return out;
        }
        for (MessageEntity m : messageMapper.selectLatestByChannelIds(channelIds)) {
            out.put(m.getChannelId(), m);
        }
        return out;
    }

    @Override
    public Map<Long, Long> countAfter(Map<Long, Long> afterSeqByChannel, UserRef excludeSender) {
        Map<Long, Long> out = new HashMap<>();
        if (afterSeqByChannel == null || afterSeqByChannel.isEmpty()) {
            return out;
        }
        List<Map<String, Object>> rows = messageMapper.selectUnreadCounts(afterSeqByChannel, excludeSender.value());
        for (Map<String, Object> row : rows) {
            Long channelId = toLong(row.get("channelId"));
            Long count = toLong(row.get("unreadCount"));
            if (channelId != null && count != null) {
                out.put(channelId, count);
            }
        }
        return out;
    }

    private static Long toLong(Object v) {
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v == null) {
            return null;
        }
        try {
            return Long.parseLong(v.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
