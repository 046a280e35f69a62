package com.teamchat.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.teamchat.common.error.ChannelRaceLostException;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.mapper.ChannelMapper;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.UserRef;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 唯一性由表上的 uk_channel_dm / uk_channel_public_name 保证，这里只负责把冲突翻译成 {@link ChannelRaceLostException}。
 */
@Component
@RequiredArgsConstructor
public class MybatisChannelStore implements ChannelStore {

    private final ChannelMapper channelMapper;

    @Override
    public ChannelEntity findById(long channelId) {
        return channelId <= 0 ? null : channelMapper.selectById(channelId);
    }

    @Override
    public ChannelEntity findDirect(CanonicalPair pair) {
        return channelMapper.selectOne(new LambdaQueryWrapper<ChannelEntity>()
                .eq(ChannelEntity::getType, ChannelType.DM)
                .eq(ChannelEntity::getDmUserLow, pair.low().value())
                .eq(ChannelEntity::getDmUserHigh, pair.high().value())
                .last("limit 1"));
    }

    @Override
    public ChannelEntity findPublicByName(String publicName) {
        return channelMapper.selectOne(new LambdaQueryWrapper<ChannelEntity>()
                .eq(ChannelEntity::getType, ChannelType.PUBLIC)
                .eq(ChannelEntity::getPublicName, publicName)
                .last("limit 1"));
    }

    @Override
    public void insert(ChannelEntity channel) {
        try {
            channelMapper.insert(channel);
        } catch (DuplicateKeyException e) {
            String key = channel.isDirect() ? channel.getName() : channel.getPublicName();
            throw new ChannelRaceLostException(key, e);
        }
    }

    @Override
    public List<ChannelEntity> listAccessible(UserRef userRef) {
        String ref = userRef.value();
        return channelMapper.selectList(new LambdaQueryWrapper<ChannelEntity>()
                .eq(ChannelEntity::getType, ChannelType.PUBLIC)
                .or(w -> w.eq(ChannelEntity::getType, ChannelType.DM)
                        .and(x -> x.eq(ChannelEntity::getDmUserLow, ref).or().eq(ChannelEntity::getDmUserHigh, ref)))
                .orderByAsc(ChannelEntity::getId));
    }
}
