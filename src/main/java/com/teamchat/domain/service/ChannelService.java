package com.teamchat.domain.service;

import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.ChannelNotFoundException;
import com.teamchat.common.error.InvalidChannelRequestException;
import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;

import java.util.List;

/**
 * 频道注册表。
 */
public interface ChannelService {

    /**
     * 私聊查找或创建的结果；created 表示本次调用插入了新行。
     */
    record DirectChannel(ChannelEntity channel, boolean created) {
    }

    /**
     * 对任意顺序的 (a, b) 返回同一个频道；并发首次联系时也只会有一条。
     *
     * @throws InvalidChannelRequestException a 与 b 相同
     */
    DirectChannel findOrCreateDirect(UserRef a, UserRef b);

    default long findOrCreateDirectChannel(UserRef a, UserRef b) {
        return findOrCreateDirect(a, b).channel().getId();
    }

    /** 只查不建；不存在返回 null。 */
    ChannelEntity findDirectChannel(UserRef a, UserRef b);

    /** 按公共名幂等创建。 */
    ChannelEntity provisionPublicChannel(String name, UserRef createdBy);

    /**
     * @throws ChannelNotFoundException 频道不存在
     */
    ChannelEntity requireChannel(long channelId);

    boolean canAccess(UserRef userRef, ChannelEntity channel);

    /**
     * requireChannel + canAccess。
     *
     * @throws ChannelAccessDeniedException 无权访问
     */
    ChannelEntity requireAccessible(UserRef userRef, long channelId);

    List<ChannelEntity> listAccessible(UserRef userRef);

    /**
     * 频道列表：带未读数、最后一条消息、私聊对端；按最近活跃排序。
     */
    List<ChannelView> listChannelsFor(UserRef userRef);

    ChannelView toView(UserRef viewer, ChannelEntity channel);

    default TopicKey resolveTopicFor(ChannelEntity channel) {
        return TopicKey.forChannel(channel.getId());
    }
}
