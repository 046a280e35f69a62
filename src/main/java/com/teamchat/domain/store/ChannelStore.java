package com.teamchat.domain.store;

import com.teamchat.common.error.ChannelRaceLostException;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.UserRef;

import java.util.List;

/**
 * 频道存储接口。
 *
 * <p>实现必须在存储层保证：同一规范参与者对最多一条私聊、同一公共名最多一条公共频道。
 * 多个服务进程可能同时处理对话双方的请求，所以这里不能依赖进程内锁。</p>
 */
public interface ChannelStore {

    ChannelEntity findById(long channelId);

    ChannelEntity findDirect(CanonicalPair pair);

    ChannelEntity findPublicByName(String publicName);

    /**
     * 插入新频道。
     *
     * @throws ChannelRaceLostException 唯一键冲突（另一个并发调用已经插入了同一对/同一名称）
     */
    void insert(ChannelEntity channel) throws ChannelRaceLostException;

    /** 全部公共频道 + 该用户参与的私聊。 */
    List<ChannelEntity> listAccessible(UserRef userRef);
}
