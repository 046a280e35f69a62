package com.teamchat.domain.store;

import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.model.UserRef;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 消息存储接口（只追加）。
 *
 * <p>频道内顺序由 seq 定义：seq 在写入时原子分配，连续且与提交顺序一致。
 * 因此“seq &gt; 某个已见过的 seq”的查询不会漏掉晚提交的消息。</p>
 */
public interface MessageStore {

    /**
     * 单条原子写入：分配频道内 seq（回填到 message）并插入。
     * id/createdAt 由调用方预先赋值。
     */
    void insert(MessageEntity message);

    MessageEntity findById(long messageId);

    List<MessageEntity> findByIds(Collection<Long> messageIds);

    /**
     * 游标读取。
     *
     * <ul>
     *   <li>afterSeq 非空：返回 seq &gt; afterSeq 的最早 limit 条（升序）</li>
     *   <li>否则：返回 seq &lt; beforeSeq（beforeSeq 为空表示从最新开始）的最新 limit 条（降序）</li>
     * </ul>
     */
    List<MessageEntity> listPage(long channelId, Long beforeSeq, Long afterSeq, int limit);

    /** 频道内 seq 最大的一条；没有消息返回 null。 */
    MessageEntity findLatest(long channelId);

    /** 每个频道的最新一条消息（没有消息的频道不出现在结果里）。 */
    Map<Long, MessageEntity> findLatestByChannels(Collection<Long> channelIds);

    /**
     * 批量计数：每个频道中 seq &gt; afterSeq 且发送者不是 excludeSender 的消息数。
     *
     * @param afterSeqByChannel channelId -&gt; 已读 seq（0 表示从头开始）
     * @return channelId -&gt; count，计数为 0 的频道可以缺省
     */
    Map<Long, Long> countAfter(Map<Long, Long> afterSeqByChannel, UserRef excludeSender);
}
