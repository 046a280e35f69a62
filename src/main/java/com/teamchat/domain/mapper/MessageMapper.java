package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.ResultMap;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 每个频道 max(seq) 那一条；走 autoResultMap 以便 attachments 用 JSON typeHandler 反序列化。
     */
    @ResultMap("mybatis-plus_MessageEntity")
    @Select("""
            <script>
            select m.*
            from t_message m
            join (
              select channel_id, max(seq) as max_seq
              from t_message
              where channel_id in
              <foreach collection="channelIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
              group by channel_id
            ) x
              on m.channel_id = x.channel_id
             and m.seq = x.max_seq
            </script>
            """)
    List<MessageEntity> selectLatestByChannelIds(@Param("channelIds") Collection<Long> channelIds);

    /**
     * 批量未读数：afterSeqs 为 channelId -&gt; 已读 seq，自己发的消息不计入。
     */
    @Select("""
            <script>
            select m.channel_id as channelId, count(*) as unreadCount
            from t_message m
            where (
              <foreach collection="afterSeqs" index="cid" item="after" separator=" or ">
                (m.channel_id = #{cid} and m.seq &gt; #{after})
              </foreach>
            )
              and m.sender_ref != #{excludeSender}
            group by m.channel_id
            </script>
            """)
    List<Map<String, Object>> selectUnreadCounts(@Param("afterSeqs") Map<Long, Long> afterSeqs,
                                                 @Param("excludeSender") String excludeSender);
}
