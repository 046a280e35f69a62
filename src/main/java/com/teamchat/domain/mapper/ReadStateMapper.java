package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.ReadStateEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

public interface ReadStateMapper extends BaseMapper<ReadStateEntity> {

    /**
     * 已读游标推进（单调，按 seq 比较）：并发的旧请求不会把游标拉回去。
     *
     * <p>last_read_at / last_read_msg_id 必须先于 last_read_seq 计算，MySQL 按赋值顺序求值，
     * 它们依赖的是更新前的 last_read_seq。</p>
     */
    @Insert("""
            insert into t_read_state(id, user_ref, channel_id, last_read_seq, last_read_msg_id, last_read_at, created_at, updated_at)
            values (#{id}, #{userRef}, #{channelId}, #{seq}, #{msgId}, #{readAt}, now(3), now(3))
            on duplicate key update
              last_read_at = if(values(last_read_seq) > last_read_seq, values(last_read_at), last_read_at),
              last_read_msg_id = if(values(last_read_seq) > last_read_seq, values(last_read_msg_id), last_read_msg_id),
              last_read_seq = greatest(last_read_seq, values(last_read_seq)),
              updated_at = now(3)
            """)
    int advance(@Param("id") long id,
                @Param("userRef") String userRef,
                @Param("channelId") long channelId,
                @Param("seq") long seq,
                @Param("msgId") long msgId,
                @Param("readAt") LocalDateTime readAt);
}
