package com.teamchat.domain.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * 频道内 seq 分配器。
 *
 * <p>使用 MySQL 的 LAST_INSERT_ID 技巧：在同一连接内 UPDATE 并取回本次递增后的值。
 * 必须在写消息的事务里调用：UPDATE 持有的 t_channel 行锁要到提交才释放，
 * 同一频道的下一次分配会等前一条消息提交（或回滚，计数器随之回滚），
 * 所以 seq 既连续，又与提交顺序一致。</p>
 */
@Component
public class ChannelSeqAllocator {

    private static final String UPDATE_SQL =
            "update t_channel set next_msg_seq = LAST_INSERT_ID(next_msg_seq + 1) where id = ?";
    private static final String SELECT_SQL = "select LAST_INSERT_ID()";

    private final JdbcTemplate jdbcTemplate;

    public ChannelSeqAllocator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long next(long channelId) {
        if (channelId <= 0) {
            throw new IllegalArgumentException("channelId must be positive");
        }
        // UPDATE 与 SELECT 必须在同一连接上执行
        Long out = jdbcTemplate.execute(UPDATE_SQL, (PreparedStatementCallback<Long>) ps -> {
            ps.setLong(1, channelId);
            if (ps.executeUpdate() <= 0) {
                throw new IllegalStateException("allocate seq failed: channel " + channelId + " not found");
            }
            try (PreparedStatement s = ps.getConnection().prepareStatement(SELECT_SQL);
                 ResultSet rs = s.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("allocate seq failed: empty result");
                }
                return rs.getLong(1);
            }
        });
        if (out == null || out <= 0) {
            throw new IllegalStateException("allocate seq failed: channel " + channelId);
        }
        return out;
    }
}
