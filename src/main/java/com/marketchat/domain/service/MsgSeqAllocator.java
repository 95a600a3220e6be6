package com.marketchat.domain.service;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * 会话内 msg_seq 分配器（并发安全）。
 *
 * <p>MySQL LAST_INSERT_ID 技巧：同一连接内 UPDATE 并取回递增后的值。在事务内调用时顺带锁住会话行，
 * 同一会话的 submit 因此按分配顺序串行提交。</p>
 */
@Component
public class MsgSeqAllocator {

    private static final String UPDATE_SQL =
            "update t_conversation set next_msg_seq = LAST_INSERT_ID(next_msg_seq + 1) where id = ?";
    private static final String SELECT_SQL = "select LAST_INSERT_ID()";

    private final JdbcTemplate jdbcTemplate;

    public MsgSeqAllocator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return 新序号；会话不存在时返回 0
     */
    public long allocateNextSeq(long conversationId) {
        if (conversationId <= 0) {
            throw new IllegalArgumentException("conversationId must be positive");
        }

        // UPDATE 与 SELECT 必须在同一连接上执行
        Long out = jdbcTemplate.execute(UPDATE_SQL, (PreparedStatementCallback<Long>) ps -> {
            ps.setLong(1, conversationId);
            int updated = ps.executeUpdate();
            if (updated <= 0) {
                return 0L;
            }
            try (PreparedStatement s = ps.getConnection().prepareStatement(SELECT_SQL);
                 ResultSet rs = s.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("allocate msg_seq failed: empty result");
                }
                return rs.getLong(1);
            }
        });
        return out == null ? 0L : out;
    }
}
