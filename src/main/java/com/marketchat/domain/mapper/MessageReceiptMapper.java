package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.MessageReceiptEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageReceiptMapper extends BaseMapper<MessageReceiptEntity> {

    @Select("""
            select *
            from t_message_receipt
            where message_id = #{messageId}
            """)
    List<MessageReceiptEntity> selectByMessageId(@Param("messageId") long messageId);

    @Select("""
            select *
            from t_message_receipt
            where message_id = #{messageId} and user_id = #{userId}
            limit 1
            """)
    MessageReceiptEntity selectByMessageAndUser(@Param("messageId") long messageId, @Param("userId") long userId);

    /**
     * sent -> delivered；已 delivered/read 的行不受影响（返回 0）。
     */
    @Update("""
            update t_message_receipt
            set status = greatest(status, 1),
                updated_at = #{now}
            where message_id = #{messageId} and user_id = #{userId} and status < 1
            """)
    int markDelivered(@Param("messageId") long messageId, @Param("userId") long userId, @Param("now") LocalDateTime now);

    /**
     * 某接收方在会话里尚未 read 的回执（行锁，随后整体置 read）。
     */
    @Select("""
            select *
            from t_message_receipt
            where conversation_id = #{conversationId} and user_id = #{userId} and status < 2
            order by message_id asc
            for update
            """)
    List<MessageReceiptEntity> selectUnreadForUpdate(@Param("conversationId") long conversationId, @Param("userId") long userId);

    @Update("""
            update t_message_receipt
            set status = 2,
                updated_at = #{now}
            where conversation_id = #{conversationId} and user_id = #{userId} and status < 2
            """)
    int markAllRead(@Param("conversationId") long conversationId, @Param("userId") long userId, @Param("now") LocalDateTime now);

    /**
     * 该用户还有 sent 回执的会话。
     */
    @Select("""
            select distinct conversation_id
            from t_message_receipt
            where user_id = #{userId} and status = 0
            """)
    List<Long> selectPendingConversationIds(@Param("userId") long userId);

    /**
     * 会话内该用户的 sent 回执（行锁，与 markRead 的 selectUnreadForUpdate 互斥）。
     */
    @Select("""
            select *
            from t_message_receipt
            where conversation_id = #{conversationId} and user_id = #{userId} and status = 0
            order by message_id asc
            limit #{limit}
            for update
            """)
    List<MessageReceiptEntity> selectPendingForUpdate(@Param("conversationId") long conversationId,
                                                      @Param("userId") long userId,
                                                      @Param("limit") int limit);

    @Select("""
            <script>
            select *
            from t_message_receipt
            where user_id = #{userId}
              and status = 1
              and id in
            <foreach collection="ids" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<MessageReceiptEntity> selectDeliveredByIds(@Param("userId") long userId, @Param("ids") List<Long> ids);

    @Update("""
            <script>
            update t_message_receipt
            set status = greatest(status, 1),
                updated_at = #{now}
            where user_id = #{userId}
              and status = 0
              and id in
            <foreach collection="ids" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    int markDeliveredByIds(@Param("userId") long userId, @Param("ids") List<Long> ids, @Param("now") LocalDateTime now);
}
