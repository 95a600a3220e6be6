package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.ConversationMemberEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface ConversationMemberMapper extends BaseMapper<ConversationMemberEntity> {

    @Select("""
            select user_id
            from t_conversation_member
            where conversation_id = #{conversationId}
            order by user_id asc
            """)
    List<Long> selectUserIds(@Param("conversationId") long conversationId);

    @Select("""
            select count(1)
            from t_conversation_member
            where conversation_id = #{conversationId} and user_id = #{userId}
            """)
    int countMember(@Param("conversationId") long conversationId, @Param("userId") long userId);

    @Select("""
            select conversation_id
            from t_conversation_member
            where user_id = #{userId}
            """)
    List<Long> selectConversationIds(@Param("userId") long userId);

    /**
     * 与 userId 共享任意会话的其它用户（去重）。
     */
    @Select("""
            select distinct peer.user_id
            from t_conversation_member me
            join t_conversation_member peer
              on peer.conversation_id = me.conversation_id
             and peer.user_id != me.user_id
            where me.user_id = #{userId}
            """)
    List<Long> selectPeerIds(@Param("userId") long userId);

    @Select("""
            <script>
            select *
            from t_conversation_member
            where conversation_id in
            <foreach collection="conversationIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<ConversationMemberEntity> selectByConversationIds(@Param("conversationIds") List<Long> conversationIds);

    /**
     * 给一批接收方未读数 +1。
     */
    @Update("""
            <script>
            update t_conversation_member
            set unread_count = ifnull(unread_count, 0) + 1
            where conversation_id = #{conversationId}
              and user_id in
            <foreach collection="userIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    int incrementUnread(@Param("conversationId") long conversationId, @Param("userIds") List<Long> userIds);

    @Update("""
            update t_conversation_member
            set unread_count = 0,
                last_read_at = #{now}
            where conversation_id = #{conversationId} and user_id = #{userId}
            """)
    int resetUnread(@Param("conversationId") long conversationId, @Param("userId") long userId, @Param("now") LocalDateTime now);

    /**
     * 读当前未读数并对行加锁，markRead 用它判断“是否有变化”。
     */
    @Select("""
            select unread_count
            from t_conversation_member
            where conversation_id = #{conversationId} and user_id = #{userId}
            for update
            """)
    Integer selectUnreadForUpdate(@Param("conversationId") long conversationId, @Param("userId") long userId);
}
