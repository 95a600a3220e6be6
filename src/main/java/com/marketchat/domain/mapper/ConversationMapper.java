package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.ConversationEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface ConversationMapper extends BaseMapper<ConversationEntity> {

    @Select("""
            select c.*
            from t_conversation c
            join t_conversation_member m on m.conversation_id = c.id
            where m.user_id = #{userId}
            order by ifnull(c.last_message_at, c.created_at) desc, c.id desc
            """)
    List<ConversationEntity> selectByUserId(@Param("userId") long userId);

    @Update("""
            update t_conversation
            set last_message_text = #{text},
                last_message_type = #{type},
                last_message_sender_id = #{senderId},
                last_message_at = #{at},
                updated_at = #{at}
            where id = #{conversationId}
            """)
    int updateLastMessage(@Param("conversationId") long conversationId,
                          @Param("text") String text,
                          @Param("type") Integer type,
                          @Param("senderId") long senderId,
                          @Param("at") LocalDateTime at);
}
