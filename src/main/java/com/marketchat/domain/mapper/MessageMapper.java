package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    @Select("""
            select *
            from t_message
            where sender_id = #{senderId} and client_msg_id = #{clientMsgId}
            limit 1
            """)
    MessageEntity selectBySenderAndClientMsgId(@Param("senderId") long senderId, @Param("clientMsgId") String clientMsgId);

    /**
     * 刷新汇总状态：取该消息所有回执中的最小值，且只升不降。
     */
    @Update("""
            <script>
            update t_message m
            set m.status = greatest(m.status, ifnull(
                  (select min(r.status) from t_message_receipt r where r.message_id = m.id), m.status))
            where m.id in
            <foreach collection="messageIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    int refreshAggregateStatus(@Param("messageIds") List<Long> messageIds);
}
