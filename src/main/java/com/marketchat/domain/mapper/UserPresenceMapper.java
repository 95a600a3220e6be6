package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.UserPresenceEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface UserPresenceMapper extends BaseMapper<UserPresenceEntity> {

    @Insert("""
            insert into t_user_presence (user_id, online, last_seen, connection_id, updated_at)
            values (#{userId}, 1, #{now}, #{connectionId}, #{now})
            on duplicate key update
              online = 1,
              last_seen = values(last_seen),
              connection_id = values(connection_id),
              updated_at = values(updated_at)
            """)
    int upsertOnline(@Param("userId") long userId, @Param("connectionId") String connectionId, @Param("now") LocalDateTime now);

    @Insert("""
            insert into t_user_presence (user_id, online, last_seen, connection_id, updated_at)
            values (#{userId}, 0, #{now}, null, #{now})
            on duplicate key update
              online = 0,
              last_seen = values(last_seen),
              connection_id = null,
              updated_at = values(updated_at)
            """)
    int upsertOffline(@Param("userId") long userId, @Param("now") LocalDateTime now);

    /**
     * 心跳：刷新 last_seen/connection_id，已有记录的 online 不变；首次出现按在线插入。
     */
    @Insert("""
            insert into t_user_presence (user_id, online, last_seen, connection_id, updated_at)
            values (#{userId}, 1, #{now}, #{connectionId}, #{now})
            on duplicate key update
              last_seen = values(last_seen),
              connection_id = if(online = 1, values(connection_id), connection_id),
              updated_at = values(updated_at)
            """)
    int upsertHeartbeat(@Param("userId") long userId, @Param("connectionId") String connectionId, @Param("now") LocalDateTime now);

    @Select("""
            <script>
            select *
            from t_user_presence
            where user_id in
            <foreach collection="userIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<UserPresenceEntity> selectByUserIds(@Param("userIds") List<Long> userIds);

    @Select("""
            select *
            from t_user_presence
            where online = 1
              and last_seen < #{before}
            order by last_seen asc
            limit #{limit}
            """)
    List<UserPresenceEntity> selectStaleOnline(@Param("before") LocalDateTime before, @Param("limit") int limit);

    /**
     * 只有 last_seen 仍早于 before 时才置离线：reaper 扫描之后又来了心跳的用户不受影响。
     */
    @Update("""
            update t_user_presence
            set online = 0,
                connection_id = null,
                updated_at = #{now}
            where user_id = #{userId}
              and online = 1
              and last_seen < #{before}
            """)
    int markOfflineIfStale(@Param("userId") long userId, @Param("before") LocalDateTime before, @Param("now") LocalDateTime now);
}
