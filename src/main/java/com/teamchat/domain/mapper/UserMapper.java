package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.UserEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

public interface UserMapper extends BaseMapper<UserEntity> {

    /**
     * 按 subject 幂等写入：已存在时只刷新展示资料，不改 status。
     */
    @Insert("""
            insert into t_user(id, external_subject, display_name, email, status, created_at, updated_at)
            values (#{id}, #{subject}, #{displayName}, #{email}, 1, now(3), now(3))
            on duplicate key update
              display_name = values(display_name),
              email = values(email),
              updated_at = now(3)
            """)
    int upsertBySubject(@Param("id") long id,
                        @Param("subject") String subject,
                        @Param("displayName") String displayName,
                        @Param("email") String email);
}
