package com.teamchat.domain.store;

import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.model.UserRef;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 用户目录（身份映射表 t_user）的存储接口。
 */
public interface UserStore {

    /** 按 external subject 查找；不存在返回 null。 */
    UserEntity findBySubject(String subject);

    /**
     * 批量按 UserRef 查找，只返回能解析到的那部分；调用方必须自行处理缺失项（外连接语义）。
     */
    Map<UserRef, UserEntity> findByRefs(Collection<UserRef> refs);

    /**
     * 首次登录/资料同步：按 subject 插入或更新展示资料。
     */
    UserEntity upsert(String subject, String displayName, String email);

    List<UserEntity> listActive();
}
