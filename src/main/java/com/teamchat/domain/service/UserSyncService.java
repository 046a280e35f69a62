package com.teamchat.domain.service;

import com.teamchat.domain.dto.MemberDto;

public interface UserSyncService {

    /**
     * 登录后同步用户资料：首次出现的 subject 建档，之后只更新展示资料。
     */
    MemberDto sync(String externalSubject, String displayName, String email);
}
