package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 用户状态（对应表字段：t_user.status）。
 */
@Getter
@RequiredArgsConstructor
public enum UserStatus {

    ACTIVE(1, "active"),

    DISABLED(2, "disabled");

    @EnumValue
    private final Integer code;

    private final String desc;
}
