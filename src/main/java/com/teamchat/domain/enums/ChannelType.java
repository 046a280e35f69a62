package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 频道类型（对应表字段：t_channel.type）。
 *
 * <ul>
 *   <li>1 = 公共频道（PUBLIC）</li>
 *   <li>2 = 私聊（DM）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ChannelType {

    /** 1 = public */
    PUBLIC(1, "public"),

    /** 2 = dm */
    DM(2, "dm");

    @EnumValue
    private final Integer code;

    private final String desc;
}
