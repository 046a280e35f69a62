package com.teamchat.domain.enums;

/**
 * 推送事件类型。
 */
public enum ChatEventType {
    MESSAGE_CREATED,
    CHANNEL_READ,
    USER_TYPING,
    /** 新建私聊后发到参与者个人 topic，网关据此把在线连接订阅到新频道。 */
    CHANNEL_JOINED
}
