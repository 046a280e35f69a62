package com.teamchat.domain.dto;

import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.model.TopicKey;
import lombok.Data;

@Data
public class ChannelView {
    private Long id;
    private ChannelType type;
    private String name;
    private TopicKey topic;
    /** 仅私聊：对端用户（可能是占位）。 */
    private SenderView peer;
    private MessageView lastMessage;
    private Long lastReadMsgId;
    private long unreadCount;
}
