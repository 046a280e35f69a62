package com.teamchat.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;
import lombok.Data;

/**
 * 推送给订阅方的事件负载，服务端网关与客户端对账器共用。
 *
 * <ul>
 *   <li>MESSAGE_CREATED：message 为规范消息</li>
 *   <li>CHANNEL_READ：readerRef + readUpToMessageId + readUpToSeq（比较先后用 seq）</li>
 *   <li>USER_TYPING：actorRef + typing</li>
 *   <li>CHANNEL_JOINED：发到参与者的用户 topic，channelId 为新频道</li>
 * </ul>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {
    private Long channelId;
    private ChatEventType eventType;
    private MessageView message;
    private UserRef readerRef;
    private Long readUpToMessageId;
    private Long readUpToSeq;
    private UserRef actorRef;
    private Boolean typing;
    private Long ts;

    public static ChatEvent messageCreated(MessageView message, long ts) {
        ChatEvent e = new ChatEvent();
        e.setChannelId(message.getChannelId());
        e.setEventType(ChatEventType.MESSAGE_CREATED);
        e.setMessage(message);
        e.setTs(ts);
        return e;
    }

    public static ChatEvent channelRead(long channelId, UserRef reader, ReadMarker marker, long ts) {
        ChatEvent e = new ChatEvent();
        e.setChannelId(channelId);
        e.setEventType(ChatEventType.CHANNEL_READ);
        e.setReaderRef(reader);
        e.setReadUpToMessageId(marker.messageId());
        e.setReadUpToSeq(marker.seq());
        e.setTs(ts);
        return e;
    }

    public static ChatEvent typing(long channelId, UserRef actor, boolean typing, long ts) {
        ChatEvent e = new ChatEvent();
        e.setChannelId(channelId);
        e.setEventType(ChatEventType.USER_TYPING);
        e.setActorRef(actor);
        e.setTyping(typing);
        e.setTs(ts);
        return e;
    }

    public static ChatEvent channelJoined(long channelId, UserRef actor, long ts) {
        ChatEvent e = new ChatEvent();
        e.setChannelId(channelId);
        e.setEventType(ChatEventType.CHANNEL_JOINED);
        e.setActorRef(actor);
        e.setTs(ts);
        return e;
    }
}
