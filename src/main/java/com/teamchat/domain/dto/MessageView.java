package com.teamchat.domain.dto;

import com.teamchat.domain.model.AttachmentRef;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 规范消息（服务端落库后的版本），HTTP 返回与 MESSAGE_CREATED 事件共用这一结构。
 */
@Data
public class MessageView {
    private Long id;
    private Long channelId;
    /** 频道内序号；客户端按它排序和计算补拉起点。 */
    private Long seq;
    private SenderView sender;
    private String content;
    private Long replyToId;
    private ReplyPreview replyPreview;
    private List<AttachmentRef> attachments;
    /** 发送方带上来的 nonce，原样回显，客户端用它把乐观消息替换掉。 */
    private String clientNonce;
    private LocalDateTime createdAt;
}
