package com.teamchat.domain.dto;

import com.teamchat.domain.model.AttachmentRef;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * channelId 与 peerRef 二选一：peerRef 表示“给这个人发私聊”，频道不存在时会先创建。
 */
@Data
public class SendMessageRequest {
    private Long channelId;
    private String peerRef;
    @Size(max = 4000, message = "content_too_long")
    private String content;
    private Long replyToId;
    @Size(max = 10, message = "too_many_attachments")
    private List<AttachmentRef> attachments;
    @Size(max = 64, message = "client_nonce_too_long")
    private String clientNonce;
}
