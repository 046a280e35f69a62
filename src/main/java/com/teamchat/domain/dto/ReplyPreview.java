package com.teamchat.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplyPreview {
    private Long id;
    private String senderName;
    /** 被回复消息的内容摘要（最多 120 字符）。 */
    private String snippet;
}
