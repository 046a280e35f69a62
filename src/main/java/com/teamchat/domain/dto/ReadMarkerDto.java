package com.teamchat.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReadMarkerDto {
    private Long channelId;
    /** 频道还没有消息时为 null。 */
    private Long lastReadMsgId;
}
