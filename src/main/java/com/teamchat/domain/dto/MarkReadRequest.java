package com.teamchat.domain.dto;

import lombok.Data;

@Data
public class MarkReadRequest {
    /** 为空表示读到频道最新一条。 */
    private Long upToMessageId;
}
