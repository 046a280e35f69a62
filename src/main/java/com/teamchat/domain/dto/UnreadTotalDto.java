package com.teamchat.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnreadTotalDto {
    /** 所有可访问频道的未读合计（不含自己发的消息）。 */
    private long total;
}
