package com.teamchat.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessagePage {
    /** 按频道内 seq 升序。 */
    private List<MessageView> messages;
    private boolean hasMore;
    /** 继续向前翻页时使用的 beforeId；没有更多时为 null。 */
    private Long nextBeforeId;
}
