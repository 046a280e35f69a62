package com.teamchat.domain.dto;

import com.teamchat.domain.model.UserRef;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息发送者/私聊对端的展示信息。
 *
 * <p>resolved=false 表示 UserRef 在用户目录中已不存在（外连接没有命中），此时 displayName 为占位名。</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SenderView {

    public static final String UNKNOWN_NAME = "Unknown user";

    private UserRef ref;
    private String displayName;
    private String email;
    private boolean resolved;

    public static SenderView placeholder(UserRef ref) {
        return new SenderView(ref, UNKNOWN_NAME, null, false);
    }
}
