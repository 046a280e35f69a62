package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.teamchat.domain.model.AttachmentRef;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@TableName(value = "t_message", autoResultMap = true)
public class MessageEntity {

    /** msgId：雪花 id，全局唯一。 */
    @TableId(value = "id", type = IdType.INPUT)
    private Long id;

    private Long channelId;

    /**
     * 频道内序号（1 起连续），写入事务里分配，提交顺序与 seq 顺序一致。
     *
     * <p>频道内的排序、补拉、已读与未读都以 seq 为准，不以 id 为准。</p>
     */
    private Long seq;

    /** 发送者 subject（UserRef 取值），不是 t_user.id。 */
    private String senderRef;

    private String content;

    /** 回复/引用的消息 id，必须属于同一频道。 */
    private Long replyToId;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<AttachmentRef> attachments;

    /** client idempotency key */
    private String clientNonce;

    /** 服务端写入时赋值（不走自动填充），返回给调用方的就是落库值。 */
    private LocalDateTime createdAt;
}
