package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 已读游标：每个 (userRef, channelId) 一行，只增不减。
 */
@Data
@TableName("t_read_state")
public class ReadStateEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String userRef;

    private Long channelId;

    private Long lastReadSeq;

    private Long lastReadMsgId;

    private LocalDateTime lastReadAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
