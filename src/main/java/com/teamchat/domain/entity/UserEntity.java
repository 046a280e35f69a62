package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.teamchat.domain.enums.UserStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_user")
public class UserEntity {

    /** 存储主键，只在本表内部使用，消息核心不引用它。 */
    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 身份提供方签发的 subject（唯一），即 UserRef 的取值。 */
    private String externalSubject;

    private String displayName;

    private String email;

    /** 用户状态：见 {@link UserStatus}（数据库仍存数字）。 */
    private UserStatus status;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
