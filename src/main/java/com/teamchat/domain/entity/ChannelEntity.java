package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.UserRef;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_channel")
public class ChannelEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 频道类型：见 {@link ChannelType}（数据库仍存数字）。 */
    private ChannelType type;

    /** 展示名：公共频道为配置名，私聊为派生名 dm:low:high。 */
    private String name;

    /** 公共频道唯一名；私聊为 null。 */
    private String publicName;

    /**
     * 私聊参与者（规范顺序，low &lt; high）。
     *
     * <p>对应唯一键 uk_channel_dm(dm_user_low, dm_user_high)；公共频道两列均为 null。</p>
     */
    private String dmUserLow;

    private String dmUserHigh;

    /** 创建者 subject。 */
    private String createdBy;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    public boolean isDirect() {
        return type == ChannelType.DM;
    }

    /**
     * 私聊的规范参与者对；公共频道返回 null。
     */
    public CanonicalPair pair() {
        if (!isDirect() || dmUserLow == null || dmUserHigh == null) {
            return null;
        }
        return new CanonicalPair(UserRef.of(dmUserLow), UserRef.of(dmUserHigh));
    }

    /**
     * 公共频道对所有已知用户开放；私聊只对两个参与者开放。
     */
    public boolean allows(UserRef userRef) {
        if (userRef == null) {
            return false;
        }
        if (!isDirect()) {
            return true;
        }
        return userRef.value().equals(dmUserLow) || userRef.value().equals(dmUserHigh);
    }
}
