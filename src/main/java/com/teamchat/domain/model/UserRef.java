package com.teamchat.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 用户引用：身份提供方签发的 external subject。
 *
 * <p>消息核心里所有“是不是我 / 谁发的”的比较都只能使用这个类型。
 * t_user 的自增/雪花主键（{@code Long}）与它不在同一个地址空间，二者不能互换，
 * 所以这里用一个独立的具名类型把它包起来，而不是到处传裸字符串。</p>
 */
public record UserRef(String value) implements Comparable<UserRef> {

    public UserRef {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("user_ref_blank");
        }
    }

    @JsonCreator
    public static UserRef of(String value) {
        return new UserRef(value);
    }

    /**
     * 宽松解析：空串/null 返回 null（用于可选的请求参数）。
     */
    public static UserRef ofNullable(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return new UserRef(value.trim());
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(UserRef o) {
        return value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
