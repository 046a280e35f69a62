package com.teamchat.domain.model;

import java.util.Objects;

/**
 * 私聊会话的规范化参与者对：按字典序排序后的 (low, high)。
 *
 * <p>查找与插入都只使用这个顺序，与调用参数的先后无关。</p>
 */
public record CanonicalPair(UserRef low, UserRef high) {

    public CanonicalPair {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (low.compareTo(high) >= 0) {
            throw new IllegalArgumentException("pair_not_canonical");
        }
    }

    public static CanonicalPair of(UserRef a, UserRef b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int cmp = a.compareTo(b);
        if (cmp == 0) {
            throw new IllegalArgumentException("self_pair");
        }
        return cmp < 0 ? new CanonicalPair(a, b) : new CanonicalPair(b, a);
    }

    public boolean contains(UserRef ref) {
        return low.equals(ref) || high.equals(ref);
    }

    public UserRef peerOf(UserRef self) {
        if (low.equals(self)) {
            return high;
        }
        if (high.equals(self)) {
            return low;
        }
        throw new IllegalArgumentException("not_a_participant");
    }

    /** DM 频道的派生名称，不可编辑。 */
    public String channelName() {
        return "dm:" + low.value() + ":" + high.value();
    }
}
