package com.teamchat.gateway.session;

import com.teamchat.domain.model.TopicKey;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TopicSubscriptionRegistryTest {

    private final TopicSubscriptionRegistry registry = new TopicSubscriptionRegistry();

    @Test
    void subscribe_isIdempotentPerChannel() {
        EmbeddedChannel ch = new EmbeddedChannel();
        TopicKey topic = TopicKey.forChannel(7L);

        assertThat(registry.subscribe(ch, topic)).isTrue();
        assertThat(registry.subscribe(ch, topic)).isFalse();
        assertThat(registry.subscribers(topic)).containsExactly(ch);
        assertThat(registry.topicsOf(ch)).containsExactly(topic);
    }

    @Test
    void unsubscribe_removesOnlyThatTopic() {
        EmbeddedChannel ch = new EmbeddedChannel();
        TopicKey a = TopicKey.forChannel(1L);
        TopicKey b = TopicKey.forChannel(2L);
        registry.subscribe(ch, a);
        registry.subscribe(ch, b);

        assertThat(registry.unsubscribe(ch, a)).isTrue();
        assertThat(registry.unsubscribe(ch, a)).isFalse();
        assertThat(registry.subscribers(a)).isEmpty();
        assertThat(registry.subscribers(b)).containsExactly(ch);
    }

    @Test
    void closingChannel_dropsAllItsSubscriptions() {
        EmbeddedChannel ch = new EmbeddedChannel();
        EmbeddedChannel other = new EmbeddedChannel();
        TopicKey topic = TopicKey.forChannel(3L);
        registry.subscribe(ch, topic);
        registry.subscribe(other, topic);

        ch.close();

        assertThat(registry.subscribers(topic)).containsExactly(other);
        assertThat(registry.topicsOf(ch)).isEmpty();
    }

    @Test
    void subscribe_inactiveChannel_isIgnored() {
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.close();

        assertThat(registry.subscribe(ch, TopicKey.forChannel(4L))).isFalse();
        assertThat(registry.subscribers(TopicKey.forChannel(4L))).isEmpty();
    }

    @Test
    void subscribe_racingWithClose_leavesNoStaleSubscriber() {
        // 第一次 isActive 检查通过，随后连接被关闭（关闭回调已经执行完）
        FlippingChannel ch = new FlippingChannel(1);
        TopicKey topic = TopicKey.forChannel(5L);

        assertThat(registry.subscribe(ch, topic)).isFalse();
        assertThat(registry.subscribers(topic)).isEmpty();
        assertThat(registry.topicsOf(ch)).isEmpty();
    }

    @Test
    void subscribers_prunesChannelsThatWentInactive() {
        FlippingChannel dead = new FlippingChannel(Integer.MAX_VALUE);
        EmbeddedChannel live = new EmbeddedChannel();
        TopicKey topic = TopicKey.forChannel(6L);
        registry.subscribe(dead, topic);
        registry.subscribe(live, topic);

        dead.activeChecksLeft = 0;

        assertThat(registry.subscribers(topic)).containsExactly(live);
        assertThat(registry.topicsOf(dead)).isEmpty();
    }

    /**
     * 前 N 次 isActive 返回 true，之后返回 false；不触发 closeFuture。
     */
    private static final class FlippingChannel extends EmbeddedChannel {
        volatile int activeChecksLeft;

        FlippingChannel(int activeChecks) {
            this.activeChecksLeft = activeChecks;
        }

        @Override
        public boolean isActive() {
            if (activeChecksLeft <= 0) {
                return false;
            }
            activeChecksLeft--;
            return super.isActive();
        }
    }
}
