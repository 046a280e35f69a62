package com.teamchat.gateway.session;

import com.teamchat.domain.model.TopicKey;
import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机 topic -&gt; 连接 的订阅表。连接关闭时自动清理。
 */
@Component
public class TopicSubscriptionRegistry {

    private static final AttributeKey<Set<TopicKey>> ATTR_TOPICS = AttributeKey.valueOf("chat:topics");

    private final ConcurrentHashMap<TopicKey, Set<Channel>> subscribers = new ConcurrentHashMap<>();

    /**
     * @return true 表示新增订阅（重复订阅返回 false）
     */
    public boolean subscribe(Channel ch, TopicKey topic) {
        if (ch == null || topic == null || !ch.isActive()) {
            return false;
        }
        Set<TopicKey> mine = ch.attr(ATTR_TOPICS).get();
        if (mine == null) {
            Set<TopicKey> created = ConcurrentHashMap.newKeySet();
            mine = ch.attr(ATTR_TOPICS).setIfAbsent(created);
            if (mine == null) {
                mine = created;
                ch.closeFuture().addListener(f -> unsubscribeAll(ch));
            }
        }
        boolean added = mine.add(topic);
        subscribers.compute(topic, (k, set) -> {
            Set<Channel> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            s.add(ch);
            return s;
        });
        // 连接可能在上面两步之间关闭（closeFuture 的 unsubscribeAll 已经跑完），这里补一次清理
        if (!ch.isActive()) {
            mine.remove(topic);
            removeSubscriber(topic, ch);
            return false;
        }
        return added;
    }

    public boolean unsubscribe(Channel ch, TopicKey topic) {
        if (ch == null || topic == null) {
            return false;
        }
        Set<TopicKey> mine = ch.attr(ATTR_TOPICS).get();
        boolean removed = mine != null && mine.remove(topic);
        removeSubscriber(topic, ch);
        return removed;
    }

    public void unsubscribeAll(Channel ch) {
        Set<TopicKey> mine = ch.attr(ATTR_TOPICS).get();
        if (mine == null) {
            return;
        }
        for (TopicKey topic : new ArrayList<>(mine)) {
            mine.remove(topic);
            removeSubscriber(topic, ch);
        }
    }

    /**
     * 当前仍活跃的订阅连接；顺手剔除已关闭的连接。
     */
    public List<Channel> subscribers(TopicKey topic) {
        Set<Channel> set = subscribers.get(topic);
        if (set == null || set.isEmpty()) {
            return Collections.emptyList();
        }
        List<Channel> out = new ArrayList<>(set.size());
        for (Channel ch : set) {
            if (ch.isActive()) {
                out.add(ch);
            } else {
                Set<TopicKey> mine = ch.attr(ATTR_TOPICS).get();
                if (mine != null) {
                    mine.remove(topic);
                }
                removeSubscriber(topic, ch);
            }
        }
        return out;
    }

    public Set<TopicKey> topicsOf(Channel ch) {
        Set<TopicKey> mine = ch.attr(ATTR_TOPICS).get();
        return mine == null ? Set.of() : Set.copyOf(mine);
    }

    private void removeSubscriber(TopicKey topic, Channel ch) {
        subscribers.computeIfPresent(topic, (k, set) -> {
            set.remove(ch);
            return set.isEmpty() ? null : set;
        });
    }
}
