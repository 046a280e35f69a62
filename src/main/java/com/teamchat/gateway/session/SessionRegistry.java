package com.teamchat.gateway.session;

import com.teamchat.domain.model.UserRef;
import com.teamchat.gateway.config.GatewayProperties;
import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线会话表。
 *
 * <ul>
 *   <li>本机：UserRef -&gt; Channel(s)（当前实例上的连接）</li>
 *   <li>Redis：UserRef -&gt; instanceId，带 TTL，用于跨实例判断“是否在线”</li>
 * </ul>
 */
@Slf4j
@Component
public class SessionRegistry {

    public static final AttributeKey<String> ATTR_SUBJECT = AttributeKey.valueOf("chat:subject");
    public static final AttributeKey<UserRef> ATTR_USER_REF = AttributeKey.valueOf("chat:userRef");
    public static final AttributeKey<Long> ATTR_ACCESS_EXP_MS = AttributeKey.valueOf("chat:aexp");

    private static final String ROUTE_KEY_PREFIX = "chat:gw:route:";
    static final Duration ROUTE_TTL = Duration.ofSeconds(120);

    private final ConcurrentHashMap<UserRef, ConcurrentHashMap<String, Channel>> userChannels = new ConcurrentHashMap<>();

    private final StringRedisTemplate redis;
    private final String instanceId;

    public SessionRegistry(StringRedisTemplate redis, GatewayProperties props) {
        this.redis = redis;
        this.instanceId = props.instanceIdEffective();
    }

    public void bind(Channel ch, UserRef userRef) {
        userChannels.computeIfAbsent(userRef, k -> new ConcurrentHashMap<>())
                .put(ch.id().asShortText(), ch);
        ch.attr(ATTR_USER_REF).set(userRef);
        setRoute(userRef);
    }

    public void unbind(Channel ch) {
        UserRef userRef = ch.attr(ATTR_USER_REF).get();
        if (userRef == null) {
            return;
        }
        ConcurrentHashMap<String, Channel> map = userChannels.get(userRef);
        if (map != null) {
            map.remove(ch.id().asShortText(), ch);
            if (map.isEmpty()) {
                userChannels.remove(userRef, map);
                deleteRouteIfOwned(userRef);
            }
        }
    }

    /** 握手 JWT 已通过（subject 已写入 channel）。 */
    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_SUBJECT).get() != null;
    }

    /** 身份已解析、会话已绑定。 */
    public boolean isBound(Channel ch) {
        return ch.attr(ATTR_USER_REF).get() != null;
    }

    public UserRef userRefOf(Channel ch) {
        return ch.attr(ATTR_USER_REF).get();
    }

    public List<Channel> getChannels(UserRef userRef) {
        ConcurrentHashMap<String, Channel> map = userChannels.get(userRef);
        if (map == null || map.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(map.values());
    }

    public boolean isLocallyOnline(UserRef userRef) {
        for (Channel ch : getChannels(userRef)) {
            if (ch != null && ch.isActive()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 本机有连接，或 Redis 里有未过期的路由。Redis 不可用时只看本机。
     */
    public boolean isOnline(UserRef userRef) {
        if (isLocallyOnline(userRef)) {
            return true;
        }
        try {
            return redis.opsForValue().get(routeKey(userRef)) != null;
        } catch (Exception e) {
            log.debug("route lookup failed, treat as offline: userRef={}, err={}", userRef, e.toString());
            return false;
        }
    }

    /** 心跳时刷新路由 TTL。 */
    public void touch(Channel ch) {
        UserRef userRef = ch.attr(ATTR_USER_REF).get();
        if (userRef != null) {
            setRoute(userRef);
        }
    }

    public String instanceId() {
        return instanceId;
    }

    private void setRoute(UserRef userRef) {
        try {
            redis.opsForValue().set(routeKey(userRef), instanceId, ROUTE_TTL);
        } catch (Exception e) {
            // 单机/开发模式：Redis 不可用时只维持本机映射
            log.warn("setRoute failed, redis unavailable? userRef={}, instanceId={}, err={}", userRef, instanceId, e.toString());
        }
    }

    private void deleteRouteIfOwned(UserRef userRef) {
        String key = routeKey(userRef);
        try {
            String cur = redis.opsForValue().get(key);
            if (instanceId.equals(cur)) {
                redis.delete(key);
            }
        } catch (Exception e) {
            log.warn("deleteRouteIfOwned failed, redis unavailable? userRef={}, err={}", userRef, e.toString());
        }
    }

    static String routeKey(UserRef userRef) {
        return ROUTE_KEY_PREFIX + userRef.value();
    }
}
