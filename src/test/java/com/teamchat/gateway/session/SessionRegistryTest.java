package com.teamchat.gateway.session;

import com.teamchat.domain.model.UserRef;
import com.teamchat.gateway.config.GatewayProperties;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRegistryTest {

    private final UserRef alice = UserRef.of("auth0|alice");
    private StringRedisTemplate redis;
    private ValueOperations<String, String> ops;
    private SessionRegistry registry;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        registry = new SessionRegistry(redis, new GatewayProperties(true, "0.0.0.0", 9001, "/ws", "gw-1"));
    }

    @Test
    void bind_writesRoute_andUnbindOfLastConnectionDeletesIt() {
        EmbeddedChannel tab1 = new EmbeddedChannel();
        EmbeddedChannel tab2 = new EmbeddedChannel();

        registry.bind(tab1, alice);
        registry.bind(tab2, alice);
        verify(ops, times(2)).set(SessionRegistry.routeKey(alice), "gw-1", SessionRegistry.ROUTE_TTL);
        assertThat(registry.isLocallyOnline(alice)).isTrue();

        registry.unbind(tab1);
        verify(redis, never()).delete(anyString());

        when(ops.get(SessionRegistry.routeKey(alice))).thenReturn("gw-1");
        registry.unbind(tab2);
        verify(redis).delete(SessionRegistry.routeKey(alice));
        assertThat(registry.getChannels(alice)).isEmpty();
    }

    @Test
    void unbind_routeOwnedByOtherInstance_isKept() {
        EmbeddedChannel tab = new EmbeddedChannel();
        registry.bind(tab, alice);
        when(ops.get(SessionRegistry.routeKey(alice))).thenReturn("gw-2");

        registry.unbind(tab);

        verify(redis, never()).delete(anyString());
    }

    @Test
    void isOnline_fallsBackToRedisRoute() {
        when(ops.get(SessionRegistry.routeKey(alice))).thenReturn("gw-2");

        assertThat(registry.isOnline(alice)).isTrue();
    }

    @Test
    void isOnline_redisDown_treatsRemoteAsOffline() {
        when(ops.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(registry.isOnline(alice)).isFalse();
    }
}
