package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ChannelService;
import com.teamchat.domain.service.ChatAppService;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.gateway.config.GatewayProperties;
import com.teamchat.gateway.session.SessionRegistry;
import com.teamchat.gateway.session.TopicSubscriptionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsSessionBootstrapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final UserRef alice = UserRef.of("auth0|alice");
    private IdentityResolver identityResolver;
    private ChannelService channelService;
    private ChatAppService chatAppService;
    private SessionRegistry sessions;
    private TopicSubscriptionRegistry subscriptions;
    private WsSessionBootstrapper bootstrapper;
    private EmbeddedChannel ch;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        identityResolver = mock(IdentityResolver.class);
        channelService = mock(ChannelService.class);
        chatAppService = mock(ChatAppService.class);
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.opsForValue()).thenReturn(mock(ValueOperations.class));
        sessions = new SessionRegistry(redis, new GatewayProperties(true, "127.0.0.1", 9001, "/ws", "gw-test"));
        subscriptions = new TopicSubscriptionRegistry();
        bootstrapper = new WsSessionBootstrapper(identityResolver, channelService, chatAppService, sessions,
                subscriptions, new WsWriter(objectMapper), Runnable::run);
        ch = new EmbeddedChannel();
        ch.attr(SessionRegistry.ATTR_SUBJECT).set("auth0|alice");
        when(channelService.resolveTopicFor(any())).thenAnswer(inv -> TopicKey.forChannel(inv.<ChannelEntity>getArgument(0).getId()));
    }

    @Test
    void bootstrap_subscribesUserAndAccessibleChannels_thenReady() throws Exception {
        when(identityResolver.resolve("auth0|alice")).thenReturn(alice);
        when(channelService.listAccessible(alice)).thenReturn(List.of(channel(1L, ChannelType.PUBLIC), channel(2L, ChannelType.DM)));

        bootstrapper.bootstrap(ch);

        assertThat(sessions.userRefOf(ch)).isEqualTo(alice);
        assertThat(subscriptions.topicsOf(ch)).containsExactlyInAnyOrder(
                TopicKey.forUser(alice), TopicKey.forChannel(1L), TopicKey.forChannel(2L));
        assertThat(readJson().get("type").asText()).isEqualTo("READY");
    }

    @Test
    void bootstrap_unknownIdentity_closesWithoutBinding() throws Exception {
        when(identityResolver.resolve("auth0|alice")).thenThrow(new UnknownIdentityException("auth0|alice"));

        bootstrapper.bootstrap(ch);

        assertThat(readJson().get("reason").asText()).isEqualTo("unknown_identity");
        assertThat(sessions.isBound(ch)).isFalse();
        assertThat(ch.isOpen()).isFalse();
    }

    @Test
    void subscribe_otherUsersTopic_isDenied() throws Exception {
        sessions.bind(ch, alice);

        bootstrapper.subscribe(ch, "chat.user.auth0|bob");

        assertThat(readJson().get("reason").asText()).isEqualTo("channel_access_denied");
        assertThat(subscriptions.topicsOf(ch)).isEmpty();
    }

    @Test
    void subscribe_inaccessibleChannel_isDenied() throws Exception {
        sessions.bind(ch, alice);
        when(channelService.requireAccessible(alice, 5L)).thenThrow(new ChannelAccessDeniedException());

        bootstrapper.subscribe(ch, "chat.channel.5");

        assertThat(readJson().get("reason").asText()).isEqualTo("channel_access_denied");
        assertThat(subscriptions.topicsOf(ch)).isEmpty();
    }

    @Test
    void subscribe_accessibleChannel_isAcknowledged() throws Exception {
        sessions.bind(ch, alice);

        bootstrapper.subscribe(ch, "chat.channel.6");

        JsonNode ack = readJson();
        assertThat(ack.get("type").asText()).isEqualTo("SUBSCRIBED");
        assertThat(ack.get("topic").asText()).isEqualTo("chat.channel.6");
        assertThat(subscriptions.topicsOf(ch)).containsExactly(TopicKey.forChannel(6L));
    }

    @Test
    void subscribe_malformedTopic_isRejected() throws Exception {
        sessions.bind(ch, alice);

        bootstrapper.subscribe(ch, "chat.channel.abc");

        assertThat(readJson().get("reason").asText()).isEqualTo("bad_topic");
    }

    @Test
    void typing_isForwardedWithSubject() {
        bootstrapper.typing(ch, 3L, false);

        verify(chatAppService).typing(eq("auth0|alice"), eq(3L), eq(false));
    }

    private static ChannelEntity channel(long id, ChannelType type) {
        ChannelEntity c = new ChannelEntity();
        c.setId(id);
        c.setType(type);
        return c;
    }

    private JsonNode readJson() throws Exception {
        TextWebSocketFrame frame = ch.readOutbound();
        assertThat(frame).isNotNull();
        try {
            return objectMapper.readTree(frame.text());
        } finally {
            frame.release();
        }
    }
}
