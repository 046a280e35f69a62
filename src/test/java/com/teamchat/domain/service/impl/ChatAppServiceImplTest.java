package com.teamchat.domain.service.impl;

import com.teamchat.common.error.InvalidChannelRequestException;
import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.common.idempotency.ClientNonceIdempotency;
import com.teamchat.common.idempotency.ClientNonceProperties;
import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import com.teamchat.gateway.fanout.ChatEventPublisher;
import com.teamchat.gateway.fanout.OfflineNotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ChatAppServiceImplTest {

    private ChatCoreFixture f;
    private ChatEventPublisher publisher;
    private OfflineNotificationDispatcher offline;
    private ChatAppServiceImpl app;
    private UserRef alice;
    private UserRef bob;
    private long general;

    @BeforeEach
    void setUp() {
        f = new ChatCoreFixture();
        publisher = mock(ChatEventPublisher.class);
        offline = mock(OfflineNotificationDispatcher.class);
        ClientNonceIdempotency idempotency = new ClientNonceIdempotency(new ClientNonceProperties(null, null, null, null));
        app = new ChatAppServiceImpl(f.identityResolver, new UserSyncServiceImpl(f.users), f.channelService,
                f.messageService, f.readStateService, publisher, offline, idempotency, f.clock);
        alice = f.user("auth0|alice", "Alice");
        bob = f.user("auth0|bob", "Bob");
        general = f.channelService.provisionPublicChannel("general", null).getId();
    }

    @Test
    void send_publishesCanonicalMessageOnChannelTopic() {
        MessageView saved = app.send("auth0|alice", toChannel(general, "shift starts at 6"));

        ArgumentCaptor<ChatEvent> event = ArgumentCaptor.forClass(ChatEvent.class);
        verify(publisher).publish(eq(TopicKey.forChannel(general)), eq(ChatEventType.MESSAGE_CREATED), event.capture());
        assertThat(event.getValue().getMessage()).isSameAs(saved);
        assertThat(event.getValue().getTs()).isEqualTo(f.clock.millis());
        verify(offline).dispatch(any(), eq(alice), eq(saved));
    }

    @Test
    void send_fanOutFailure_doesNotFailTheWrite() {
        doThrow(new IllegalStateException("redis down")).when(publisher).publish(any(), any(), any());

        MessageView saved = app.send("auth0|alice", toChannel(general, "still stored"));

        assertThat(f.messageService.getView(saved.getId())).isNotNull();
        assertThat(f.messages.size()).isEqualTo(1);
    }

    @Test
    void send_toPeerOnFirstContact_announcesChannelBeforeMessage() {
        SendMessageRequest req = new SendMessageRequest();
        req.setPeerRef("auth0|bob");
        req.setContent("hey bob");

        MessageView saved = app.send("auth0|alice", req);

        long dm = f.channelService.findDirectChannel(alice, bob).getId();
        assertThat(saved.getChannelId()).isEqualTo(dm);
        InOrder order = inOrder(publisher);
        order.verify(publisher).publish(eq(TopicKey.forUser(alice)), eq(ChatEventType.CHANNEL_JOINED), any());
        order.verify(publisher).publish(eq(TopicKey.forUser(bob)), eq(ChatEventType.CHANNEL_JOINED), any());
        order.verify(publisher).publish(eq(TopicKey.forChannel(dm)), eq(ChatEventType.MESSAGE_CREATED), any());

        // 第二次不再创建，也不再宣告
        app.send("auth0|bob", toChannel(dm, "hi"));
        verify(publisher, times(2)).publish(any(), eq(ChatEventType.CHANNEL_JOINED), any());
    }

    @Test
    void send_sameClientNonce_returnsFirstMessage() {
        SendMessageRequest req = toChannel(general, "retry me");
        req.setClientNonce("nonce-42");

        MessageView first = app.send("auth0|alice", req);
        MessageView second = app.send("auth0|alice", req);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(f.messages.size()).isEqualTo(1);
        verify(publisher, times(1)).publish(any(), eq(ChatEventType.MESSAGE_CREATED), any());
    }

    @Test
    void send_sameNonceFromDifferentSenders_areIndependent() {
        SendMessageRequest req = toChannel(general, "same nonce");
        req.setClientNonce("n");

        MessageView a = app.send("auth0|alice", req);
        MessageView b = app.send("auth0|bob", req);

        assertThat(a.getId()).isNotEqualTo(b.getId());
    }

    @Test
    void send_channelAndPeerTogether_isRejected() {
        SendMessageRequest req = toChannel(general, "x");
        req.setPeerRef("auth0|bob");

        assertThatThrownBy(() -> app.send("auth0|alice", req))
                .isInstanceOf(InvalidChannelRequestException.class)
                .hasMessage("channel_and_peer_conflict");
        verifyNoInteractions(publisher);
    }

    @Test
    void send_toUnknownPeer_isRejected() {
        SendMessageRequest req = new SendMessageRequest();
        req.setPeerRef("auth0|nobody");
        req.setContent("hello?");

        assertThatThrownBy(() -> app.send("auth0|alice", req))
                .isInstanceOf(InvalidChannelRequestException.class)
                .hasMessage("peer_not_found");
        assertThat(f.channels.size()).isEqualTo(1);
    }

    @Test
    void send_unknownSubject_isRejectedWithoutFallback() {
        assertThatThrownBy(() -> app.send("auth0|ghost", toChannel(general, "boo")))
                .isInstanceOf(UnknownIdentityException.class);
        verify(publisher, never()).publish(any(), any(), any());
    }

    @Test
    void markRead_publishesReceiptWithMarker() {
        long m = app.send("auth0|bob", toChannel(general, "read me")).getId();

        Long marker = app.markRead("auth0|alice", general, null);

        assertThat(marker).isEqualTo(m);
        ArgumentCaptor<ChatEvent> event = ArgumentCaptor.forClass(ChatEvent.class);
        verify(publisher).publish(eq(TopicKey.forChannel(general)), eq(ChatEventType.CHANNEL_READ), event.capture());
        assertThat(event.getValue().getReaderRef()).isEqualTo(alice);
        assertThat(event.getValue().getReadUpToMessageId()).isEqualTo(m);
        assertThat(event.getValue().getReadUpToSeq()).isEqualTo(1L);
        assertThat(app.unreadTotal("auth0|alice").getTotal()).isZero();
    }

    @Test
    void markRead_emptyChannel_publishesNothing() {
        assertThat(app.markRead("auth0|alice", general, null)).isNull();
        verifyNoInteractions(publisher);
    }

    @Test
    void firstContact_bothSidesEndUpInTheSameChannel() {
        SendMessageRequest hello = new SendMessageRequest();
        hello.setPeerRef("auth0|bob");
        hello.setContent("are you on site today?");
        MessageView first = app.send("auth0|alice", hello);

        ChannelView bobsView = app.channels("auth0|bob").stream()
                .filter(c -> c.getType() == ChannelType.DM)
                .findFirst()
                .orElseThrow();
        assertThat(bobsView.getId()).isEqualTo(first.getChannelId());
        assertThat(bobsView.getName()).isEqualTo("Alice");
        assertThat(bobsView.getUnreadCount()).isEqualTo(1);

        ChannelView opened = app.openDirect("auth0|bob", "auth0|alice");
        MessageView reply = app.send("auth0|bob", toChannel(opened.getId(), "yes, bay 4"));

        assertThat(reply.getChannelId()).isEqualTo(first.getChannelId());
        assertThat(app.history("auth0|alice", first.getChannelId(), null).getMessages())
                .extracting(MessageView::getContent)
                .containsExactly("are you on site today?", "yes, bay 4");
        assertThat(f.channels.size()).isEqualTo(2);
    }

    private static SendMessageRequest toChannel(long channelId, String content) {
        SendMessageRequest req = new SendMessageRequest();
        req.setChannelId(channelId);
        req.setContent(content);
        return req;
    }
}
