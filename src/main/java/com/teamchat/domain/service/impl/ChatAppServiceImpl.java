package com.teamchat.domain.service.impl;

import com.teamchat.common.error.InvalidChannelRequestException;
import com.teamchat.common.error.TransientWriteFailureException;
import com.teamchat.common.idempotency.ClientNonceIdempotency;
import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.dto.UnreadTotalDto;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.model.NewMessage;
import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ChannelService;
import com.teamchat.domain.service.ChatAppService;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.domain.service.MessageService;
import com.teamchat.domain.service.ReadStateService;
import com.teamchat.domain.service.UserSyncService;
import com.teamchat.gateway.fanout.ChatEventPublisher;
import com.teamchat.gateway.fanout.OfflineNotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
public class ChatAppServiceImpl implements ChatAppService {

    private final IdentityResolver identityResolver;
    private final UserSyncService userSyncService;
    private final ChannelService channelService;
    private final MessageService messageService;
    private final ReadStateService readStateService;
    private final ChatEventPublisher publisher;
    private final OfflineNotificationDispatcher offlineNotifications;
    private final ClientNonceIdempotency idempotency;
    private final Clock clock;

    public ChatAppServiceImpl(IdentityResolver identityResolver,
                              UserSyncService userSyncService,
                              ChannelService channelService,
                              MessageService messageService,
                              ReadStateService readStateService,
                              ChatEventPublisher publisher,
                              OfflineNotificationDispatcher offlineNotifications,
                              ClientNonceIdempotency idempotency,
                              Clock clock) {
        this.identityResolver = identityResolver;
        this.userSyncService = userSyncService;
        this.channelService = channelService;
        this.messageService = messageService;
        this.readStateService = readStateService;
        this.publisher = publisher;
        this.offlineNotifications = offlineNotifications;
        this.idempotency = idempotency;
        this.clock = clock;
    }

    @Override
    public MessageView send(String subject, SendMessageRequest request) {
        UserRef me = identityResolver.resolve(subject);
        ChannelEntity channel = resolveTarget(me, request.getChannelId(), request.getPeerRef());
        NewMessage draft = new NewMessage(channel.getId(), me, request.getContent(), request.getReplyToId(),
                request.getAttachments(), blankToNull(request.getClientNonce()));

        MessageView saved;
        if (draft.clientNonce() != null && idempotency.enabled()) {
            String key = idempotency.key(me, draft.clientNonce());
            Long existing = idempotency.get(key);
            if (existing != null) {
                return replay(existing);
            }
            long msgId = messageService.allocateId();
            Long raced = idempotency.claim(key, msgId);
            if (raced != null) {
                return replay(raced);
            }
            try {
                saved = messageService.append(msgId, draft);
            } catch (RuntimeException e) {
                idempotency.release(key, msgId);
                throw e;
            }
        } else {
            saved = messageService.append(draft);
        }

        publishQuietly(channelService.resolveTopicFor(channel), ChatEventType.MESSAGE_CREATED,
                ChatEvent.messageCreated(saved, clock.millis()));
        try {
            offlineNotifications.dispatch(channel, me, saved);
        } catch (Exception e) {
            log.warn("offline notify dispatch failed: msgId={}, err={}", saved.getId(), e.toString());
        }
        return saved;
    }

    @Override
    public MessagePage history(String subject, long channelId, MessageCursor cursor) {
        UserRef me = identityResolver.resolve(subject);
        return messageService.listMessages(me, channelId, cursor);
    }

    @Override
    public Long markRead(String subject, long channelId, Long upToMessageId) {
        UserRef me = identityResolver.resolve(subject);
        ReadMarker marker = readStateService.markRead(me, channelId, upToMessageId);
        if (marker == null) {
            return null;
        }
        publishQuietly(TopicKey.forChannel(channelId), ChatEventType.CHANNEL_READ,
                ChatEvent.channelRead(channelId, me, marker, clock.millis()));
        return marker.messageId();
    }

    @Override
    public List<ChannelView> channels(String subject) {
        return channelService.listChannelsFor(identityResolver.resolve(subject));
    }

    @Override
    public ChannelView openDirect(String subject, String peerRef) {
        UserRef me = identityResolver.resolve(subject);
        ChannelEntity channel = directWith(me, peerRef);
        return channelService.toView(me, channel);
    }

    @Override
    public UnreadTotalDto unreadTotal(String subject) {
        return new UnreadTotalDto(readStateService.totalUnread(identityResolver.resolve(subject)));
    }

    @Override
    public void typing(String subject, long channelId, boolean typing) {
        UserRef me = identityResolver.resolve(subject);
        ChannelEntity channel = channelService.requireAccessible(me, channelId);
        publishQuietly(channelService.resolveTopicFor(channel), ChatEventType.USER_TYPING,
                ChatEvent.typing(channelId, me, typing, clock.millis()));
    }

    @Override
    public MemberDto syncMe(String subject, String displayName, String email) {
        return userSyncService.sync(subject, displayName, email);
    }

    @Override
    public List<MemberDto> members(String subject) {
        return identityResolver.listMembers(identityResolver.resolve(subject));
    }

    private ChannelEntity resolveTarget(UserRef me, Long channelId, String peerRef) {
        boolean hasPeer = peerRef != null && !peerRef.isBlank();
        if (channelId != null && hasPeer) {
            throw new InvalidChannelRequestException("channel_and_peer_conflict");
        }
        if (channelId != null) {
            return channelService.requireAccessible(me, channelId);
        }
        if (!hasPeer) {
            throw new InvalidChannelRequestException("channel_or_peer_required");
        }
        return directWith(me, peerRef);
    }

    /**
     * 首次联系时创建私聊，并先通知双方个人 topic（在线连接据此订阅新频道），再返回给调用方发消息。
     */
    private ChannelEntity directWith(UserRef me, String peerRef) {
        UserRef peer = UserRef.ofNullable(peerRef);
        if (peer == null) {
            throw new InvalidChannelRequestException("peer_ref_required");
        }
        if (!identityResolver.isKnown(peer)) {
            throw new InvalidChannelRequestException("peer_not_found");
        }
        ChannelService.DirectChannel dc = channelService.findOrCreateDirect(me, peer);
        if (dc.created()) {
            CanonicalPair pair = dc.channel().pair();
            long ts = clock.millis();
            for (UserRef participant : List.of(pair.low(), pair.high())) {
                publishQuietly(TopicKey.forUser(participant), ChatEventType.CHANNEL_JOINED,
                        ChatEvent.channelJoined(dc.channel().getId(), me, ts));
            }
        }
        return dc.channel();
    }

    private MessageView replay(long messageId) {
        MessageView view = messageService.getView(messageId);
        if (view == null) {
            // 同一 nonce 的第一次请求还没落库完成
            throw new TransientWriteFailureException("send_in_progress", null);
        }
        return view;
    }

    private void publishQuietly(TopicKey topic, ChatEventType type, ChatEvent event) {
        try {
            publisher.publish(topic, type, event);
        } catch (Exception e) {
            log.warn("fan-out failed after write: topic={}, type={}, err={}", topic, type, e.toString());
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
