package com.teamchat.domain.service.impl;

import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.ChannelNotFoundException;
import com.teamchat.common.error.ChannelRaceLostException;
import com.teamchat.common.error.InvalidChannelRequestException;
import com.teamchat.common.error.TransientWriteFailureException;
import com.teamchat.common.error.TransientWrites;
import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SenderView;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.enums.ChannelType;
import com.teamchat.domain.model.CanonicalPair;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ChannelService;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.domain.service.ReadStateService;
import com.teamchat.domain.store.ChannelStore;
import com.teamchat.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 频道注册表。
 *
 * <p>查找或创建采用“先查、再插、冲突后重读”：唯一性完全交给存储层的唯一键，
 * 多实例并发首次联系时，输掉竞争的一方读回胜出的那一行。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelServiceImpl implements ChannelService {

    static final String SYSTEM_CREATOR = "system";

    private final ChannelStore channelStore;
    private final MessageStore messageStore;
    private final ReadStateService readStateService;
    private final IdentityResolver identityResolver;
    private final MessageViewAssembler messageViewAssembler;

    @Override
    public DirectChannel findOrCreateDirect(UserRef a, UserRef b) {
        if (a == null || b == null) {
            throw new InvalidChannelRequestException("participant_required");
        }
        if (a.equals(b)) {
            throw new InvalidChannelRequestException("self_direct_channel");
        }
        CanonicalPair pair = CanonicalPair.of(a, b);
        ChannelEntity existing = channelStore.findDirect(pair);
        if (existing != null) {
            return new DirectChannel(existing, false);
        }

        ChannelEntity channel = new ChannelEntity();
        channel.setType(ChannelType.DM);
        channel.setName(pair.channelName());
        channel.setDmUserLow(pair.low().value());
        channel.setDmUserHigh(pair.high().value());
        channel.setCreatedBy(a.value());
        try {
            TransientWrites.run(() -> channelStore.insert(channel));
            log.info("direct channel created: id={}, pair={}", channel.getId(), pair.channelName());
            return new DirectChannel(channel, true);
        } catch (ChannelRaceLostException e) {
            ChannelEntity winner = channelStore.findDirect(pair);
            if (winner == null) {
                throw new TransientWriteFailureException("channel_create_failed", e);
            }
            log.debug("direct channel race lost, reuse winner: id={}, pair={}", winner.getId(), pair.channelName());
            return new DirectChannel(winner, false);
        }
    }

    @Override
    public ChannelEntity findDirectChannel(UserRef a, UserRef b) {
        if (a == null || b == null || a.equals(b)) {
            return null;
        }
        return channelStore.findDirect(CanonicalPair.of(a, b));
    }

    @Override
    public ChannelEntity provisionPublicChannel(String name, UserRef createdBy) {
        String publicName = name == null ? "" : name.trim();
        if (publicName.isEmpty()) {
            throw new InvalidChannelRequestException("public_name_required");
        }
        ChannelEntity existing = channelStore.findPublicByName(publicName);
        if (existing != null) {
            return existing;
        }
        ChannelEntity channel = new ChannelEntity();
        channel.setType(ChannelType.PUBLIC);
        channel.setName(publicName);
        channel.setPublicName(publicName);
        channel.setCreatedBy(createdBy == null ? SYSTEM_CREATOR : createdBy.value());
        try {
            TransientWrites.run(() -> channelStore.insert(channel));
            log.info("public channel provisioned: id={}, name={}", channel.getId(), publicName);
            return channel;
        } catch (ChannelRaceLostException e) {
            ChannelEntity winner = channelStore.findPublicByName(publicName);
            if (winner == null) {
                throw new TransientWriteFailureException("channel_create_failed", e);
            }
            return winner;
        }
    }

    @Override
    public ChannelEntity requireChannel(long channelId) {
        ChannelEntity channel = channelStore.findById(channelId);
        if (channel == null) {
            throw new ChannelNotFoundException(channelId);
        }
        return channel;
    }

    @Override
    public boolean canAccess(UserRef userRef, ChannelEntity channel) {
        return channel != null && channel.allows(userRef);
    }

    @Override
    public ChannelEntity requireAccessible(UserRef userRef, long channelId) {
        ChannelEntity channel = requireChannel(channelId);
        if (!canAccess(userRef, channel)) {
            throw new ChannelAccessDeniedException();
        }
        return channel;
    }

    @Override
    public List<ChannelEntity> listAccessible(UserRef userRef) {
        return channelStore.listAccessible(userRef);
    }

    @Override
    public List<ChannelView> listChannelsFor(UserRef userRef) {
        List<ChannelEntity> channels = channelStore.listAccessible(userRef);
        if (channels.isEmpty()) {
            return List.of();
        }
        List<Long> ids = channels.stream().map(ChannelEntity::getId).toList();
        Map<Long, MessageEntity> latest = messageStore.findLatestByChannels(ids);
        Map<Long, Long> unread = readStateService.unreadCounts(userRef, ids);
        Map<Long, Long> lastRead = readStateService.lastReadMessageIds(userRef, ids);

        Set<UserRef> peers = new HashSet<>();
        for (ChannelEntity c : channels) {
            if (c.isDirect()) {
                peers.add(c.pair().peerOf(userRef));
            }
        }
        Map<UserRef, SenderView> peerViews = identityResolver.describeAll(peers);
        Map<Long, MessageView> lastViews = new HashMap<>();
        for (MessageView v : messageViewAssembler.assembleAll(latest.values())) {
            lastViews.put(v.getChannelId(), v);
        }

        List<ChannelView> out = new ArrayList<>(channels.size());
        for (ChannelEntity c : channels) {
            ChannelView v = baseView(userRef, c, peerViews);
            v.setLastMessage(lastViews.get(c.getId()));
            v.setUnreadCount(unread.getOrDefault(c.getId(), 0L));
            v.setLastReadMsgId(lastRead.get(c.getId()));
            out.add(v);
        }
        out.sort(Comparator
                .comparingLong((ChannelView v) -> v.getLastMessage() == null ? 0L : v.getLastMessage().getId())
                .thenComparingLong(ChannelView::getId)
                .reversed());
        return out;
    }

    @Override
    public ChannelView toView(UserRef viewer, ChannelEntity channel) {
        Map<UserRef, SenderView> peerViews = channel.isDirect()
                ? identityResolver.describeAll(List.of(channel.pair().peerOf(viewer)))
                : Map.of();
        ChannelView v = baseView(viewer, channel, peerViews);
        Map<Long, MessageEntity> latest = messageStore.findLatestByChannels(List.of(channel.getId()));
        MessageEntity last = latest.get(channel.getId());
        v.setLastMessage(last == null ? null : messageViewAssembler.assemble(last));
        v.setUnreadCount(readStateService.unreadCount(viewer, channel.getId()));
        v.setLastReadMsgId(readStateService.lastReadMessageId(viewer, channel.getId()));
        return v;
    }

    private ChannelView baseView(UserRef viewer, ChannelEntity c, Map<UserRef, SenderView> peerViews) {
        ChannelView v = new ChannelView();
        v.setId(c.getId());
        v.setType(c.getType());
        v.setName(c.getName());
        v.setTopic(resolveTopicFor(c));
        if (c.isDirect()) {
            UserRef peer = c.pair().peerOf(viewer);
            SenderView pv = peerViews.getOrDefault(peer, SenderView.placeholder(peer));
            v.setPeer(pv);
            v.setName(pv.getDisplayName());
        }
        return v;
    }
}
