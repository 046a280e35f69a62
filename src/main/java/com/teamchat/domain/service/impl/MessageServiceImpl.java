package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.InvalidReplyException;
import com.teamchat.common.error.TransientWrites;
import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.model.NewMessage;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ChannelService;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.domain.service.MessageService;
import com.teamchat.domain.store.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class MessageServiceImpl implements MessageService {

    public static final int MAX_CONTENT_LENGTH = 4000;

    private final ChannelService channelService;
    private final IdentityResolver identityResolver;
    private final MessageStore messageStore;
    private final MessageViewAssembler messageViewAssembler;
    private final IdentifierGenerator identifierGenerator;
    private final Clock clock;

    public MessageServiceImpl(ChannelService channelService,
                              IdentityResolver identityResolver,
                              MessageStore messageStore,
                              MessageViewAssembler messageViewAssembler,
                              IdentifierGenerator identifierGenerator,
                              Clock clock) {
        this.channelService = channelService;
        this.identityResolver = identityResolver;
        this.messageStore = messageStore;
        this.messageViewAssembler = messageViewAssembler;
        this.identifierGenerator = identifierGenerator;
        this.clock = clock;
    }

    @Override
    public long allocateId() {
        return identifierGenerator.nextId(null).longValue();
    }

    @Override
    public MessageView append(long messageId, NewMessage message) {
        validateContent(message);
        ChannelEntity channel = channelService.requireChannel(message.channelId());
        UserRef sender = message.senderRef();
        if (!identityResolver.isKnown(sender)) {
            throw new UnknownIdentityException(sender == null ? null : sender.value());
        }
        if (!channelService.canAccess(sender, channel)) {
            throw new ChannelAccessDeniedException();
        }
        if (message.replyToId() != null) {
            MessageEntity target = messageStore.findById(message.replyToId());
            if (target == null || !target.getChannelId().equals(channel.getId())) {
                throw new InvalidReplyException(channel.getId(), message.replyToId());
            }
        }

        MessageEntity m = new MessageEntity();
        m.setId(messageId);
        m.setChannelId(channel.getId());
        m.setSenderRef(sender.value());
        m.setContent(message.content() == null ? "" : message.content());
        m.setReplyToId(message.replyToId());
        m.setAttachments(message.attachments().isEmpty() ? null : message.attachments());
        m.setClientNonce(message.clientNonce());
        m.setCreatedAt(LocalDateTime.now(clock));
        TransientWrites.run(() -> messageStore.insert(m));
        log.debug("message appended: id={}, channelId={}, sender={}", m.getId(), m.getChannelId(), sender);
        return messageViewAssembler.assemble(m);
    }

    @Override
    public MessageView getView(long messageId) {
        MessageEntity m = messageStore.findById(messageId);
        return m == null ? null : messageViewAssembler.assemble(m);
    }

    @Override
    public MessagePage listMessages(UserRef viewer, long channelId, MessageCursor cursor) {
        MessageCursor c = cursor == null ? MessageCursor.latest() : cursor;
        channelService.requireAccessible(viewer, channelId);

        Long beforeSeq = c.beforeId() == null ? null : seqOf(channelId, c.beforeId());
        Long afterSeq = c.afterId() == null ? null : seqOf(channelId, c.afterId());
        List<MessageEntity> rows = new ArrayList<>(
                messageStore.listPage(channelId, beforeSeq, afterSeq, c.limit() + 1));
        boolean hasMore = rows.size() > c.limit();
        if (hasMore) {
            rows = new ArrayList<>(rows.subList(0, c.limit()));
        }
        if (!c.isCatchUp()) {
            // 向前翻页时存储层按 seq 降序返回
            Collections.reverse(rows);
        }
        Long nextBeforeId = !c.isCatchUp() && hasMore && !rows.isEmpty() ? rows.get(0).getId() : null;
        return new MessagePage(messageViewAssembler.assembleAll(rows), hasMore, nextBeforeId);
    }

    @Override
    public Long latestMessageId(long channelId) {
        MessageEntity latest = messageStore.findLatest(channelId);
        return latest == null ? null : latest.getId();
    }

    /**
     * 游标对外是消息 id，对内换成频道内 seq；id 只用来定位，不参与比较。
     */
    private Long seqOf(long channelId, long messageId) {
        MessageEntity m = messageStore.findById(messageId);
        if (m == null || m.getChannelId() != channelId) {
            throw new IllegalArgumentException("cursor_not_in_channel");
        }
        return m.getSeq();
    }

    private static void validateContent(NewMessage message) {
        String content = message.content();
        boolean blank = content == null || content.isBlank();
        if (blank && message.attachments().isEmpty()) {
            throw new IllegalArgumentException("content_blank");
        }
        if (content != null && content.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("content_too_long");
        }
    }
}
