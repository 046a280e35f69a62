package com.teamchat.domain.service.impl;

import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.ReplyPreview;
import com.teamchat.domain.dto.SenderView;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MessageEntity -&gt; MessageView：批量补齐发送者（外连接语义，缺失时用占位）与回复预览。
 */
@Component
@RequiredArgsConstructor
public class MessageViewAssembler {

    static final int SNIPPET_MAX = 120;

    private final IdentityResolver identityResolver;
    private final MessageStore messageStore;

    public MessageView assemble(MessageEntity message) {
        return assembleAll(List.of(message)).get(0);
    }

    /**
     * 保持入参顺序。
     */
    public List<MessageView> assembleAll(Collection<MessageEntity> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        Set<Long> replyIds = new HashSet<>();
        for (MessageEntity m : messages) {
            if (m.getReplyToId() != null) {
                replyIds.add(m.getReplyToId());
            }
        }
        Map<Long, MessageEntity> replies = new HashMap<>();
        if (!replyIds.isEmpty()) {
            for (MessageEntity r : messageStore.findByIds(replyIds)) {
                replies.put(r.getId(), r);
            }
        }

        Set<UserRef> refs = new HashSet<>();
        for (MessageEntity m : messages) {
            refs.add(UserRef.of(m.getSenderRef()));
        }
        for (MessageEntity r : replies.values()) {
            refs.add(UserRef.of(r.getSenderRef()));
        }
        Map<UserRef, SenderView> senders = identityResolver.describeAll(refs);

        List<MessageView> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            MessageView v = new MessageView();
            v.setId(m.getId());
            v.setSeq(m.getSeq());
            v.setChannelId(m.getChannelId());
            UserRef sender = UserRef.of(m.getSenderRef());
            v.setSender(senders.getOrDefault(sender, SenderView.placeholder(sender)));
            v.setContent(m.getContent());
            v.setReplyToId(m.getReplyToId());
            v.setAttachments(m.getAttachments() == null ? List.of() : m.getAttachments());
            v.setClientNonce(m.getClientNonce());
            v.setCreatedAt(m.getCreatedAt());
            MessageEntity replied = m.getReplyToId() == null ? null : replies.get(m.getReplyToId());
            if (replied != null) {
                UserRef rs = UserRef.of(replied.getSenderRef());
                String name = senders.getOrDefault(rs, SenderView.placeholder(rs)).getDisplayName();
                v.setReplyPreview(new ReplyPreview(replied.getId(), name, snippet(replied.getContent())));
            }
            out.add(v);
        }
        return out;
    }

    static String snippet(String content) {
        if (content == null) {
            return "";
        }
        String s = content.strip();
        return s.length() <= SNIPPET_MAX ? s : s.substring(0, SNIPPET_MAX);
    }
}
