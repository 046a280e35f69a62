package com.teamchat.gateway.ws;

import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.ChannelService;
import com.teamchat.domain.service.ChatAppService;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.gateway.session.SessionRegistry;
import com.teamchat.gateway.session.TopicSubscriptionRegistry;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * WS 连接上需要查库的操作，统一丢到 chatDbExecutor 执行，不占用 eventLoop。
 */
@Slf4j
@Component
public class WsSessionBootstrapper {

    private final IdentityResolver identityResolver;
    private final ChannelService channelService;
    private final ChatAppService chatAppService;
    private final SessionRegistry sessionRegistry;
    private final TopicSubscriptionRegistry subscriptions;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    public WsSessionBootstrapper(IdentityResolver identityResolver,
                                 ChannelService channelService,
                                 ChatAppService chatAppService,
                                 SessionRegistry sessionRegistry,
                                 TopicSubscriptionRegistry subscriptions,
                                 WsWriter wsWriter,
                                 @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.identityResolver = identityResolver;
        this.channelService = channelService;
        this.chatAppService = chatAppService;
        this.sessionRegistry = sessionRegistry;
        this.subscriptions = subscriptions;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    /**
     * 握手完成后：subject -&gt; UserRef，绑定会话，订阅个人 topic 与所有可访问频道，然后回 READY。
     */
    public void bootstrap(Channel ch) {
        String subject = ch.attr(SessionRegistry.ATTR_SUBJECT).get();
        if (subject == null) {
            wsWriter.writeError(ch, "unauthorized");
            ch.close();
            return;
        }
        submit(ch, () -> {
            UserRef me;
            try {
                me = identityResolver.resolve(subject);
            } catch (UnknownIdentityException e) {
                wsWriter.writeError(ch, "unknown_identity").addListener(f -> ch.close());
                return;
            }
            if (!ch.isActive()) {
                return;
            }
            sessionRegistry.bind(ch, me);
            subscriptions.subscribe(ch, TopicKey.forUser(me));
            int n = 0;
            for (ChannelEntity c : channelService.listAccessible(me)) {
                subscriptions.subscribe(ch, channelService.resolveTopicFor(c));
                n++;
            }
            log.debug("ws session ready: userRef={}, channels={}, ch={}", me, n, ch.id().asShortText());
            wsWriter.write(ch, WsEnvelope.of(WsEnvelope.READY));
        });
    }

    public void subscribe(Channel ch, String rawTopic) {
        UserRef me = sessionRegistry.userRefOf(ch);
        TopicKey topic = parseTopic(ch, rawTopic);
        if (me == null || topic == null) {
            return;
        }
        if (topic.isUserTopic()) {
            if (!topic.equals(TopicKey.forUser(me))) {
                wsWriter.writeError(ch, "channel_access_denied");
                return;
            }
            subscriptions.subscribe(ch, topic);
            wsWriter.write(ch, subscribed(WsEnvelope.SUBSCRIBED, topic));
            return;
        }
        submit(ch, () -> {
            try {
                channelService.requireAccessible(me, topic.channelId());
            } catch (ChatException e) {
                wsWriter.writeError(ch, e.getMessage());
                return;
            }
            subscriptions.subscribe(ch, topic);
            wsWriter.write(ch, subscribed(WsEnvelope.SUBSCRIBED, topic));
        });
    }

    public void unsubscribe(Channel ch, String rawTopic) {
        TopicKey topic = parseTopic(ch, rawTopic);
        if (topic == null) {
            return;
        }
        subscriptions.unsubscribe(ch, topic);
        wsWriter.write(ch, subscribed(WsEnvelope.UNSUBSCRIBED, topic));
    }

    public void typing(Channel ch, Long channelId, boolean typing) {
        String subject = ch.attr(SessionRegistry.ATTR_SUBJECT).get();
        if (channelId == null || channelId <= 0) {
            wsWriter.writeError(ch, "missing_channel_id");
            return;
        }
        submit(ch, () -> {
            try {
                chatAppService.typing(subject, channelId, typing);
            } catch (ChatException e) {
                wsWriter.writeError(ch, e.getMessage());
            }
        });
    }

    private TopicKey parseTopic(Channel ch, String rawTopic) {
        try {
            TopicKey topic = TopicKey.of(rawTopic);
            if (topic.isChannelTopic() && topic.channelId() == null) {
                throw new IllegalArgumentException("bad_topic");
            }
            if (!topic.isChannelTopic() && !topic.isUserTopic()) {
                throw new IllegalArgumentException("bad_topic");
            }
            return topic;
        } catch (RuntimeException e) {
            wsWriter.writeError(ch, "bad_topic");
            return null;
        }
    }

    private static WsEnvelope subscribed(String type, TopicKey topic) {
        WsEnvelope env = WsEnvelope.of(type);
        env.setTopic(topic.value());
        return env;
    }

    private void submit(Channel ch, Runnable task) {
        try {
            dbExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.warn("ws task failed: ch={}, err={}", ch.id().asShortText(), e.toString());
                    wsWriter.writeError(ch, "internal_error");
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("ws task rejected (db executor full): ch={}", ch.id().asShortText());
            wsWriter.writeError(ch, "server_busy");
        }
    }
}
