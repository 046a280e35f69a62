package com.teamchat.client;

import com.teamchat.domain.dto.ChatEvent;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.enums.ChatEventType;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.TopicKey;
import com.teamchat.domain.model.UserRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个频道视图的客户端对账器。
 *
 * <ul>
 *   <li>发送：先插入以 clientNonce 为 key 的乐观消息；成功后换成规范消息（回声先到则直接丢弃乐观消息），
 *       失败则移除并恢复草稿</li>
 *   <li>同一时刻最多一条发送在途：compare-and-set 在任何异步操作之前完成</li>
 *   <li>推送事件进入有界队列，由单个循环线程按序处理；已存在的消息（同一 seq）不会重复合并</li>
 *   <li>渲染按频道内 seq 排序，乐观消息排在最后</li>
 *   <li>补拉从“连续已知的最后一条”开始：seq 在频道内连续，推送乱序或丢失造成的空洞都会被补上</li>
 * </ul>
 */
@Slf4j
public class ChannelViewReconciler implements AutoCloseable {

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;
    static final int REFRESH_PAGE_SIZE = MessageCursor.MAX_LIMIT;

    private final long channelId;
    private final UserRef me;
    private final ChatApi api;
    private final ChatEventSource eventSource;
    private final BlockingQueue<ChatEvent> inbox;

    private final AtomicBoolean sending = new AtomicBoolean(false);
    private final AtomicBoolean overflowed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object lock = new Object();
    /** seq -&gt; 规范消息。 */
    private final TreeMap<Long, MessageView> canonical = new TreeMap<>();
    private final LinkedHashMap<String, RenderedMessage> optimistic = new LinkedHashMap<>();
    private final Map<UserRef, ReadMarker> readMarkers = new HashMap<>();
    private final Set<UserRef> typing = new HashSet<>();
    private String draft = "";
    private String lastError;

    private ChatEventSource.Subscription subscription;
    private Thread loop;

    public ChannelViewReconciler(long channelId, UserRef me, ChatApi api, ChatEventSource eventSource) {
        this(channelId, me, api, eventSource, DEFAULT_QUEUE_CAPACITY);
    }

    public ChannelViewReconciler(long channelId, UserRef me, ChatApi api, ChatEventSource eventSource, int queueCapacity) {
        this.channelId = channelId;
        this.me = me;
        this.api = api;
        this.eventSource = eventSource;
        this.inbox = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    }

    /**
     * 订阅频道 topic 并启动处理线程。
     */
    public void start() {
        subscribe();
        loop = new Thread(this::runLoop, "chat-reconciler-" + channelId);
        loop.setDaemon(true);
        loop.start();
    }

    /**
     * 只订阅不启动线程：由调用方通过 {@link #drainPending()} 驱动（UI 线程自己轮询时使用）。
     */
    public void subscribe() {
        subscription = eventSource.subscribe(TopicKey.forChannel(channelId), this::offer);
    }

    /**
     * 发送。
     *
     * @return false 表示已有发送在途，本次被拒绝（草稿保持不变）
     */
    public boolean send(String content) {
        if (!sending.compareAndSet(false, true)) {
            return false;
        }
        String nonce = UUID.randomUUID().toString();
        synchronized (lock) {
            optimistic.put(nonce, new RenderedMessage(null, nonce, me, null, content, true));
            draft = "";
            lastError = null;
        }
        SendMessageRequest req = new SendMessageRequest();
        req.setChannelId(channelId);
        req.setContent(content);
        req.setClientNonce(nonce);

        CompletableFuture<MessageView> call;
        try {
            call = api.send(req);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((saved, err) -> {
            if (err != null || saved == null) {
                onSendFailed(nonce, content, err);
            } else {
                onSendSucceeded(nonce, saved);
            }
        });
        return true;
    }

    private void onSendSucceeded(String nonce, MessageView saved) {
        synchronized (lock) {
            optimistic.remove(nonce);
            if (saved.getSeq() != null) {
                canonical.putIfAbsent(saved.getSeq(), saved);
            }
        }
        sending.set(false);
    }

    private void onSendFailed(String nonce, String content, Throwable err) {
        synchronized (lock) {
            optimistic.remove(nonce);
            draft = content;
            lastError = err == null ? "send_failed" : rootMessage(err);
        }
        log.debug("send failed, draft restored: channelId={}, err={}", channelId, lastError);
        sending.set(false);
    }

    /**
     * 推送回调入口（任意线程）：只入队，不做处理。
     */
    void offer(ChatEvent event) {
        if (closed.get() || event == null) {
            return;
        }
        if (!inbox.offer(event)) {
            // 队列满：丢弃并在下一轮处理后用 refresh 补齐
            overflowed.set(true);
            log.warn("reconciler inbox full, event dropped: channelId={}, type={}", channelId, event.getEventType());
        }
    }

    /**
     * 处理当前队列里的全部事件。
     *
     * @return 处理的事件数
     */
    public int drainPending() {
        List<ChatEvent> batch = new ArrayList<>();
        inbox.drainTo(batch);
        for (ChatEvent e : batch) {
            apply(e);
        }
        if (overflowed.compareAndSet(true, false)) {
            refresh();
        }
        return batch.size();
    }

    private void runLoop() {
        while (!closed.get()) {
            try {
                apply(inbox.take());
                if (inbox.isEmpty() && overflowed.compareAndSet(true, false)) {
                    refresh();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.warn("reconciler event failed: channelId={}, err={}", channelId, e.toString());
            }
        }
    }

    void apply(ChatEvent event) {
        if (event.getChannelId() != null && event.getChannelId() != channelId) {
            return;
        }
        ChatEventType type = event.getEventType();
        if (type == null) {
            return;
        }
        synchronized (lock) {
            switch (type) {
                case MESSAGE_CREATED -> mergeMessage(event.getMessage());
                case CHANNEL_READ -> {
                    UserRef reader = event.getReaderRef();
                    if (reader != null && !reader.equals(me)
                            && event.getReadUpToMessageId() != null && event.getReadUpToSeq() != null) {
                        ReadMarker marker = new ReadMarker(event.getReadUpToSeq(), event.getReadUpToMessageId());
                        readMarkers.merge(reader, marker, (old, cur) -> cur.seq() > old.seq() ? cur : old);
                    }
                }
                case USER_TYPING -> {
                    UserRef actor = event.getActorRef();
                    if (actor != null && !actor.equals(me)) {
                        if (Boolean.FALSE.equals(event.getTyping())) {
                            typing.remove(actor);
                        } else {
                            typing.add(actor);
                        }
                    }
                }
                default -> {
                }
            }
        }
    }

    /** 调用方持有 lock。 */
    private void mergeMessage(MessageView m) {
        if (m == null || m.getSeq() == null) {
            return;
        }
        canonical.putIfAbsent(m.getSeq(), m);
        if (m.getClientNonce() != null && m.getSender() != null && me.equals(m.getSender().getRef())) {
            optimistic.remove(m.getClientNonce());
        }
        if (m.getSender() != null) {
            typing.remove(m.getSender().getRef());
        }
    }

    /**
     * 重连后补齐：从连续已知的最后一条之后拉取，直到没有更多；本地为空时拉最新一页。
     *
     * @return 新合并的消息数
     */
    public CompletableFuture<Integer> refresh() {
        Long from;
        synchronized (lock) {
            from = contiguousTailId();
        }
        MessageCursor cursor = from == null
                ? new MessageCursor(null, null, REFRESH_PAGE_SIZE)
                : new MessageCursor(null, from, REFRESH_PAGE_SIZE);
        return api.history(channelId, cursor).thenCompose(page -> {
            int merged = mergePage(page);
            if (from != null && page.isHasMore() && merged > 0) {
                return refresh().thenApply(more -> merged + more);
            }
            return CompletableFuture.completedFuture(merged);
        });
    }

    /**
     * 从最小的已知 seq 往后，最后一条没有空洞的消息 id；本地为空返回 null。调用方持有 lock。
     */
    private Long contiguousTailId() {
        if (canonical.isEmpty()) {
            return null;
        }
        long tail = canonical.firstKey();
        for (Long seq : canonical.tailMap(tail, false).keySet()) {
            if (seq != tail + 1) {
                break;
            }
            tail = seq;
        }
        return canonical.get(tail).getId();
    }

    private int mergePage(MessagePage page) {
        if (page == null || page.getMessages() == null) {
            return 0;
        }
        int merged = 0;
        synchronized (lock) {
            for (MessageView m : page.getMessages()) {
                if (m.getSeq() != null && !canonical.containsKey(m.getSeq())) {
                    mergeMessage(m);
                    merged++;
                }
            }
        }
        return merged;
    }

    /**
     * 当前渲染列表：规范消息按 seq 升序，乐观消息按发送顺序排在后面。
     */
    public List<RenderedMessage> render() {
        synchronized (lock) {
            List<RenderedMessage> out = new ArrayList<>(canonical.size() + optimistic.size());
            for (MessageView m : canonical.values()) {
                out.add(RenderedMessage.canonical(m));
            }
            out.addAll(optimistic.values());
            return out;
        }
    }

    public ReconcilerState state() {
        return sending.get() ? ReconcilerState.SENDING : ReconcilerState.IDLE;
    }

    public String draft() {
        synchronized (lock) {
            return draft;
        }
    }

    public void setDraft(String text) {
        synchronized (lock) {
            draft = text == null ? "" : text;
        }
    }

    public String lastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    /** 其他成员的已读位置（读回执），值为消息 id。 */
    public Map<UserRef, Long> readMarkers() {
        synchronized (lock) {
            Map<UserRef, Long> out = new HashMap<>();
            readMarkers.forEach((reader, marker) -> out.put(reader, marker.messageId()));
            return Map.copyOf(out);
        }
    }

    public Set<UserRef> typingUsers() {
        synchronized (lock) {
            return Set.copyOf(typing);
        }
    }

    /**
     * 停止监听；在途的发送不取消，完成后仍会更新本地状态。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (subscription != null) {
            try {
                subscription.close();
            } catch (RuntimeException e) {
                log.debug("unsubscribe failed: channelId={}, err={}", channelId, e.toString());
            }
        }
        if (loop != null) {
            loop.interrupt();
        }
        inbox.clear();
    }

    private static String rootMessage(Throwable err) {
        Throwable t = err;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
