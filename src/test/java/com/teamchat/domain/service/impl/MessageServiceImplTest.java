package com.teamchat.domain.service.impl;

import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.InvalidReplyException;
import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.model.AttachmentRef;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.model.NewMessage;
import com.teamchat.domain.model.UserRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageServiceImplTest {

    private ChatCoreFixture f;
    private UserRef alice;
    private UserRef bob;
    private long general;
    private long dm;

    @BeforeEach
    void setUp() {
        f = new ChatCoreFixture();
        alice = f.user("auth0|alice", "Alice");
        bob = f.user("auth0|bob", "Bob");
        general = f.channelService.provisionPublicChannel("general", null).getId();
        dm = f.channelService.findOrCreateDirectChannel(alice, bob);
    }

    @Test
    void append_returnsCanonicalMessage() {
        NewMessage draft = new NewMessage(general, alice, "pump 3 is leaking", null, null, "n-1");

        MessageView saved = f.messageService.append(draft);

        assertThat(saved.getId()).isNotNull();
        assertThat(saved.getChannelId()).isEqualTo(general);
        assertThat(saved.getSender().getRef()).isEqualTo(alice);
        assertThat(saved.getSender().getDisplayName()).isEqualTo("Alice");
        assertThat(saved.getClientNonce()).isEqualTo("n-1");
        assertThat(saved.getCreatedAt()).isEqualTo(LocalDateTime.now(f.clock));
        assertThat(saved.getAttachments()).isEmpty();
    }

    @Test
    void listMessages_returnsAscendingOrder_andPagesBackwards() {
        long m1 = f.post(general, alice, "one");
        long m2 = f.post(general, bob, "two");
        long m3 = f.post(general, alice, "three");

        MessagePage latest = f.messageService.listMessages(bob, general, MessageCursor.of(null, null, 2));
        assertThat(latest.getMessages()).extracting(MessageView::getId).containsExactly(m2, m3);
        assertThat(latest.isHasMore()).isTrue();
        assertThat(latest.getNextBeforeId()).isEqualTo(m2);

        MessagePage older = f.messageService.listMessages(bob, general, MessageCursor.of(latest.getNextBeforeId(), null, 2));
        assertThat(older.getMessages()).extracting(MessageView::getId).containsExactly(m1);
        assertThat(older.isHasMore()).isFalse();
        assertThat(older.getNextBeforeId()).isNull();
    }

    @Test
    void listMessages_afterId_catchesUpInOrder() {
        long m1 = f.post(general, alice, "one");
        long m2 = f.post(general, bob, "two");
        long m3 = f.post(general, alice, "three");

        MessagePage page = f.messageService.listMessages(alice, general, MessageCursor.of(null, m1, 10));

        assertThat(page.getMessages()).extracting(MessageView::getId).containsExactly(m2, m3);
        assertThat(page.isHasMore()).isFalse();
    }

    @Test
    void listMessages_senderMissingFromDirectory_rendersPlaceholder() {
        f.post(general, bob, "bye");
        f.users.remove("auth0|bob");

        MessagePage page = f.messageService.listMessages(alice, general, MessageCursor.latest());

        assertThat(page.getMessages()).hasSize(1);
        MessageView v = page.getMessages().get(0);
        assertThat(v.getContent()).isEqualTo("bye");
        assertThat(v.getSender().getRef()).isEqualTo(bob);
        assertThat(v.getSender().isResolved()).isFalse();
        assertThat(v.getSender().getDisplayName()).isEqualTo("Unknown user");
    }

    @Test
    void append_replyInSameChannel_carriesPreview() {
        long original = f.post(general, bob, "  who has the torque wrench?  ");

        MessageView reply = f.messageService.append(NewMessage.text(general, alice, "me").replyingTo(original));

        assertThat(reply.getReplyToId()).isEqualTo(original);
        assertThat(reply.getReplyPreview().getSenderName()).isEqualTo("Bob");
        assertThat(reply.getReplyPreview().getSnippet()).isEqualTo("who has the torque wrench?");
    }

    @Test
    void append_replyToOtherChannel_isRejected() {
        long elsewhere = f.post(dm, bob, "private");
        int before = f.messages.size();

        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(general, alice, "x").replyingTo(elsewhere)))
                .isInstanceOf(InvalidReplyException.class);
        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(general, alice, "x").replyingTo(424242L)))
                .isInstanceOf(InvalidReplyException.class);
        assertThat(f.messages.size()).isEqualTo(before);
    }

    @Test
    void append_blankWithoutAttachments_isRejected() {
        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(general, alice, "   ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("content_blank");
        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(general, alice, "x".repeat(4001))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("content_too_long");
    }

    @Test
    void append_attachmentOnly_isAccepted() {
        AttachmentRef photo = new AttachmentRef("https://files.example.com/a.png", "image", "a.png", "f-1");

        MessageView saved = f.messageService.append(
                new NewMessage(general, alice, null, null, List.of(photo), null));

        assertThat(saved.getContent()).isEmpty();
        assertThat(saved.getAttachments()).containsExactly(photo);
    }

    @Test
    void append_outsider_cannotPostIntoDirectChannel() {
        UserRef carol = f.user("auth0|carol", "Carol");

        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(dm, carol, "hello")))
                .isInstanceOf(ChannelAccessDeniedException.class);
        assertThatThrownBy(() -> f.messageService.append(NewMessage.text(general, UserRef.of("ghost"), "boo")))
                .isInstanceOf(UnknownIdentityException.class);
    }

    @Test
    void catchUp_includesMessageCommittedAfterCursor_evenWithSmallerId() {
        long slowId = f.messageService.allocateId();
        long fast = f.post(general, bob, "fast");

        MessageView slow = f.messageService.append(slowId, NewMessage.text(general, bob, "slow"));

        assertThat(slow.getId()).isLessThan(fast);
        MessagePage catchUp = f.messageService.listMessages(alice, general, MessageCursor.of(null, fast, 50));
        assertThat(catchUp.getMessages()).extracting(MessageView::getId).containsExactly(slowId);
        assertThat(f.messageService.latestMessageId(general)).isEqualTo(slowId);
        MessagePage latest = f.messageService.listMessages(alice, general, MessageCursor.latest());
        assertThat(latest.getMessages()).extracting(MessageView::getId).containsExactly(fast, slowId);
        assertThat(latest.getMessages()).extracting(MessageView::getSeq).containsExactly(1L, 2L);
    }

    @Test
    void listMessages_cursorFromAnotherChannel_isRejected() {
        long elsewhere = f.post(dm, bob, "dm");
        f.post(general, bob, "public");

        assertThatThrownBy(() -> f.messageService.listMessages(alice, general, MessageCursor.of(null, elsewhere, 10)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("cursor_not_in_channel");
    }

    @Test
    void concurrentAppends_acrossChannels_keepEachChannelOrderedAndIsolated() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                long target = t % 2 == 0 ? general : dm;
                UserRef sender = t < 2 ? alice : bob;
                tasks.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 25; i++) {
                        f.post(target, sender, "m" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (long channel : new long[]{general, dm}) {
            List<MessageView> page = f.messageService.listMessages(alice, channel, MessageCursor.of(null, null, 100)).getMessages();
            assertThat(page).hasSize(50);
            assertThat(page).allSatisfy(m -> assertThat(m.getChannelId()).isEqualTo(channel));
            assertThat(page).extracting(MessageView::getSeq).containsExactlyElementsOf(
                    LongStream.rangeClosed(1, 50).boxed().toList());
        }
    }
}
