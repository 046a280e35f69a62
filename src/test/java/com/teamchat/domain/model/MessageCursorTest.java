package com.teamchat.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCursorTest {

    @Test
    void limit_isDefaultedAndCapped() {
        assertThat(MessageCursor.of(null, null, null).limit()).isEqualTo(MessageCursor.DEFAULT_LIMIT);
        assertThat(MessageCursor.of(null, null, 0).limit()).isEqualTo(MessageCursor.DEFAULT_LIMIT);
        assertThat(MessageCursor.of(null, null, 10_000).limit()).isEqualTo(MessageCursor.MAX_LIMIT);
    }

    @Test
    void afterId_marksCatchUp() {
        assertThat(MessageCursor.of(50L, 10L, 20).isCatchUp()).isTrue();
        assertThat(MessageCursor.of(50L, null, 20).isCatchUp()).isFalse();
        assertThat(MessageCursor.of(-1L, -1L, 20)).isEqualTo(new MessageCursor(null, null, 20));
    }
}
