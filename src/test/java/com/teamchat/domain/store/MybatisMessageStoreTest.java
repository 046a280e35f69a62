package com.teamchat.domain.store;

import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.mapper.MessageMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MybatisMessageStoreTest {

    private final MessageMapper mapper = mock(MessageMapper.class);
    private final ChannelSeqAllocator allocator = mock(ChannelSeqAllocator.class);
    private final MybatisMessageStore store = new MybatisMessageStore(mapper, allocator);

    @Test
    void insert_allocatesSeqBeforeWritingRow() {
        when(allocator.next(7L)).thenReturn(12L);
        MessageEntity m = new MessageEntity();
        m.setId(900L);
        m.setChannelId(7L);

        store.insert(m);

        InOrder order = inOrder(allocator, mapper);
        order.verify(allocator).next(7L);
        ArgumentCaptor<MessageEntity> row = ArgumentCaptor.forClass(MessageEntity.class);
        order.verify(mapper).insert(row.capture());
        assertThat(row.getValue().getSeq()).isEqualTo(12L);
    }

    @Test
    void insert_unknownChannel_writesNothing() {
        when(allocator.next(8L)).thenThrow(new IllegalStateException("allocate seq failed: channel 8 not found"));
        MessageEntity m = new MessageEntity();
        m.setId(901L);
        m.setChannelId(8L);

        assertThatThrownBy(() -> store.insert(m)).isInstanceOf(IllegalStateException.class);
        verify(mapper, never()).insert(any(MessageEntity.class));
    }
}
