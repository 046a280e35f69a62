package com.teamchat.domain.service;

import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.dto.UnreadTotalDto;
import com.teamchat.domain.model.MessageCursor;

import java.util.List;

/**
 * 对外写 API 的编排层：解析身份 -&gt; 频道 -&gt; 落库 -&gt; 事件扩散。
 *
 * <p>入参 subject 是经过令牌校验的身份提供方 subject；扩散与通知在写成功之后进行，失败不影响返回值。</p>
 */
public interface ChatAppService {

    MessageView send(String subject, SendMessageRequest request);

    MessagePage history(String subject, long channelId, MessageCursor cursor);

    /**
     * @return 调用后的已读游标；频道为空时为 null
     */
    Long markRead(String subject, long channelId, Long upToMessageId);

    List<ChannelView> channels(String subject);

    ChannelView openDirect(String subject, String peerRef);

    UnreadTotalDto unreadTotal(String subject);

    void typing(String subject, long channelId, boolean typing);

    MemberDto syncMe(String subject, String displayName, String email);

    List<MemberDto> members(String subject);
}
