package com.teamchat.client;

import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.model.MessageCursor;

import java.util.concurrent.CompletableFuture;

/**
 * 客户端调用的写/读 API（HTTP 实现由宿主应用提供）。
 */
public interface ChatApi {

    CompletableFuture<MessageView> send(SendMessageRequest request);

    CompletableFuture<MessagePage> history(long channelId, MessageCursor cursor);
}
