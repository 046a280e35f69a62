package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.domain.dto.MarkReadRequest;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.dto.MessageView;
import com.teamchat.domain.dto.ReadMarkerDto;
import com.teamchat.domain.dto.SendMessageRequest;
import com.teamchat.domain.dto.TypingRequest;
import com.teamchat.domain.model.MessageCursor;
import com.teamchat.domain.service.ChatAppService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/chat")
public class ChatMessageController {

    private final ChatAppService chatAppService;

    /**
     * 发消息：channelId 或 peerRef 二选一；返回落库后的规范消息（同时会通过 WS 推给所有订阅者，包括自己）。
     */
    @PostMapping("/messages")
    public Result<MessageView> send(@Valid @RequestBody SendMessageRequest request) {
        return Result.ok(chatAppService.send(AuthContext.requireSubject(), request));
    }

    /**
     * 历史消息：beforeId 向前翻页，afterId 重连补齐；结果按频道内 seq 升序。
     */
    @GetMapping("/channels/{channelId}/messages")
    public Result<MessagePage> history(@PathVariable long channelId,
                                       @RequestParam(required = false) Long beforeId,
                                       @RequestParam(required = false) Long afterId,
                                       @RequestParam(required = false) Integer limit) {
        return Result.ok(chatAppService.history(AuthContext.requireSubject(), channelId,
                MessageCursor.of(beforeId, afterId, limit)));
    }

    @PostMapping("/channels/{channelId}/read")
    public Result<ReadMarkerDto> markRead(@PathVariable long channelId,
                                          @RequestBody(required = false) MarkReadRequest request) {
        Long upTo = request == null ? null : request.getUpToMessageId();
        Long marker = chatAppService.markRead(AuthContext.requireSubject(), channelId, upTo);
        return Result.ok(new ReadMarkerDto(channelId, marker));
    }

    @PostMapping("/channels/{channelId}/typing")
    public Result<Void> typing(@PathVariable long channelId,
                               @RequestBody(required = false) TypingRequest request) {
        boolean typing = request == null || request.isTyping();
        chatAppService.typing(AuthContext.requireSubject(), channelId, typing);
        return Result.okVoid();
    }
}
