package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.domain.dto.ChannelView;
import com.teamchat.domain.dto.DirectChannelRequest;
import com.teamchat.domain.dto.UnreadTotalDto;
import com.teamchat.domain.service.ChatAppService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/chat")
public class ChatChannelController {

    private final ChatAppService chatAppService;

    /**
     * 当前用户的频道列表（公共频道 + 自己的私聊），按最近活跃排序，带未读数。
     */
    @GetMapping("/channels")
    public Result<List<ChannelView>> list() {
        return Result.ok(chatAppService.channels(AuthContext.requireSubject()));
    }

    /**
     * 打开与某人的私聊（不存在则创建）。
     */
    @PostMapping("/channels/direct")
    public Result<ChannelView> openDirect(@Valid @RequestBody DirectChannelRequest request) {
        return Result.ok(chatAppService.openDirect(AuthContext.requireSubject(), request.getPeerRef()));
    }

    @GetMapping("/unread/total")
    public Result<UnreadTotalDto> unreadTotal() {
        return Result.ok(chatAppService.unreadTotal(AuthContext.requireSubject()));
    }
}
