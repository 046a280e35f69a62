package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.dto.UserSyncRequest;
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
public class ChatMemberController {

    private final ChatAppService chatAppService;

    /**
     * 登录后由前端调用一次：首次建档，之后刷新展示名/邮箱。
     */
    @PostMapping("/me/sync")
    public Result<MemberDto> syncMe(@Valid @RequestBody UserSyncRequest request) {
        return Result.ok(chatAppService.syncMe(AuthContext.requireSubject(), request.getDisplayName(), request.getEmail()));
    }

    /** 团队成员（不含自己）。 */
    @GetMapping("/members")
    public Result<List<MemberDto>> members() {
        return Result.ok(chatAppService.members(AuthContext.requireSubject()));
    }
}
