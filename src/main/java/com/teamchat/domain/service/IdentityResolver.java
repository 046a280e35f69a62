package com.teamchat.domain.service;

import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.dto.SenderView;
import com.teamchat.domain.model.UserRef;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 身份解析：把身份提供方的 subject 映射为消息核心使用的 {@link UserRef}。
 *
 * <p>所有“是不是我”“谁发的”的比较都使用这里返回的值。</p>
 */
public interface IdentityResolver {

    /**
     * 纯查询，不创建用户。
     *
     * @throws UnknownIdentityException subject 不在用户目录中
     */
    UserRef resolve(String externalSubject);

    boolean isKnown(UserRef userRef);

    Optional<SenderView> describe(UserRef userRef);

    /**
     * 批量取展示信息；目录里找不到的 ref 返回占位，结果覆盖所有入参。
     */
    Map<UserRef, SenderView> describeAll(Collection<UserRef> userRefs);

    /** 团队成员列表（不含 self）。 */
    List<MemberDto> listMembers(UserRef self);
}
