package com.teamchat.domain.service.impl;

import com.teamchat.common.error.UnknownIdentityException;
import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.dto.SenderView;
import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.IdentityResolver;
import com.teamchat.domain.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolverImpl implements IdentityResolver {

    private final UserStore userStore;

    @Override
    public UserRef resolve(String externalSubject) {
        UserEntity user = userStore.findBySubject(externalSubject);
        if (user == null) {
            log.debug("identity not found: subject={}", externalSubject);
            throw new UnknownIdentityException(externalSubject);
        }
        return UserRef.of(user.getExternalSubject());
    }

    @Override
    public boolean isKnown(UserRef userRef) {
        return userRef != null && userStore.findBySubject(userRef.value()) != null;
    }

    @Override
    public Optional<SenderView> describe(UserRef userRef) {
        if (userRef == null) {
            return Optional.empty();
        }
        UserEntity user = userStore.findBySubject(userRef.value());
        return Optional.ofNullable(user).map(IdentityResolverImpl::toSender);
    }

    @Override
    public Map<UserRef, SenderView> describeAll(Collection<UserRef> userRefs) {
        Map<UserRef, SenderView> out = new HashMap<>();
        if (userRefs == null || userRefs.isEmpty()) {
            return out;
        }
        Map<UserRef, UserEntity> found = userStore.findByRefs(userRefs);
        for (UserRef ref : userRefs) {
            UserEntity u = found.get(ref);
            out.put(ref, u == null ? SenderView.placeholder(ref) : toSender(u));
        }
        if (found.size() < out.size()) {
            log.debug("describeAll: {} of {} refs unresolved", out.size() - found.size(), out.size());
        }
        return out;
    }

    @Override
    public List<MemberDto> listMembers(UserRef self) {
        List<MemberDto> out = new ArrayList<>();
        for (UserEntity u : userStore.listActive()) {
            if (self != null && self.value().equals(u.getExternalSubject())) {
                continue;
            }
            out.add(new MemberDto(UserRef.of(u.getExternalSubject()), u.getDisplayName(), u.getEmail()));
        }
        return out;
    }

    private static SenderView toSender(UserEntity u) {
        String name = u.getDisplayName() == null || u.getDisplayName().isBlank()
                ? u.getExternalSubject()
                : u.getDisplayName();
        return new SenderView(UserRef.of(u.getExternalSubject()), name, u.getEmail(), true);
    }
}
