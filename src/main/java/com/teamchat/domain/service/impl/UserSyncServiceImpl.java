package com.teamchat.domain.service.impl;

import com.teamchat.domain.dto.MemberDto;
import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.model.UserRef;
import com.teamchat.domain.service.UserSyncService;
import com.teamchat.domain.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserSyncServiceImpl implements UserSyncService {

    private final UserStore userStore;

    @Override
    public MemberDto sync(String externalSubject, String displayName, String email) {
        UserRef ref = UserRef.of(externalSubject);
        String name = displayName == null ? null : displayName.trim();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("display_name_required");
        }
        String mail = email == null || email.isBlank() ? null : email.trim();
        UserEntity saved = userStore.upsert(ref.value(), name, mail);
        if (saved == null) {
            throw new IllegalStateException("user sync lost row: " + ref);
        }
        log.debug("user synced: ref={}", ref);
        return new MemberDto(ref, saved.getDisplayName(), saved.getEmail());
    }
}
