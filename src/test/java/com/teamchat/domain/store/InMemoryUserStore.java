package com.teamchat.domain.store;

import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.enums.UserStatus;
import com.teamchat.domain.model.UserRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryUserStore implements UserStore {

    private final Map<String, UserEntity> bySubject = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong(1000);

    public UserRef add(String subject, String displayName) {
        upsert(subject, displayName, subject + "@example.com");
        return UserRef.of(subject);
    }

    public void remove(String subject) {
        bySubject.remove(subject);
    }

    @Override
    public UserEntity findBySubject(String subject) {
        return subject == null ? null : bySubject.get(subject);
    }

    @Override
    public Map<UserRef, UserEntity> findByRefs(Collection<UserRef> refs) {
        Map<UserRef, UserEntity> out = new HashMap<>();
        for (UserRef ref : refs) {
            UserEntity u = bySubject.get(ref.value());
            if (u != null) {
                out.put(ref, u);
            }
        }
        return out;
    }

    @Override
    public UserEntity upsert(String subject, String displayName, String email) {
        return bySubject.compute(subject, (k, old) -> {
            if (old == null) {
                return UserEntity.builder()
                        .id(seq.incrementAndGet())
                        .externalSubject(subject)
                        .displayName(displayName)
                        .email(email)
                        .status(UserStatus.ACTIVE)
                        .build();
            }
            old.setDisplayName(displayName);
            old.setEmail(email);
            return old;
        });
    }

    @Override
    public List<UserEntity> listActive() {
        List<UserEntity> out = new ArrayList<>();
        for (UserEntity u : bySubject.values()) {
            if (u.getStatus() == null || u.getStatus() == UserStatus.ACTIVE) {
                out.add(u);
            }
        }
        out.sort((a, b) -> a.getExternalSubject().compareTo(b.getExternalSubject()));
        return out;
    }
}
