package com.teamchat.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.enums.UserStatus;
import com.teamchat.domain.mapper.UserMapper;
import com.teamchat.domain.model.UserRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MybatisUserStore implements UserStore {

    private final UserMapper userMapper;

    @Override
    public UserEntity findBySubject(String subject) {
        if (subject == null || subject.isBlank()) {
            return null;
        }
        return userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getExternalSubject, subject)
                .last("limit 1"));
    }

    @Override
    public Map<UserRef, UserEntity> findByRefs(Collection<UserRef> refs) {
        Map<UserRef, UserEntity> out = new HashMap<>();
        if (refs == null || refs.isEmpty()) {
            return out;
        }
        List<String> subjects = refs.stream().map(UserRef::value).distinct().toList();
        List<UserEntity> rows = userMapper.selectList(new LambdaQueryWrapper<UserEntity>()
                .in(UserEntity::getExternalSubject, subjects));
        for (UserEntity u : rows) {
            out.put(UserRef.of(u.getExternalSubject()), u);
        }
        return out;
    }

    @Override
    public UserEntity upsert(String subject, String displayName, String email) {
        userMapper.upsertBySubject(IdWorker.getId(), subject, displayName, email);
        return findBySubject(subject);
    }

    @Override
    public List<UserEntity> listActive() {
        return userMapper.selectList(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getStatus, UserStatus.ACTIVE)
                .orderByAsc(UserEntity::getDisplayName));
    }
}
