package com.teamchat.domain.store;

import com.teamchat.domain.model.ReadMarker;
import com.teamchat.domain.model.UserRef;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReadStateStore implements ReadStateStore {

    private final Map<String, ReadMarker> markers = new ConcurrentHashMap<>();

    private static String key(UserRef userRef, long channelId) {
        return userRef.value() + "|" + channelId;
    }

    @Override
    public ReadMarker findLastRead(UserRef userRef, long channelId) {
        return markers.get(key(userRef, channelId));
    }

    @Override
    public Map<Long, ReadMarker> findLastReadByChannels(UserRef userRef, Collection<Long> channelIds) {
        Map<Long, ReadMarker> out = new HashMap<>();
        for (Long id : channelIds) {
            ReadMarker v = markers.get(key(userRef, id));
            if (v != null) {
                out.put(id, v);
            }
        }
        return out;
    }

    @Override
    public void advance(UserRef userRef, long channelId, ReadMarker marker, LocalDateTime readAt) {
        markers.merge(key(userRef, channelId), marker, (old, cur) -> cur.seq() > old.seq() ? cur : old);
    }
}
