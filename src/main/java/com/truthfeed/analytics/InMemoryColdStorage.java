package com.truthfeed.analytics;

import com.truthfeed.bus.FeedEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryColdStorage implements ColdStorage {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<FeedEvent>> archives = new ConcurrentHashMap<>();

    @Override
    public void store(String feedId, List<FeedEvent> events) {
        archives.computeIfAbsent(feedId, id -> new CopyOnWriteArrayList<>()).addAll(events);
    }

    @Override
    public List<FeedEvent> archived(String feedId) {
        List<FeedEvent> archive = archives.get(feedId);
        return archive == null ? List.of() : List.copyOf(archive);
    }
}
