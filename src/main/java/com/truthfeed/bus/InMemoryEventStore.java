package com.truthfeed.bus;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<FeedEvent>> logs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> feedByEventId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FeedCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public FeedEvent append(FeedEvent event) {
        CopyOnWriteArrayList<FeedEvent> log = logs.computeIfAbsent(event.feedId(), id -> new CopyOnWriteArrayList<>());
        if (!log.isEmpty() && log.get(log.size() - 1).sequenceNumber() >= event.sequenceNumber()) {
            throw new IllegalStateException("sequence_number " + event.sequenceNumber()
                + " does not advance feed " + event.feedId());
        }
        log.add(event);
        feedByEventId.put(event.eventId(), event.feedId());
        return event;
    }

    @Override
    public Optional<FeedEvent> lastEvent(String feedId) {
        List<FeedEvent> log = logs.get(feedId);
        if (log == null || log.isEmpty()) {
            return Optional.empty();
        }
        List<FeedEvent> copy = List.copyOf(log);
        return copy.isEmpty() ? Optional.empty() : Optional.of(copy.get(copy.size() - 1));
    }

    @Override
    public List<FeedEvent> events(String feedId, long afterSequence, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return snapshot(feedId).stream()
            .filter(e -> e.sequenceNumber() > afterSequence)
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<FeedEvent> snapshot(String feedId) {
        List<FeedEvent> log = logs.get(feedId);
        return log == null ? List.of() : List.copyOf(log);
    }

    @Override
    public Optional<FeedEvent> findByEventId(String eventId) {
        String feedId = feedByEventId.get(eventId);
        if (feedId == null) {
            return Optional.empty();
        }
        return snapshot(feedId).stream()
            .filter(e -> e.eventId().equals(eventId))
            .findFirst();
    }

    @Override
    public void updateAnchor(String eventId, String anchorReference) {
        String feedId = feedByEventId.get(eventId);
        if (feedId == null) {
            return;
        }
        CopyOnWriteArrayList<FeedEvent> log = logs.get(feedId);
        synchronized (log) {
            for (int i = 0; i < log.size(); i++) {
                FeedEvent event = log.get(i);
                if (event.eventId().equals(eventId)) {
                    log.set(i, event.withAnchor(anchorReference));
                    return;
                }
            }
        }
    }

    @Override
    public List<FeedEvent> removeThrough(String feedId, long sequenceInclusive) {
        CopyOnWriteArrayList<FeedEvent> log = logs.get(feedId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            List<FeedEvent> removed = log.stream()
                .filter(e -> e.sequenceNumber() <= sequenceInclusive)
                .collect(Collectors.toCollection(ArrayList::new));
            log.removeAll(removed);
            removed.forEach(e -> feedByEventId.remove(e.eventId()));
            return removed;
        }
    }

    @Override
    public void saveCheckpoint(FeedCheckpoint checkpoint) {
        checkpoints.put(checkpoint.feedId(), checkpoint);
    }

    @Override
    public Optional<FeedCheckpoint> latestCheckpoint(String feedId) {
        return Optional.ofNullable(checkpoints.get(feedId));
    }

    @Override
    public boolean updateCheckpointAnchor(String feedId, String checkpointHash, String anchorReference) {
        FeedCheckpoint updated = checkpoints.computeIfPresent(feedId, (id, current) ->
            current.checkpointHash().equals(checkpointHash) ? current.withAnchor(anchorReference) : current);
        return updated != null && anchorReference.equals(updated.anchorReference())
            && checkpointHash.equals(updated.checkpointHash());
    }
}
