package com.truthfeed.api;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.bus.FeedEventService;
import com.truthfeed.bus.FeedVerification;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Feed endpoints. Every route exists for the global feed of a type and for
 * a per-subject feed:
 *
 * POST /v1/feeds/{type}[/{subject}]/events
 * GET  /v1/feeds/{type}[/{subject}]/events?since=&limit=
 * GET  /v1/feeds/{type}[/{subject}]/rss?limit=
 * GET  /v1/feeds/{type}[/{subject}]/verify
 */
@RestController
@RequestMapping("/v1/feeds")
public class FeedController {

    public static final String RSS_CONTENT_TYPE = "application/rss+xml";

    private final FeedEventService feedEventService;
    private final FeedRegistry feedRegistry;
    private final RssFeedWriter rssFeedWriter;
    private final Clock clock;

    public FeedController(FeedEventService feedEventService,
                          FeedRegistry feedRegistry,
                          RssFeedWriter rssFeedWriter,
                          Clock clock) {
        this.feedEventService = feedEventService;
        this.feedRegistry = feedRegistry;
        this.rssFeedWriter = rssFeedWriter;
        this.clock = clock;
    }

    @GetMapping
    public List<Feed> listFeeds() {
        return feedRegistry.allFeeds();
    }

    @PostMapping("/{type}/events")
    public ResponseEntity<FeedEvent> appendGlobal(@PathVariable String type,
                                                  @RequestBody AppendEventRequest request) {
        return append(FeedPaths.ref(type, null), request);
    }

    @PostMapping("/{type}/{subject}/events")
    public ResponseEntity<FeedEvent> appendSubject(@PathVariable String type,
                                                   @PathVariable String subject,
                                                   @RequestBody AppendEventRequest request) {
        return append(FeedPaths.ref(type, subject), request);
    }

    @GetMapping("/{type}/events")
    public List<FeedEvent> eventsGlobal(@PathVariable String type,
                                        @RequestParam(defaultValue = "0") long since,
                                        @RequestParam(defaultValue = "100") int limit) {
        return feedEventService.events(FeedPaths.ref(type, null), since, FeedPaths.clampLimit(limit));
    }

    @GetMapping("/{type}/{subject}/events")
    public List<FeedEvent> eventsSubject(@PathVariable String type,
                                         @PathVariable String subject,
                                         @RequestParam(defaultValue = "0") long since,
                                         @RequestParam(defaultValue = "100") int limit) {
        return feedEventService.events(FeedPaths.ref(type, subject), since, FeedPaths.clampLimit(limit));
    }

    @GetMapping(value = "/{type}/rss", produces = RSS_CONTENT_TYPE)
    public String rssGlobal(@PathVariable String type, @RequestParam(defaultValue = "50") int limit) {
        return rss(FeedPaths.ref(type, null), limit);
    }

    @GetMapping(value = "/{type}/{subject}/rss", produces = RSS_CONTENT_TYPE)
    public String rssSubject(@PathVariable String type,
                             @PathVariable String subject,
                             @RequestParam(defaultValue = "50") int limit) {
        return rss(FeedPaths.ref(type, subject), limit);
    }

    @GetMapping("/{type}/verify")
    public FeedVerification verifyGlobal(@PathVariable String type) {
        return feedEventService.verifyFeed(FeedPaths.ref(type, null));
    }

    @GetMapping("/{type}/{subject}/verify")
    public FeedVerification verifySubject(@PathVariable String type, @PathVariable String subject) {
        return feedEventService.verifyFeed(FeedPaths.ref(type, subject));
    }

    private ResponseEntity<FeedEvent> append(FeedRef ref, AppendEventRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        FeedEvent event = feedEventService.appendEvent(ref, request.eventType(), request.payload(),
            FeedPaths.require(request.confidence(), "confidence"));
        return ResponseEntity.status(HttpStatus.CREATED)
            .contentType(MediaType.APPLICATION_JSON)
            .body(event);
    }

    private String rss(FeedRef ref, int limit) {
        Feed feed = feedRegistry.lookupFeed(ref);
        List<FeedEvent> all = feedEventService.events(ref, Long.MIN_VALUE, Integer.MAX_VALUE);
        List<FeedEvent> newestFirst = new ArrayList<>(all.subList(Math.max(0, all.size() - FeedPaths.clampLimit(limit)),
            all.size()));
        Collections.reverse(newestFirst);
        return rssFeedWriter.write(feed, newestFirst, clock.instant());
    }
}
