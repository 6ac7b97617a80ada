package com.truthfeed.api;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.subscription.StreamSink;
import com.truthfeed.subscription.Subscription;
import com.truthfeed.subscription.SubscriptionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/v1/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubscriptionCreatedResponse subscribe(@RequestBody CreateSubscriptionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        Subscription subscription = subscriptionService.subscribe(
            request.subscriberId(),
            request.feeds(),
            request.filters(),
            request.deliveryMode(),
            request.endpoint(),
            request.rateLimit()
        );
        return new SubscriptionCreatedResponse(subscription, subscription.getWebhookSecret());
    }

    @GetMapping("/{id}")
    public Subscription get(@PathVariable String id) {
        return subscriptionService.get(id);
    }

    @DeleteMapping("/{id}")
    public Subscription unsubscribe(@PathVariable String id) {
        return subscriptionService.unsubscribe(id);
    }

    @GetMapping("/{id}/events")
    public List<FeedEvent> poll(@PathVariable String id, @RequestParam(defaultValue = "100") int max) {
        return subscriptionService.poll(id, max);
    }

    /**
     * Server-sent events for a stream-mode subscription. Events published
     * while no stream is attached are not replayed.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        SseEmitter emitter = new SseEmitter(0L);
        StreamSink sink = new StreamSink() {
            @Override
            public void send(FeedEvent event) throws IOException {
                emitter.send(SseEmitter.event()
                    .id(event.eventId())
                    .name("feed_event")
                    .data(event));
            }

            @Override
            public void close() {
                emitter.complete();
            }
        };
        subscriptionService.attachStream(id, sink);

        emitter.onCompletion(() -> subscriptionService.detachStream(id, sink));
        emitter.onTimeout(() -> subscriptionService.detachStream(id, sink));
        emitter.onError(ex -> subscriptionService.detachStream(id, sink));
        return emitter;
    }
}
