package com.truthfeed.api;

import com.truthfeed.analytics.FeedAnalyticsService;
import com.truthfeed.analytics.FeedStats;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * GET /v1/feeds/{type}[/{subject}]/analytics?from=&to=
 *
 * {@code from} and {@code to} are ISO-8601 instants; both optional.
 */
@RestController
@RequestMapping("/v1/feeds")
public class AnalyticsController {

    private final FeedAnalyticsService analyticsService;

    public AnalyticsController(FeedAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/{type}/analytics")
    public FeedStats analyticsGlobal(
            @PathVariable String type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return analyticsService.getAnalytics(FeedPaths.ref(type, null), from, to);
    }

    @GetMapping("/{type}/{subject}/analytics")
    public FeedStats analyticsSubject(
            @PathVariable String type,
            @PathVariable String subject,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return analyticsService.getAnalytics(FeedPaths.ref(type, subject), from, to);
    }
}
