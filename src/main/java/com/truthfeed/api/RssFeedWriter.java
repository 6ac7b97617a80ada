package com.truthfeed.api;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.feed.Feed;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a feed's events as an RSS 2.0 document, newest first.
 */
@Component
public class RssFeedWriter {

    private static final DateTimeFormatter RFC_1123 = DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);
    private static final int MAX_DESCRIPTION_EXCERPT = 200;

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    public String write(Feed feed, List<FeedEvent> newestFirst, Instant builtAt) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("rss");
            xml.writeAttribute("version", "2.0");
            xml.writeStartElement("channel");
            element(xml, "title", "Truth Feed: " + feed.getFeedId());
            element(xml, "link", feed.getFeedUrl());
            element(xml, "description", "Hash-chained " + feed.getFeedType().getValue() + " events"
                + (feed.getSubjectId() != null ? " for " + feed.getSubjectId() : "")
                + " (verification: " + feed.getVerificationStatus().getValue() + ")");
            element(xml, "lastBuildDate", RFC_1123.format(builtAt));
            for (FeedEvent event : newestFirst) {
                xml.writeStartElement("item");
                element(xml, "title", title(event));
                element(xml, "link", feed.getFeedUrl() + "?since=" + (event.sequenceNumber() - 1) + "&limit=1");
                element(xml, "description", description(event));
                xml.writeStartElement("guid");
                xml.writeAttribute("isPermaLink", "false");
                xml.writeCharacters(event.eventId());
                xml.writeEndElement();
                element(xml, "pubDate", RFC_1123.format(event.timestamp()));
                element(xml, "category", event.eventType());
                xml.writeEndElement();
            }
            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("failed to render RSS for feed " + feed.getFeedId(), ex);
        }
        return out.toString();
    }

    static String title(FeedEvent event) {
        Map<String, Object> data = event.payload();
        switch (event.eventType()) {
            case "compliance_event":
                return text(data, "event_type", "compliance_event") + " - " + subjectOrGlobal(event);
            case "trust_score_update":
            case "trust_attestation":
            case "expert_validation":
                return "Trust Score: " + number(data.get("new_score")) + " (" + signed(data.get("score_change")) + ")";
            case "regulatory_update":
                return text(data, "update_type", "update") + ": " + text(data, "title", "untitled");
            case "expert_opinion":
                return "Expert " + text(data, "opinion_type", "opinion") + ": " + text(data, "subject", "general");
            case "audit_activity":
                return text(data, "activity_type", "activity") + ": " + text(data, "framework", "compliance") + " audit";
            default:
                return event.eventType() + " - " + subjectOrGlobal(event);
        }
    }

    static String description(FeedEvent event) {
        Map<String, Object> data = event.payload();
        String base = "Cryptographically verified " + event.eventType() + " with confidence score "
            + event.confidenceScore() + ". ";
        switch (event.eventType()) {
            case "compliance_event":
                return base + "Status changed from " + text(data, "previous_status", "unknown") + " to "
                    + text(data, "new_status", "unknown") + " for " + text(data, "framework", "unspecified") + ".";
            case "trust_score_update":
            case "trust_attestation":
            case "expert_validation":
                return base + "Trust score updated to " + number(data.get("new_score")) + " based on "
                    + text(data, "contributing_factors", "0") + " factors.";
            case "regulatory_update":
                return base + text(data, "description", "") + " Effective: " + text(data, "effective_date", "n/a");
            case "expert_opinion":
                String opinion = text(data, "opinion_text", "");
                return base + (opinion.length() > MAX_DESCRIPTION_EXCERPT
                    ? opinion.substring(0, MAX_DESCRIPTION_EXCERPT) + "..." : opinion);
            case "audit_activity":
                return base + text(data, "activity_description", "");
            default:
                return base + "Event data available via API.";
        }
    }

    private static void element(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static String subjectOrGlobal(FeedEvent event) {
        return event.subjectId() != null ? event.subjectId() : "Global";
    }

    private static String text(Map<String, Object> data, String key, String fallback) {
        Object value = data.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    private static String number(Object value) {
        return value instanceof Number n ? String.format(Locale.ROOT, "%.2f", n.doubleValue()) : "n/a";
    }

    private static String signed(Object value) {
        if (!(value instanceof Number n)) {
            return "n/a";
        }
        return (n.doubleValue() > 0 ? "+" : "") + String.format(Locale.ROOT, "%.2f", n.doubleValue());
    }
}
