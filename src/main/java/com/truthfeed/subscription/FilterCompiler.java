package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns submitted {@link FeedFilter}s into predicates. All validation happens
 * here, so a compiled filter never throws while matching; a missing or
 * mistyped event attribute simply does not match.
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    public static List<CompiledFilter> compileAll(List<FeedFilter> filters) {
        if (filters == null) {
            return List.of();
        }
        List<CompiledFilter> compiled = new ArrayList<>(filters.size());
        for (FeedFilter filter : filters) {
            compiled.add(compile(filter));
        }
        return compiled;
    }

    public static CompiledFilter compile(FeedFilter filter) {
        if (filter == null || filter.filterType() == null || filter.operator() == null) {
            throw new FilterEvaluationException("filter_type and operator are required");
        }
        FilterType type = filter.filterType();
        FilterOperator operator = filter.operator();
        if (type.isNumeric()) {
            return new CompiledFilter(filter, numeric(type, operator, filter.value()));
        }
        return new CompiledFilter(filter, textual(type, operator, filter.value()));
    }

    private static Predicate<FeedEvent> numeric(FilterType type, FilterOperator operator, Object raw) {
        if (operator == FilterOperator.CONTAINS || operator == FilterOperator.REGEX) {
            throw new FilterEvaluationException(type.getValue() + " filters support equals, greater_than, less_than");
        }
        double threshold = toNumber(type, raw);
        return event -> {
            Double actual = numericValue(type, event);
            if (actual == null) {
                return false;
            }
            switch (operator) {
                case GREATER_THAN:
                    return actual > threshold;
                case LESS_THAN:
                    return actual < threshold;
                default:
                    return Double.compare(actual, threshold) == 0;
            }
        };
    }

    private static Predicate<FeedEvent> textual(FilterType type, FilterOperator operator, Object raw) {
        if (operator.isNumericComparison()) {
            throw new FilterEvaluationException(type.getValue() + " filters support equals, contains, regex");
        }
        if (!(raw instanceof String expected) || expected.isBlank()) {
            throw new FilterEvaluationException(type.getValue() + " filter requires a non-empty string value");
        }
        Predicate<String> test;
        switch (operator) {
            case CONTAINS:
                test = actual -> actual.contains(expected);
                break;
            case REGEX:
                Pattern pattern;
                try {
                    pattern = Pattern.compile(expected);
                } catch (PatternSyntaxException ex) {
                    throw new FilterEvaluationException("invalid regex for " + type.getValue() + ": "
                        + ex.getDescription(), ex);
                }
                test = actual -> pattern.matcher(actual).find();
                break;
            default:
                test = expected::equals;
        }
        Predicate<String> valueTest = test;
        return event -> textValues(type, event).stream().anyMatch(valueTest);
    }

    private static double toNumber(FilterType type, Object raw) {
        if (raw instanceof Number number && Double.isFinite(number.doubleValue())) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                double parsed = Double.parseDouble(text.trim());
                if (Double.isFinite(parsed)) {
                    return parsed;
                }
            } catch (NumberFormatException ex) {
                throw new FilterEvaluationException(type.getValue() + " filter value is not a number: " + text, ex);
            }
        }
        throw new FilterEvaluationException(type.getValue() + " filter requires a finite numeric value");
    }

    private static Double numericValue(FilterType type, FeedEvent event) {
        if (type == FilterType.CONFIDENCE) {
            return event.confidenceScore();
        }
        Map<String, Object> payload = event.payload();
        Object value = payload.containsKey("new_score") ? payload.get("new_score") : payload.get("trust_score");
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static List<String> textValues(FilterType type, FeedEvent event) {
        Map<String, Object> payload = event.payload();
        List<String> values = new ArrayList<>();
        switch (type) {
            case ORGANIZATION:
                addText(values, event.subjectId() != null ? event.subjectId() : payload.get("organization_id"));
                break;
            case EVENT_TYPE:
                addText(values, event.eventType());
                addText(values, payload.get("event_type"));
                break;
            case COMPLIANCE_FRAMEWORK:
                addText(values, payload.get("framework"));
                addText(values, payload.get("compliance_framework"));
                addText(values, payload.get("affected_frameworks"));
                break;
            case EXPERT_CREDENTIAL:
                addText(values, payload.get("expert_credentials"));
                break;
            default:
                break;
        }
        return values;
    }

    private static void addText(List<String> values, Object raw) {
        if (raw instanceof String text) {
            values.add(text);
        } else if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof String text) {
                    values.add(text);
                }
            }
        }
    }
}
