package com.updownbacktest.backtester.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Set;

/**
 * A parsed condition operand: the evaluated price, the condition literal, or an
 * indicator reference with an optional sub-field.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Operand {

    public enum Kind {
        PRICE,
        VALUE,
        INDICATOR
    }

    private static final String INDICATOR_PREFIX = "indicator_";

    Kind kind;
    String indicatorId;
    String field;

    public static Operand price() {
        return new Operand(Kind.PRICE, null, null);
    }

    public static Operand value() {
        return new Operand(Kind.VALUE, null, null);
    }

    public static Operand indicator(String indicatorId, String field) {
        return new Operand(Kind.INDICATOR, indicatorId, field);
    }

    /**
     * Parses {@code price}, {@code close}, {@code value}, {@code indicator_<id>[.<field>]}
     * or a bare {@code <id>[.<field>]} naming one of {@code knownIndicatorIds}.
     */
    public static Operand parse(String raw, Set<String> knownIndicatorIds) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Condition operand is required");
        }
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase();
        if (lower.equals("price") || lower.equals("close")) {
            return price();
        }
        if (lower.equals("value")) {
            return value();
        }

        String reference = lower.startsWith(INDICATOR_PREFIX)
                ? trimmed.substring(INDICATOR_PREFIX.length())
                : trimmed;
        int dot = reference.indexOf('.');
        String id = dot >= 0 ? reference.substring(0, dot) : reference;
        String field = dot >= 0 ? reference.substring(dot + 1) : null;

        if (!lower.startsWith(INDICATOR_PREFIX) && !knownIndicatorIds.contains(id)) {
            throw new IllegalArgumentException("Unknown condition operand: " + raw);
        }
        return indicator(id, field == null || field.isEmpty() ? null : field);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PRICE -> "price";
            case VALUE -> "value";
            case INDICATOR -> INDICATOR_PREFIX + indicatorId + (field != null ? "." + field : "");
        };
    }
}
