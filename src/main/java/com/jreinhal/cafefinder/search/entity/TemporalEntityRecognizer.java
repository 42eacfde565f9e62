package com.jreinhal.cafefinder.search.entity;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recognizes relative and absolute time expressions and resolves them against the injected clock.
 *
 * Values are either an ISO date ({@code DATE}), an ISO range {@code start/end} ({@code TIME_RANGE})
 * or one of the markers {@link #NEXT_OCCURRENCE} and {@link #FUTURE}.
 */
@Component
public class TemporalEntityRecognizer {
    private static final Logger log = LoggerFactory.getLogger(TemporalEntityRecognizer.class);

    public static final String NEXT_OCCURRENCE = "next_occurrence";
    public static final String FUTURE = "future";

    private static final Pattern NEXT_SESSION = Pattern.compile("\\b(next|upcoming)\\s+(lops?|sessions?|talks?)\\b");
    private static final Pattern FUTURE_SESSION = Pattern.compile("\\b(future)\\s+(lops?|sessions?|talks?)\\b");
    private static final Pattern RELATIVE_PERIOD = Pattern.compile("\\b(next|upcoming|future|this|last|past)\\s+(week|month|quarter|year)\\b");
    private static final Pattern RELATIVE_DAY = Pattern.compile("\\b(today|tonight|tomorrow|yesterday)\\b");
    private static final Pattern QUARTER = Pattern.compile("\\bq([1-4])(?:\\s+(\\d{4}))?\\b");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private final Clock clock;

    public TemporalEntityRecognizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param lowerQuery the query lowercased without changing character offsets
     */
    public List<TemporalMatch> recognize(String lowerQuery) {
        List<TemporalMatch> matches = new ArrayList<>();
        if (lowerQuery == null || lowerQuery.isEmpty()) {
            return matches;
        }
        LocalDate today = LocalDate.now(this.clock);

        Matcher m = NEXT_SESSION.matcher(lowerQuery);
        while (m.find()) {
            matches.add(qualified(m, lowerQuery, EntityType.TIME_RANGE, NEXT_OCCURRENCE, 0.95));
        }
        m = FUTURE_SESSION.matcher(lowerQuery);
        while (m.find()) {
            matches.add(qualified(m, lowerQuery, EntityType.TIME_RANGE, FUTURE, 0.95));
        }
        m = RELATIVE_PERIOD.matcher(lowerQuery);
        while (m.find()) {
            matches.add(qualified(m, lowerQuery, EntityType.TIME_RANGE, period(today, m.group(1), m.group(2)), 0.90));
        }
        m = RELATIVE_DAY.matcher(lowerQuery);
        while (m.find()) {
            LocalDate date = switch (m.group(1)) {
                case "tomorrow" -> today.plusDays(1);
                case "yesterday" -> today.minusDays(1);
                default -> today;
            };
            matches.add(whole(m, lowerQuery, EntityType.DATE, date.toString(), 0.95));
        }
        m = QUARTER.matcher(lowerQuery);
        while (m.find()) {
            int year = m.group(2) != null ? Integer.parseInt(m.group(2)) : today.getYear();
            LocalDate start = LocalDate.of(year, (Integer.parseInt(m.group(1)) - 1) * 3 + 1, 1);
            matches.add(whole(m, lowerQuery, EntityType.TIME_RANGE, range(start, start.plusMonths(3).minusDays(1)), 0.90));
        }
        m = ISO_DATE.matcher(lowerQuery);
        while (m.find()) {
            try {
                LocalDate date = LocalDate.parse(m.group(1));
                matches.add(whole(m, lowerQuery, EntityType.DATE, date.toString(), 0.95));
            }
            catch (DateTimeParseException e) {
                log.debug("Ignoring invalid date literal {}", m.group(1));
            }
        }
        return matches;
    }

    static String period(LocalDate today, String qualifier, String unit) {
        return switch (qualifier) {
            case "this" -> currentPeriod(today, unit);
            case "last", "past" -> range(minus(today, unit), today);
            default -> range(today, plus(today, unit));
        };
    }

    private static String currentPeriod(LocalDate today, String unit) {
        return switch (unit) {
            case "week" -> range(today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                    today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)));
            case "month" -> range(today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()));
            case "quarter" -> {
                LocalDate start = LocalDate.of(today.getYear(), (today.getMonthValue() - 1) / 3 * 3 + 1, 1);
                yield range(start, start.plusMonths(3).minusDays(1));
            }
            default -> range(today.withDayOfYear(1), today.with(TemporalAdjusters.lastDayOfYear()));
        };
    }

    private static LocalDate plus(LocalDate date, String unit) {
        return switch (unit) {
            case "week" -> date.plusWeeks(1);
            case "month" -> date.plusMonths(1);
            case "quarter" -> date.plusMonths(3);
            default -> date.plusYears(1);
        };
    }

    private static LocalDate minus(LocalDate date, String unit) {
        return switch (unit) {
            case "week" -> date.minusWeeks(1);
            case "month" -> date.minusMonths(1);
            case "quarter" -> date.minusMonths(3);
            default -> date.minusYears(1);
        };
    }

    private static String range(LocalDate start, LocalDate end) {
        return start + "/" + end;
    }

    private static TemporalMatch qualified(Matcher m, String text, EntityType type, String value, double confidence) {
        Entity entity = new Entity(type, text.substring(m.start(), m.end()), value, confidence,
                new Entity.Position(m.start(), m.end()));
        return new TemporalMatch(entity, new Entity.Position(m.start(1), m.end(1)));
    }

    private static TemporalMatch whole(Matcher m, String text, EntityType type, String value, double confidence) {
        Entity.Position span = new Entity.Position(m.start(), m.end());
        return new TemporalMatch(new Entity(type, text.substring(m.start(), m.end()), value, confidence, span), span);
    }

    /**
     * A temporal entity plus the sub-span that carries the time meaning on its own ("next" in "next lop").
     */
    public record TemporalMatch(Entity entity, Entity.Position qualifier) {
    }
}
