package com.jreinhal.cafefinder.search.index;

import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.search.entity.TemporalEntityRecognizer;
import com.jreinhal.cafefinder.util.LogSanitizer;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restricts LOP sessions to the time window named by a DATE or TIME_RANGE entity value.
 */
public final class TemporalSessionFilter {
    private static final Logger log = LoggerFactory.getLogger(TemporalSessionFilter.class);

    public static final String PAST = "past";

    private TemporalSessionFilter() {
    }

    /**
     * Sessions inside the window; undated sessions never qualify. An unrecognized value leaves the list unchanged.
     */
    public static List<LopSession> apply(List<LopSession> sessions, String value, LocalDate today) {
        return predicate(value, today)
                .map(p -> sessions.stream().filter(s -> s.date() != null && p.test(s.date())).toList())
                .orElse(sessions);
    }

    static Optional<Predicate<LocalDate>> predicate(String value, LocalDate today) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        if (TemporalEntityRecognizer.FUTURE.equals(value) || TemporalEntityRecognizer.NEXT_OCCURRENCE.equals(value)) {
            return Optional.of(date -> !date.isBefore(today));
        }
        if (PAST.equals(value)) {
            return Optional.of(date -> date.isBefore(today));
        }
        try {
            int slash = value.indexOf('/');
            if (slash >= 0) {
                LocalDate start = LocalDate.parse(value.substring(0, slash));
                LocalDate end = LocalDate.parse(value.substring(slash + 1));
                return Optional.of(date -> !date.isBefore(start) && !date.isAfter(end));
            }
            LocalDate target = LocalDate.parse(value);
            return Optional.of(target::equals);
        }
        catch (DateTimeParseException e) {
            log.debug("Unrecognized temporal value {}, sessions left unfiltered", LogSanitizer.sanitize(value));
            return Optional.empty();
        }
    }
}
