package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the observation date column. Formats come from
 * {@code consolidation.reshape.date-patterns} and are tried in order;
 * a time-of-day suffix ("2020-01-05 10:00:00", "2020-01-05T10:00") is ignored.
 */
@Component
public class ObservationDateParser {

    private static final Logger logger = LoggerFactory.getLogger(ObservationDateParser.class);

    private final List<DateTimeFormatter> formatters = new ArrayList<>();

    public ObservationDateParser(ConsolidationConfig config) {
        for (String pattern : config.getReshape().getDatePatterns()) {
            // 'uuuu' instead of 'yyyy' so STRICT resolution works without an era field
            formatters.add(DateTimeFormatter.ofPattern(pattern.replace("yyyy", "uuuu"))
                    .withResolverStyle(ResolverStyle.STRICT));
        }
    }

    public Optional<LocalDate> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String text = value.trim();
        int timeSeparator = indexOfTimeSeparator(text);
        if (timeSeparator > 0) {
            text = text.substring(0, timeSeparator);
        }
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException e) {
                logger.trace("'{}' does not match {}", text, formatter);
            }
        }
        return Optional.empty();
    }

    private static int indexOfTimeSeparator(String text) {
        int space = text.indexOf(' ');
        int t = text.indexOf('T');
        if (space < 0) {
            return t;
        }
        if (t < 0) {
            return space;
        }
        return Math.min(space, t);
    }
}
