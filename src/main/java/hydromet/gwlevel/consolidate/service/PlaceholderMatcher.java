package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recognizes the "no data" markers region exports put in place of a reading.
 * Patterns come from {@code consolidation.validation.placeholder-patterns}.
 */
@Component
public class PlaceholderMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderMatcher.class);

    private final List<Pattern> patterns = new ArrayList<>();

    public PlaceholderMatcher(ConsolidationConfig config) {
        for (String expression : config.getValidation().getPlaceholderPatterns()) {
            try {
                patterns.add(Pattern.compile(expression.trim(), Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                // Not a valid regex: match the text literally
                logger.warn("Placeholder pattern '{}' is not a valid regex, matching it literally", expression);
                patterns.add(Pattern.compile(Pattern.quote(expression.trim()), Pattern.CASE_INSENSITIVE));
            }
        }
    }

    /**
     * True if the value is a configured placeholder marker. Blank values are not placeholders.
     */
    public boolean isPlaceholder(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(trimmed).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the value carries no reading: blank or a placeholder marker.
     */
    public boolean isMissing(String value) {
        return value == null || value.trim().isEmpty() || isPlaceholder(value);
    }
}
