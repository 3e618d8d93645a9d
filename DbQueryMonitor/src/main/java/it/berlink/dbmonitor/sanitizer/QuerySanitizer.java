package it.berlink.dbmonitor.sanitizer;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes credentials from query text and bound parameters before they are
 * stored in the history or written to the log.
 *
 * Both methods are total: whatever cannot be recognised is passed through as is.
 */
@Component
public class QuerySanitizer {

    public static final String REDACTED = "[REDACTED]";

    /** Longer string values are assumed to be hashes or encoded tokens. */
    static final int MAX_PLAIN_PARAM_LENGTH = 50;

    // key = 'value' with case-insensitive key, keeps the key as written
    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
        "(?i)(password|token|secret)\\s*=\\s*'[^']*'"
    );

    private static final String[] SECRET_MARKERS = {"password", "token", "secret"};

    public String sanitizeQueryText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return SECRET_ASSIGNMENT.matcher(text).replaceAll("$1 = '" + REDACTED + "'");
    }

    public List<Object> sanitizeParams(List<?> params) {
        if (params == null) {
            return null;
        }

        List<Object> sanitized = new ArrayList<>(params.size());
        for (Object param : params) {
            sanitized.add(isSensitive(param) ? REDACTED : param);
        }
        return Collections.unmodifiableList(sanitized);
    }

    private boolean isSensitive(Object param) {
        if (!(param instanceof String value)) {
            return false;
        }
        if (value.length() > MAX_PLAIN_PARAM_LENGTH) {
            return true;
        }
        for (String marker : SECRET_MARKERS) {
            if (value.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
