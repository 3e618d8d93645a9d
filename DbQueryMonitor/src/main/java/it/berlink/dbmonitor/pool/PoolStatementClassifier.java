package it.berlink.dbmonitor.pool;

import it.berlink.dbmonitor.model.QueryContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the operation and table labels of a raw SQL statement.
 */
@Component
public class PoolStatementClassifier {

    static final String OTHER = "other";

    private static final List<String> OPERATIONS = List.of(
        "select", "insert", "update", "delete", "create", "drop", "alter"
    );

    // checked in order, first match wins
    private static final List<Pattern> TABLE_PATTERNS = List.of(
        Pattern.compile("\\bfrom\\s+\"?([\\w.]+)"),
        Pattern.compile("\\binto\\s+\"?([\\w.]+)"),
        Pattern.compile("\\bupdate\\s+\"?([\\w.]+)"),
        Pattern.compile("\\btable\\s+\"?([\\w.]+)")
    );

    public String operation(String text) {
        if (text == null) {
            return OTHER;
        }
        String normalized = text.trim().toLowerCase();
        for (String operation : OPERATIONS) {
            if (normalized.startsWith(operation)) {
                return operation;
            }
        }
        return OTHER;
    }

    public String table(String text) {
        if (text == null) {
            return QueryContext.UNKNOWN;
        }
        String normalized = text.toLowerCase();
        for (Pattern pattern : TABLE_PATTERNS) {
            Matcher matcher = pattern.matcher(normalized);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return QueryContext.UNKNOWN;
    }
}
