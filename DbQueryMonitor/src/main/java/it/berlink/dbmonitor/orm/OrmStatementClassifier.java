package it.berlink.dbmonitor.orm;

import it.berlink.dbmonitor.model.QueryContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Labels ORM-generated SQL, where identifiers are double-quoted.
 */
@Component
public class OrmStatementClassifier {

    static final String OTHER = "other";

    private static final List<String> OPERATIONS = List.of("select", "insert", "update", "delete");
    private static final Pattern QUOTED_IDENTIFIER = Pattern.compile("\"([^\"]+)\"");

    public String operation(String query) {
        if (query == null) {
            return OTHER;
        }
        String normalized = query.toLowerCase();
        for (String operation : OPERATIONS) {
            if (normalized.contains(operation)) {
                return operation;
            }
        }
        return OTHER;
    }

    public String table(String query) {
        if (query == null) {
            return QueryContext.UNKNOWN;
        }
        Matcher matcher = QUOTED_IDENTIFIER.matcher(query);
        return matcher.find() ? matcher.group(1) : QueryContext.UNKNOWN;
    }
}
