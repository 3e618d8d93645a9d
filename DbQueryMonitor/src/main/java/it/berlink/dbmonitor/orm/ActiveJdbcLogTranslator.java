package it.berlink.dbmonitor.orm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feeds ActiveJDBC statement logs into the ORM event stream.
 *
 * ActiveJDBC logs every statement after running it, e.g.:
 *    2026-01-25 16:55:10.891 INFO  [823552] [OperationService.getAllOperations] org.javalite.activejdbc.LazyList - {"sql":"SELECT * FROM gb_site_bulks WHERE id_site = ?","params":[4],"duration_millis":1,"cache":"miss"}
 *
 * The bare JSON payload is accepted as well.
 *
 * Nothing in this service reads log files: the host application passes each
 * line it receives, e.g. from a log appender, to {@link #accept}.
 */
@Slf4j
@Component
public class ActiveJdbcLogTranslator {

    // TIMESTAMP LEVEL [THREAD] [METHOD] LOGGER - JSON
    private static final Pattern ACTIVEJDBC_LOG_PATTERN = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3})" +  // timestamp (group 1)
        "\\s+\\w+" +                                                // log level (INFO, DEBUG, etc)
        "\\s+\\[\\d+\\]" +                                          // thread id [401519]
        "\\s+\\[([^\\]]+)\\]" +                                     // method (group 2)
        ".* - " +                                                   // logger name + separator
        "(\\{.+\\})$"                                               // JSON payload (group 3)
    );

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
    };

    private final ObjectMapper objectMapper;
    private final OrmEventPublisher publisher;
    private final Clock clock;

    public ActiveJdbcLogTranslator(ObjectMapper objectMapper, OrmEventPublisher publisher, Clock clock) {
        this.objectMapper = objectMapper;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Publishes the statement found in the line, if any.
     *
     * @return true when a query event was published
     */
    public boolean accept(String line) {
        Optional<OrmQueryEvent> event = translate(line);
        event.ifPresent(publisher::publishQuery);
        return event.isPresent();
    }

    Optional<OrmQueryEvent> translate(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        String trimmedLine = line.trim();
        if (trimmedLine.startsWith("{")) {
            return parsePayload(trimmedLine, null, clock.instant());
        }

        Matcher matcher = ACTIVEJDBC_LOG_PATTERN.matcher(trimmedLine);
        if (!matcher.matches()) {
            log.trace("Not an ActiveJDBC statement log: {}", trimmedLine);
            return Optional.empty();
        }

        Instant timestamp = parseTimestamp(matcher.group(1)).orElseGet(clock::instant);
        return parsePayload(matcher.group(3), matcher.group(2), timestamp);
    }

    private Optional<OrmQueryEvent> parsePayload(String jsonPayload, String method, Instant timestamp) {
        try {
            JsonNode jsonNode = objectMapper.readTree(jsonPayload);

            String sql = jsonNode.path("sql").asText(null);
            if (sql == null || sql.isBlank()) {
                log.trace("No SQL found in JSON payload: {}", jsonPayload);
                return Optional.empty();
            }

            return Optional.of(OrmQueryEvent.builder()
                .query(sql)
                .params(readParams(jsonNode.path("params")))
                .durationMs(readDuration(jsonNode.path("duration_millis")))
                .target(method)
                .timestamp(timestamp)
                .build());

        } catch (JsonProcessingException e) {
            log.trace("Failed to parse ActiveJDBC JSON payload: {} - Error: {}", jsonPayload, e.getMessage());
            return Optional.empty();
        }
    }

    // only numeric durations are trusted, "NaN" or other text counts as 0
    private static double readDuration(JsonNode durationNode) {
        if (!durationNode.isNumber()) {
            return 0;
        }
        double duration = durationNode.asDouble();
        return Double.isFinite(duration) && duration > 0 ? duration : 0;
    }

    private List<Object> readParams(JsonNode paramsNode) {
        if (!paramsNode.isArray()) {
            return null;
        }
        List<Object> params = new ArrayList<>(paramsNode.size());
        for (JsonNode param : paramsNode) {
            params.add(objectMapper.convertValue(param, Object.class));
        }
        return params;
    }

    private Optional<Instant> parseTimestamp(String timestampStr) {
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                LocalDateTime ldt = LocalDateTime.parse(timestampStr, formatter);
                return Optional.of(ldt.atZone(ZoneId.systemDefault()).toInstant());
            } catch (DateTimeParseException e) {
                log.trace("Timestamp {} does not match {}", timestampStr, formatter);
            }
        }
        return Optional.empty();
    }
}
