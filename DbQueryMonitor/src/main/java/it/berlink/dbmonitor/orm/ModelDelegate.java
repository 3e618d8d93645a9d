package it.berlink.dbmonitor.orm;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Operations available on one ORM model. Unset operations are unsupported.
 *
 * Criteria and data are column/value maps; rows are returned the same way.
 */
@Value
@Builder
public class ModelDelegate {

    String name;

    /** where -> matching rows */
    Function<Map<String, Object>, List<Map<String, Object>>> findMany;

    /** data -> created row */
    Function<Map<String, Object>, Map<String, Object>> create;

    /** (where, data) -> updated row */
    BiFunction<Map<String, Object>, Map<String, Object>, Map<String, Object>> update;

    /** where -> deleted row */
    Function<Map<String, Object>, Map<String, Object>> delete;

    public boolean supports(ModelOperation operation) {
        return switch (operation) {
            case FIND_MANY -> findMany != null;
            case CREATE -> create != null;
            case UPDATE -> update != null;
            case DELETE -> delete != null;
        };
    }

    boolean supportsAny() {
        for (ModelOperation operation : ModelOperation.values()) {
            if (supports(operation)) {
                return true;
            }
        }
        return false;
    }
}
