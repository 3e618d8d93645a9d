package it.berlink.dbmonitor.orm;

/**
 * Convenience operations of {@link InstrumentedOrmClient}, with the operation
 * label used when the caller does not give one.
 */
public enum ModelOperation {

    FIND_MANY("select"),
    CREATE("insert"),
    UPDATE("update"),
    DELETE("delete");

    private final String defaultLabel;

    ModelOperation(String defaultLabel) {
        this.defaultLabel = defaultLabel;
    }

    public String defaultLabel() {
        return defaultLabel;
    }
}
