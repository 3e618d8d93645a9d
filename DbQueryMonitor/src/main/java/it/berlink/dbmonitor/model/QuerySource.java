package it.berlink.dbmonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a recorded execution.
 */
public enum QuerySource {

    POOL("pool"),
    CLIENT("client"),
    ORM("orm"),
    WRAPPER("wrapper");

    private final String label;

    QuerySource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
