package it.berlink.dbmonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {

    HEALTHY,
    WARNING,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
