package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Current state of one meter of the metrics registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeterSnapshot {

    private String name;
    private String type;
    private String description;
    private Map<String, String> tags;
    private Map<String, Double> measurements;
}
