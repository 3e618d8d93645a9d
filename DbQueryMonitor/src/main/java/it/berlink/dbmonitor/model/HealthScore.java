package it.berlink.dbmonitor.model;

import lombok.Value;

@Value
public class HealthScore {

    int score;
    HealthStatus status;
}
