package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AverageDuration {

    private double last5Minutes;
    private double lastHour;
    private double overall;
}
