package it.berlink.dbmonitor.config;

import it.berlink.dbmonitor.alert.LoggingSlowQueryAlertSink;
import it.berlink.dbmonitor.alert.SlowQueryAlertSink;
import it.berlink.dbmonitor.alert.WebhookSlowQueryAlertSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Wires the clock and the slow-query alert sink.
 */
@Slf4j
@Configuration
public class MonitorConfig {

    @Bean
    public Clock monitorClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public SlowQueryAlertSink slowQueryAlertSink(QueryMonitorProperties props) {
        QueryMonitorProperties.AlertProps alert = props.getAlert();
        if (alert.getWebhookUrl() == null || alert.getWebhookUrl().isBlank()) {
            log.info("No slow-query webhook configured, alerts will be logged only");
            return new LoggingSlowQueryAlertSink();
        }

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(alert.getConnectTimeoutMs());
        factory.setReadTimeout(alert.getReadTimeoutMs());

        log.info("Slow-query alerts will be posted to {}", alert.getWebhookUrl());
        return new WebhookSlowQueryAlertSink(new RestTemplate(factory), alert.getWebhookUrl());
    }
}
