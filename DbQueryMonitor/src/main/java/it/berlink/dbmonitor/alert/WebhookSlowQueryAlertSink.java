package it.berlink.dbmonitor.alert;

import it.berlink.dbmonitor.model.QueryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Posts slow-query alerts to an HTTP endpoint.
 *
 * Delivery runs on a single background thread; a failed post is logged and dropped.
 */
@Slf4j
public class WebhookSlowQueryAlertSink implements SlowQueryAlertSink {

    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final ExecutorService executor;

    public WebhookSlowQueryAlertSink(RestTemplate restTemplate, String webhookUrl) {
        this(restTemplate, webhookUrl, Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "slow-query-alert");
            thread.setDaemon(true);
            return thread;
        }));
    }

    WebhookSlowQueryAlertSink(RestTemplate restTemplate, String webhookUrl, ExecutorService executor) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
        this.executor = executor;
    }

    @Override
    public void send(QueryRecord record, long thresholdMs) {
        AlertPayload payload = AlertPayload.of(record, thresholdMs);
        try {
            executor.execute(() -> post(payload));
        } catch (RejectedExecutionException e) {
            log.warn("Slow-query alert dropped, sink is shut down");
        }
    }

    private void post(AlertPayload payload) {
        try {
            restTemplate.postForEntity(webhookUrl, payload, Void.class);
            log.debug("Slow-query alert posted to {}", webhookUrl);
        } catch (RestClientException e) {
            log.warn("Failed to post slow-query alert to {}: {}", webhookUrl, e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
