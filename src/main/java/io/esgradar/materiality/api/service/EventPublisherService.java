package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.MaterialityReport;
import io.esgradar.materiality.api.dto.analysis.UpdateNecessity;
import io.esgradar.materiality.api.dto.kafka.AnalysisCompletedEvent;
import io.esgradar.materiality.api.dto.kafka.UpdateRequiredEvent;
import io.esgradar.materiality.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Announces finished analyses on Kafka. Publishing is fire-and-forget: failures are logged and
 * counted, never propagated to the caller.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    public void publish(MaterialityReport report) {
        publishAnalysisCompleted(report);
        publishUpdateRequired(report);
    }

    public void publishAnalysisCompleted(MaterialityReport report) {
        try {
            AnalysisCompletedEvent event = AnalysisCompletedEvent.create(report);
            send(topics.analysisCompleted(), messageKey(report), event, event.eventId());

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing analysis completed event for {}", report.companyName(), e);
        }
    }

    /**
     * Sends an update-required alert, only when the report's necessity is HIGH.
     */
    public void publishUpdateRequired(MaterialityReport report) {
        if (report.updateNecessity() != UpdateNecessity.HIGH) {
            logger.debug("Update necessity {} for {}, no alert sent", report.updateNecessity(), report.companyName());
            return;
        }

        try {
            UpdateRequiredEvent event = UpdateRequiredEvent.create(report);
            send(topics.updateRequired(), messageKey(report), event, event.alertId());

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing update required event for {}", report.companyName(), e);
        }
    }

    public PublishingStats getStats() {
        return new PublishingStats(published.get(), failed.get(), attempts.get());
    }

    private void send(String topic, String key, Object event, String eventId) {
        attempts.incrementAndGet();

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                published.incrementAndGet();
                logger.info("Sent {} to {} (partition {})", eventId, topic, result.getRecordMetadata().partition());
            } else {
                failed.incrementAndGet();
                logger.error("Failed to send {} to {}", eventId, topic, ex);
            }
        });
    }

    private static String messageKey(MaterialityReport report) {
        return report.companyName() + ":" + report.year();
    }

    public record PublishingStats(
            long published,
            long failed,
            long attempts
    ) {
        public double getSuccessRate() {
            return attempts > 0 ? (double) published / attempts : 0.0;
        }
    }
}
