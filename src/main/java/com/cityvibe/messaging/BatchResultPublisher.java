package com.cityvibe.messaging;

import com.cityvibe.domain.BatchResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes batch outcomes to Kafka: summaries to the results topic, failed batches to
 * the dead-letter topic. Messages are keyed by venue id.
 */
@Service
public class BatchResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(BatchResultPublisher.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String resultsTopic;
    private final String deadLetterTopic;
    private final Counter sendSuccessCounter;
    private final Counter sendFailureCounter;
    private final Timer sendLatencyTimer;

    public BatchResultPublisher(
            KafkaTemplate<String, Object> kafkaTemplate,
            MeterRegistry meterRegistry,
            @Value("${cityvibe.kafka.topics.batch-results:batch-results}") String resultsTopic,
            @Value("${cityvibe.kafka.topics.dead-letter:batch-dead-letter}") String deadLetterTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.resultsTopic = resultsTopic;
        this.deadLetterTopic = deadLetterTopic;

        this.sendSuccessCounter = Counter.builder("kafka.producer.send.success")
            .description("Number of successfully sent messages")
            .register(meterRegistry);

        this.sendFailureCounter = Counter.builder("kafka.producer.send.failure")
            .description("Number of failed message sends")
            .register(meterRegistry);

        this.sendLatencyTimer = Timer.builder("kafka.producer.send.latency")
            .description("Latency of message sends")
            .register(meterRegistry);
    }

    public CompletableFuture<SendResult<String, Object>> publishResult(String scrapeRunId, BatchResult result) {
        return send(resultsTopic, result.getVenueId(), new BatchResultMessage(scrapeRunId, result));
    }

    public CompletableFuture<SendResult<String, Object>> publishFailure(FailedBatch failed) {
        String key = failed.getMessage() != null ? failed.getMessage().getVenueId() : null;
        return send(deadLetterTopic, key, failed);
    }

    private CompletableFuture<SendResult<String, Object>> send(String topic, String key, Object value) {
        Timer.Sample sample = Timer.start();

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, value);

        future.whenComplete((result, ex) -> {
            sample.stop(sendLatencyTimer);

            if (ex != null) {
                sendFailureCounter.increment();
                log.error("Failed to send message to topic {}: {}", topic, ex.getMessage(), ex);
            } else {
                sendSuccessCounter.increment();
                log.debug("Sent message to topic {} partition {} offset {}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
