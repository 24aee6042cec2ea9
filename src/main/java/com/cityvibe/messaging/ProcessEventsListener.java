package com.cityvibe.messaging;

import com.cityvibe.domain.BatchResult;
import com.cityvibe.pipeline.BatchFatalException;
import com.cityvibe.pipeline.PipelineCoordinator;
import com.cityvibe.venue.VenueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Consumes scraped batches from Kafka and runs them through the pipeline.
 *
 * Every message is acknowledged. Batches that fail fatally go to the dead-letter topic
 * with the original payload so they can be replayed.
 */
@Service
public class ProcessEventsListener {

    private static final Logger log = LoggerFactory.getLogger(ProcessEventsListener.class);

    private final PipelineCoordinator coordinator;
    private final VenueRegistry venueRegistry;
    private final BatchResultPublisher publisher;

    public ProcessEventsListener(
            PipelineCoordinator coordinator,
            VenueRegistry venueRegistry,
            BatchResultPublisher publisher) {
        this.coordinator = coordinator;
        this.venueRegistry = venueRegistry;
        this.publisher = publisher;
    }

    @KafkaListener(
        topics = "${cityvibe.kafka.topics.raw-batches:raw-batches}",
        groupId = "${cityvibe.kafka.consumer-group:cityvibe-etl}",
        concurrency = "${cityvibe.kafka.concurrency:4}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void onBatch(
            @Payload ScrapeBatchMessage message,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.info("Received {} from partition {} offset {}", message, partition, offset);
        try {
            if (message.getVenue() != null) {
                venueRegistry.register(message.getVenue());
            }

            BatchResult result = coordinator.process(message.getVenueId(), message.getRawEvents());
            publisher.publishResult(message.getScrapeRunId(), result);

        } catch (BatchFatalException e) {
            log.error("Batch {} failed: {}", message.getScrapeRunId(), e.getMessage());
            publisher.publishFailure(new FailedBatch(message, e, e.getPartialResult()));

        } catch (RuntimeException e) {
            log.error("Unexpected error processing batch {}", message.getScrapeRunId(), e);
            publisher.publishFailure(new FailedBatch(message, e, null));

        } finally {
            // acknowledge in all cases; failed batches are replayed from the dead-letter topic
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
        }
    }
}
