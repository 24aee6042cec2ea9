package com.cityvibe.messaging;

import com.cityvibe.domain.BatchResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BatchResultPublisher Tests")
class BatchResultPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private MeterRegistry meterRegistry;
    private BatchResultPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new BatchResultPublisher(kafkaTemplate, meterRegistry, "results", "dead-letter");
    }

    @Test
    @DisplayName("Should publish results keyed by venue")
    void shouldPublishResult() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        BatchResult result = BatchResult.builder("venue-1").processed(3).build();

        publisher.publishResult("run-1", result);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("results"), eq("venue-1"), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(BatchResultMessage.class, message -> {
            assertThat(message.getScrapeRunId()).isEqualTo("run-1");
            assertThat(message.getResult()).isSameAs(result);
            assertThat(message.getCompletedAt()).isNotNull();
        });
    }

    @Test
    @DisplayName("Should send failed batches to the dead-letter topic")
    void shouldPublishFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        ScrapeBatchMessage message = new ScrapeBatchMessage("run-1", "venue-1", List.of());
        FailedBatch failed = new FailedBatch(message, new IllegalStateException("boom"), null);

        publisher.publishFailure(failed);

        verify(kafkaTemplate).send("dead-letter", "venue-1", failed);
    }

    @Test
    @DisplayName("Should count failed sends")
    void shouldCountFailedSends() {
        CompletableFuture<SendResult<String, Object>> future = new CompletableFuture<>();
        future.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(future);

        publisher.publishResult("run-1", BatchResult.builder("venue-1").build());

        assertThat(meterRegistry.get("kafka.producer.send.failure").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("kafka.producer.send.success").counter().count()).isZero();
    }
}
