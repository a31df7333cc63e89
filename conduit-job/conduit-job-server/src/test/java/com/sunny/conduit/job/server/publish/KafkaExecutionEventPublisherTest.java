package com.sunny.conduit.job.server.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.enums.ExecutionStatus;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.model.TriggerExecution;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaExecutionEventPublisherTest {

    private static final long NOW = 1_700_000_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MockProducer<String, String> producer =
            new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    private final KafkaExecutionEventPublisher publisher = new KafkaExecutionEventPublisher(producer, objectMapper,
            Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

    @Test
    void onExecutionChanged_shouldPublishToTenantTopicKeyedByJob() throws Exception {
        publisher.onExecutionChanged(execution("tenant-a", ExecutionStatus.RUNNING, null));
        publisher.onExecutionChanged(execution("tenant-a", ExecutionStatus.FAILED, "boom"));

        List<ProducerRecord<String, String>> records = producer.history();
        assertEquals(2, records.size());
        assertEquals("conduit.tenant.tenant-a.events", records.get(0).topic());
        assertEquals("3", records.get(0).key());

        JobEvent started = objectMapper.readValue(records.get(0).value(), JobEvent.class);
        assertEquals(JobEvent.TYPE_EXECUTION_STARTED, started.type());
        assertEquals(NOW, started.timestamp());

        JobEvent finished = objectMapper.readValue(records.get(1).value(), JobEvent.class);
        assertEquals(JobEvent.TYPE_EXECUTION_FINISHED, finished.type());
        assertEquals("failed", finished.status());
        assertEquals("boom", finished.error());
    }

    @Test
    void onExecutionChanged_invalidTenantShouldBeSkipped() {
        publisher.onExecutionChanged(execution("bad tenant", ExecutionStatus.RUNNING, null));

        assertTrue(producer.history().isEmpty());
    }

    @Test
    void onExecutionChanged_sendFailureShouldNotPropagate() {
        MockProducer<String, String> failing = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaExecutionEventPublisher failingPublisher = new KafkaExecutionEventPublisher(failing, objectMapper,
                Clock.systemUTC());

        failingPublisher.onExecutionChanged(execution("tenant-a", ExecutionStatus.SUCCEEDED, null));
        assertTrue(failing.errorNext(new RuntimeException("broker down")));
    }

    private static TriggerExecution execution(String tenantId, ExecutionStatus status, String error) {
        Long finishedAt = status.isTerminal() ? NOW : null;
        return new TriggerExecution(101L, 11L, 3L, tenantId, status, 1, NOW - 1000, finishedAt, error, null);
    }
}
