package com.gaming.loyalty.messaging;

import com.gaming.loyalty.config.LoyaltyProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class KafkaLedgerEventPublisherTest {

    private static final String TOPIC = "loyalty-ledger-events";

    @Mock
    private KafkaTemplate<String, LedgerEvent> kafkaTemplate;

    private KafkaLedgerEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new KafkaLedgerEventPublisher(kafkaTemplate, new LoyaltyProperties());
    }

    private static LedgerEvent event(String playerId) {
        return LedgerEvent.builder()
                .eventId("evt-1")
                .eventType(LedgerEvent.TRANSACTION_RECORDED)
                .playerId(playerId)
                .transactionId(7L)
                .build();
    }

    @Test
    void sendsToLedgerTopicKeyedByPlayer() {
        LedgerEvent event = event("p1");
        SendResult<String, LedgerEvent> result = new SendResult<>(new ProducerRecord<>(TOPIC, "p1", event),
                new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 5, 0L, 0, 0));
        when(kafkaTemplate.send(TOPIC, "p1", event)).thenReturn(CompletableFuture.completedFuture(result));

        publisher.publish(event);

        verify(kafkaTemplate).send(TOPIC, "p1", event);
    }

    @Test
    void brokerFailureIsLoggedNotThrown(CapturedOutput output) {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertThatCode(() -> publisher.publish(event("p1"))).doesNotThrowAnyException();

        assertThat(output).contains("Failed to publish ledger event key=p1 eventId=evt-1");
    }

    @Test
    void synchronousSendFailureIsLoggedNotThrown(CapturedOutput output) {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new KafkaException("metadata timeout"));

        assertThatCode(() -> publisher.publish(event("p2"))).doesNotThrowAnyException();

        assertThat(output).contains("Failed to send ledger event key=p2 eventId=evt-1");
    }
}
