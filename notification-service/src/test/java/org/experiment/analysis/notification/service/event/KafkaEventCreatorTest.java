package org.experiment.analysis.notification.service.event;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.experiment.analysis.datamodel.event.EventUser;
import org.experiment.analysis.datamodel.event.ExperimentWarningEvent;
import org.experiment.analysis.datamodel.event.SrmPayload;
import org.experiment.analysis.datamodel.json.ObjectMapperProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KafkaEventCreatorTest {

  private static ExperimentWarningEvent event() {
    return ExperimentWarningEvent.builder()
        .data(new SrmPayload("exp_1", "Checkout", 0.001))
        .user(EventUser.builder().id("u_1").build())
        .project("prj_web")
        .build();
  }

  @Test
  void testEventIsPublishedAsJson() throws IOException {
    MockProducer<String, String> producer =
        new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaEventCreator eventCreator = new KafkaEventCreator(producer, "experiment-events", 1000);

    Assertions.assertEquals(
        Optional.of("experiment-events-0-0"), eventCreator.createEvent("org_1", event()));
    Assertions.assertEquals(
        Optional.of("experiment-events-0-1"), eventCreator.createEvent("org_1", event()));

    List<ProducerRecord<String, String>> history = producer.history();
    Assertions.assertEquals(2, history.size());
    Assertions.assertEquals("org_1", history.get(0).key());
    JsonNode json = ObjectMapperProvider.get().readTree(history.get(0).value());
    Assertions.assertEquals("experiment.warning", json.get("event").asText());
    Assertions.assertEquals("srm", json.get("data").get("type").asText());
    Assertions.assertEquals(0.001, json.get("data").get("threshold").asDouble());
    Assertions.assertEquals("prj_web", json.get("projects").get(0).asText());
    Assertions.assertFalse(json.get("containsSecrets").asBoolean());

    eventCreator.close();
    Assertions.assertTrue(producer.closed());
  }

  @Test
  @SuppressWarnings("unchecked")
  void testFailedSendCreatesNoEvent() throws IOException {
    Producer<String, String> producer = mock(Producer.class);
    CompletableFuture<RecordMetadata> failed = new CompletableFuture<>();
    failed.completeExceptionally(new KafkaException("broker unavailable"));
    when(producer.send(any(ProducerRecord.class))).thenReturn(failed);
    KafkaEventCreator eventCreator = new KafkaEventCreator(producer, "experiment-events", 1000);

    Assertions.assertTrue(eventCreator.createEvent("org_1", event()).isEmpty());
  }

  @Test
  void testProducerConfig() {
    KafkaConfigReader reader =
        new KafkaConfigReader(
            ConfigFactory.parseMap(
                Map.of(
                    "bootstrap.servers", "localhost:9092",
                    "producer.topic", "experiment-events",
                    "producer.acks", "1")));

    Map<String, Object> producerConfig = reader.getProducerConfig();
    Assertions.assertEquals("experiment-events", reader.getProducerTopicName());
    Assertions.assertEquals(
        "localhost:9092", producerConfig.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
    Assertions.assertEquals("1", producerConfig.get(ProducerConfig.ACKS_CONFIG));
    Assertions.assertFalse(producerConfig.containsKey("topic"));
    Assertions.assertEquals(
        StringSerializer.class.getName(),
        producerConfig.get(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG));
    Assertions.assertEquals(KafkaConfigReader.DEFAULT_SEND_TIMEOUT_MS, reader.getSendTimeoutMs());
  }
}
