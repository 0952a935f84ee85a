package org.experiment.analysis.notification.service.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.experiment.analysis.datamodel.event.ExperimentWarningEvent;
import org.experiment.analysis.datamodel.json.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes warning events as JSON keyed by organization id. The created event id is {@code
 * <topic>-<partition>-<offset>} of the acknowledged record.
 */
public class KafkaEventCreator implements EventCreator {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaEventCreator.class);
  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperProvider.get();

  private final Producer<String, String> producer;
  private final String topic;
  private final long sendTimeoutMs;

  public KafkaEventCreator(Config kafkaConfig) {
    KafkaConfigReader kafkaConfigReader = new KafkaConfigReader(kafkaConfig);
    Properties properties = new Properties();
    properties.putAll(kafkaConfigReader.getProducerConfig());
    this.producer = new KafkaProducer<>(properties);
    this.topic = kafkaConfigReader.getProducerTopicName();
    this.sendTimeoutMs = kafkaConfigReader.getSendTimeoutMs();
  }

  @VisibleForTesting
  KafkaEventCreator(Producer<String, String> producer, String topic, long sendTimeoutMs) {
    this.producer = producer;
    this.topic = topic;
    this.sendTimeoutMs = sendTimeoutMs;
  }

  @Override
  public Optional<String> createEvent(String organizationId, ExperimentWarningEvent event)
      throws IOException {
    String json = OBJECT_MAPPER.writeValueAsString(event);
    try {
      RecordMetadata metadata =
          producer
              .send(new ProducerRecord<>(topic, organizationId, json))
              .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
      String eventId = metadata.topic() + "-" + metadata.partition() + "-" + metadata.offset();
      LOGGER.debug("Created event {} for organization {}", eventId, organizationId);
      return Optional.of(eventId);
    } catch (ExecutionException | TimeoutException e) {
      LOGGER.error("Error publishing event for organization {} to {}", organizationId, topic, e);
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while publishing event to " + topic, e);
    }
  }

  @Override
  public void close() {
    producer.close();
  }
}
