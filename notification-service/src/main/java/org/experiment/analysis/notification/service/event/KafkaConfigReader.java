package org.experiment.analysis.notification.service.event;

import com.typesafe.config.Config;
import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;

class KafkaConfigReader {
  static final String TOPIC_NAME_CONFIG = "topic";
  static final String BOOTSTRAP_SERVERS_CONFIG = "bootstrap.servers";
  static final String PRODUCER_CONFIG = "producer";
  static final String SEND_TIMEOUT_CONFIG = "sendTimeoutMs";
  static final long DEFAULT_SEND_TIMEOUT_MS = 10_000;

  private final Config kafkaConfig;

  KafkaConfigReader(Config kafkaConfig) {
    this.kafkaConfig = kafkaConfig;
  }

  String getProducerTopicName() {
    return kafkaConfig.getString(
        new StringJoiner(".").add(PRODUCER_CONFIG).add(TOPIC_NAME_CONFIG).toString());
  }

  long getSendTimeoutMs() {
    return kafkaConfig.hasPath(SEND_TIMEOUT_CONFIG)
        ? kafkaConfig.getLong(SEND_TIMEOUT_CONFIG)
        : DEFAULT_SEND_TIMEOUT_MS;
  }

  Map<String, Object> getProducerConfig() {
    Map<String, Object> properties = createProducerBaseProperties();
    Map<String, Object> overrides = getFlatMapConfig(kafkaConfig, PRODUCER_CONFIG);
    // the topic is ours, not a producer property
    overrides.remove(TOPIC_NAME_CONFIG);
    properties.putAll(overrides);
    return properties;
  }

  private Map<String, Object> getFlatMapConfig(Config config, String path) {
    Map<String, Object> propertiesMap = new HashMap<>();
    if (!config.hasPath(path)) {
      return propertiesMap;
    }
    Config subConfig = config.getConfig(path);
    subConfig
        .entrySet()
        .forEach(entry -> propertiesMap.put(entry.getKey(), subConfig.getString(entry.getKey())));
    return propertiesMap;
  }

  private Map<String, Object> createProducerBaseProperties() {
    Map<String, Object> baseProperties = new HashMap<>();
    baseProperties.put(
        ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaConfig.getString(BOOTSTRAP_SERVERS_CONFIG));
    baseProperties.put(ProducerConfig.ACKS_CONFIG, "all");
    baseProperties.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384);
    baseProperties.put(ProducerConfig.LINGER_MS_CONFIG, 1);
    baseProperties.put(
        ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    baseProperties.put(
        ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return baseProperties;
  }
}
