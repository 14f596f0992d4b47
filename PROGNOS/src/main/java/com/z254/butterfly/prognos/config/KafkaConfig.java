package com.z254.butterfly.prognos.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration for the engine event relay.
 * <p>
 * Events are serialized as JSON by an idempotent producer. Only active when
 * {@code prognos.kafka.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "prognos.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final PrognosProperties prognosProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, PrognosProperties prognosProperties) {
        this.kafkaProperties = kafkaProperties;
        this.prognosProperties = prognosProperties;
    }

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 100);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    @Bean
    public KafkaAdmin.NewTopics prognosTopics() {
        return new KafkaAdmin.NewTopics(prognosProperties.getKafka().getTopics().values().stream()
                .distinct()
                .map(name -> TopicBuilder.name(name)
                        .partitions(3)
                        .replicas(1)
                        .config("retention.ms", "604800000") // 7 days
                        .build())
                .toArray(NewTopic[]::new));
    }
}
