package com.z254.butterfly.prognos.event.kafka;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.event.EngineEvent;
import com.z254.butterfly.prognos.event.EventBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards engine bus events to Kafka topics.
 * <p>
 * Only topics present in {@code prognos.kafka.topics} are relayed. Send failures are
 * logged and counted; they never reach the publisher of the engine event.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "prognos.kafka", name = "enabled", havingValue = "true")
public class KafkaEventRelay {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final EventBus eventBus;
    private final Map<String, String> topics;
    private final Counter relayed;
    private final Counter failed;
    private final Disposable.Composite subscriptions = Disposables.composite();

    public KafkaEventRelay(KafkaTemplate<String, Object> kafkaTemplate,
                           EventBus eventBus,
                           PrognosProperties properties,
                           MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.eventBus = eventBus;
        this.topics = Map.copyOf(properties.getKafka().getTopics());
        this.relayed = Counter.builder("prognos.kafka.events.relayed").register(meterRegistry);
        this.failed = Counter.builder("prognos.kafka.events.failed").register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        topics.forEach((engineTopic, kafkaTopic) ->
                subscriptions.add(eventBus.subscribe(engineTopic, event -> relay(kafkaTopic, event))));
        log.info("Relaying {} engine topics to Kafka: {}", topics.size(), topics.values());
    }

    @PreDestroy
    public void stop() {
        subscriptions.dispose();
    }

    void relay(String kafkaTopic, EngineEvent event) {
        Map<String, Object> message = new HashMap<>();
        message.put("eventId", event.getEventId());
        message.put("topic", event.getTopic());
        message.put("publishedAt", event.getPublishedAt().toString());
        message.put("payload", event.getPayload());

        CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(kafkaTopic, event.getEventId(), message);

        future.whenComplete((sendResult, ex) -> {
            if (ex != null) {
                failed.increment();
                log.error("Failed to relay event {} to {}: {}", event.getEventId(), kafkaTopic, ex.getMessage());
            } else {
                relayed.increment();
                log.debug("Relayed event {} to {} partition {} offset {}",
                        event.getEventId(), kafkaTopic,
                        sendResult.getRecordMetadata().partition(),
                        sendResult.getRecordMetadata().offset());
            }
        });
    }
}
