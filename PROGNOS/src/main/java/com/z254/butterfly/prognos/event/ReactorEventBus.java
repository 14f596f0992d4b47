package com.z254.butterfly.prognos.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link EventBus} backed by one multicast sink per topic.
 * <p>
 * Each topic queues at most {@code bufferSize} events for its slowest subscriber; events
 * beyond that are dropped and counted.
 */
@Slf4j
@Component
public class ReactorEventBus implements EventBus {

    private final Map<String, Sinks.Many<EngineEvent>> sinks = new ConcurrentHashMap<>();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final Clock clock;
    private final int bufferSize;

    @Autowired
    public ReactorEventBus(Clock clock) {
        this(clock, Queues.SMALL_BUFFER_SIZE);
    }

    ReactorEventBus(Clock clock, int bufferSize) {
        this.clock = clock;
        this.bufferSize = bufferSize;
    }

    @Override
    public EngineEvent publish(String topic, Object payload) {
        EngineEvent event = new EngineEvent(UUID.randomUUID().toString(), topic, payload, clock.instant());
        Sinks.Many<EngineEvent> sink = sinks.get(topic);
        if (sink == null || sink.currentSubscriberCount() == 0) {
            log.trace("No subscribers for topic {}", topic);
            return event;
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        switch (result) {
            case OK -> log.debug("Published event {} on {}", event.getEventId(), topic);
            case FAIL_ZERO_SUBSCRIBER -> log.trace("No subscribers for topic {}", topic);
            case FAIL_OVERFLOW -> {
                droppedEvents.incrementAndGet();
                log.warn("Dropped event {} on {}: subscriber queue full ({} events)",
                        event.getEventId(), topic, bufferSize);
            }
            default -> {
                droppedEvents.incrementAndGet();
                log.warn("Dropped event {} on {}: {}", event.getEventId(), topic, result);
            }
        }
        return event;
    }

    @Override
    public Disposable subscribe(String topic, Consumer<EngineEvent> handler) {
        return events(topic).subscribe(event -> {
            try {
                handler.accept(event);
            } catch (Exception e) {
                log.error("Event handler failed for topic {} event {}", topic, event.getEventId(), e);
            }
        });
    }

    /**
     * Raw event stream of a topic, honouring subscriber demand.
     */
    Flux<EngineEvent> events(String topic) {
        return sinks.computeIfAbsent(topic,
                t -> Sinks.many().multicast().<EngineEvent>onBackpressureBuffer(bufferSize, false)).asFlux();
    }

    public long droppedEvents() {
        return droppedEvents.get();
    }
}
