package com.z254.butterfly.prognos.event;

import lombok.Value;

import java.time.Instant;

/**
 * Envelope for an event published on the engine bus.
 */
@Value
public class EngineEvent {
    String eventId;
    String topic;
    Object payload;
    Instant publishedAt;

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
