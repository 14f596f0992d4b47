package com.z254.butterfly.prognos.event;

import reactor.core.Disposable;

import java.util.function.Consumer;

/**
 * In-process publish/subscribe for engine events.
 * <p>
 * Delivery to one subscriber never depends on another: a handler that throws is
 * logged and the remaining handlers still receive the event.
 */
public interface EventBus {

    EngineEvent publish(String topic, Object payload);

    /**
     * Subscribe to a topic.
     *
     * @return handle that cancels the subscription when disposed
     */
    Disposable subscribe(String topic, Consumer<EngineEvent> handler);
}
