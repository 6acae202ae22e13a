package com.hivemind.core.loop;

import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes text deltas as {@code agent.text} events.
 */
@Component
public class EventBusOutputChannel implements OutputChannel {

    private final EventBus eventBus;

    public EventBusOutputChannel(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void emit(String agentId, String textDelta) {
        eventBus.publish(HivemindEvent.of("agent.text", agentId, null, Map.of("text", textDelta)));
    }
}
