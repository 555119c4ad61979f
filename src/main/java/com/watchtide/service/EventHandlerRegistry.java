package com.watchtide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps queue item type → handler.
 *
 * EventHandler beans win; every type under watchtide.topics.tasks that has
 * no bean gets a TopicForwardingHandler for its topic:
 *   watchtide:
 *     topics:
 *       tasks:
 *         gmail_history: watchtide.tasks.gmail-history
 */
@Component
@Slf4j
public class EventHandlerRegistry {

    private final Map<String, EventHandler> handlers = new TreeMap<>();

    public EventHandlerRegistry(List<EventHandler> handlerBeans,
                                KafkaTemplate<String, String> kafkaTemplate,
                                ObjectMapper objectMapper,
                                WatchtideProperties properties,
                                Clock clock) {
        for (EventHandler handler : handlerBeans) {
            EventHandler previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for type " + handler.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        properties.getTopics().getTasks().forEach((type, topic) -> {
            if (!handlers.containsKey(type)) {
                handlers.put(type, new TopicForwardingHandler(type, topic, kafkaTemplate, objectMapper, clock));
            }
        });
        log.info("Event handlers registered: types={}", handlers.keySet());
    }

    public Optional<EventHandler> find(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Map<String, EventHandler> all() {
        return Collections.unmodifiableMap(handlers);
    }
}
