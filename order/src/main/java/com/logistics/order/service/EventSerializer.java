package com.logistics.order.service;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.shared.events.EventTypes;
import com.logistics.shared.events.OrderEvent;

import lombok.RequiredArgsConstructor;

/**
 * Stored payload codec. The payload is the flat JSON object of the event's
 * fields; the type tag is kept in its own column and selects the class on read.
 */
@Component
@RequiredArgsConstructor
public class EventSerializer {

    private final ObjectMapper objectMapper;

    public String serialize(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + event.type() + " for order " + event.orderId(), e);
        }
    }

    /**
     * @throws UnknownEventTypeException if no event class is registered for {@code type}
     */
    public OrderEvent deserialize(String type, String payload) {
        Class<? extends OrderEvent> eventClass = EventTypes.eventClassOf(type);
        if (eventClass == null) {
            throw new UnknownEventTypeException(type);
        }
        try {
            return objectMapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize stored " + type + " payload", e);
        }
    }
}
