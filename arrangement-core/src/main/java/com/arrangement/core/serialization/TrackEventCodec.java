package com.arrangement.core.serialization;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.event.TrackEventKind;
import com.arrangement.core.event.UnrecognizedEvent;
import com.arrangement.core.exception.EventSerializationException;
import com.arrangement.core.store.EventCodec;
import com.arrangement.core.store.StoredEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON codec for the track event family. The stored kind selects the record type;
 * kinds this build does not know decode to {@link UnrecognizedEvent}.
 */
public class TrackEventCodec implements EventCodec<TrackEvent> {

    private static final Logger log = LoggerFactory.getLogger(TrackEventCodec.class);

    private final ObjectMapper objectMapper;

    public TrackEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String encode(TrackEvent event) {
        try {
            if (event instanceof UnrecognizedEvent unrecognized) {
                return objectMapper.writeValueAsString(unrecognized.payload());
            }
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                String.format("Failed to serialize %s for %s", event.eventKind(), event.aggregateId()), e);
        }
    }

    @Override
    public TrackEvent decode(StoredEvent storedEvent) {
        Optional<TrackEventKind> kind = TrackEventKind.fromEventName(storedEvent.eventKind());
        try {
            if (kind.isEmpty()) {
                log.debug("Decoding unknown event kind {} at version {} of {}",
                    storedEvent.eventKind(), storedEvent.version(), storedEvent.aggregateId());
                JsonNode payload = objectMapper.readTree(storedEvent.payload());
                return new UnrecognizedEvent(
                    storedEvent.aggregateId(), storedEvent.timestamp(), storedEvent.eventKind(), payload);
            }
            return objectMapper.readValue(storedEvent.payload(), kind.get().eventClass());
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                String.format("Failed to deserialize %s at version %d of %s",
                    storedEvent.eventKind(), storedEvent.version(), storedEvent.aggregateId()), e);
        }
    }
}
