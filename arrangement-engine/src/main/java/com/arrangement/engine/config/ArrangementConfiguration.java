package com.arrangement.engine.config;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.serialization.JsonSupport;
import com.arrangement.core.serialization.TrackEventCodec;
import com.arrangement.core.store.EventStore;
import com.arrangement.engine.dispatch.ArrangementMediator;
import com.arrangement.engine.dispatch.HandlerRegistrations;
import com.arrangement.engine.history.TrackHistoryService;
import com.arrangement.engine.metrics.ArrangementMetrics;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.persistence.InMemoryEventStore;
import com.arrangement.engine.undo.UndoRedoService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.time.Clock;

/**
 * Wires the arrangement engine. Everything is constructor-injected; there are no process-wide
 * registries.
 */
@Configuration
@PropertySource("classpath:arrangement.properties")
public class ArrangementConfiguration {

    @Bean
    public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public ArrangementProperties arrangementProperties(
            @Value("${arrangement.undo.max-depth:50}") int undoMaxDepth,
            @Value("${arrangement.undo.max-batch:50}") int undoMaxBatch,
            @Value("${arrangement.snapshot.interval:100}") int snapshotInterval,
            @Value("${arrangement.quantize.default-bpm:120}") double defaultBpm) {
        return new ArrangementProperties(undoMaxDepth, undoMaxBatch, snapshotInterval, defaultBpm);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.newObjectMapper();
    }

    @Bean
    public TrackEventCodec trackEventCodec(ObjectMapper objectMapper) {
        return new TrackEventCodec(objectMapper);
    }

    @Bean
    public EventStore<TrackEvent> eventStore(TrackEventCodec codec, Clock clock) {
        return new InMemoryEventStore<>(codec, clock);
    }

    @Bean
    public EventSourcedTrackRepository trackRepository(EventStore<TrackEvent> eventStore, ObjectMapper objectMapper,
                                                       Clock clock, ArrangementProperties properties) {
        return new EventSourcedTrackRepository(eventStore, objectMapper, clock, properties.snapshotInterval());
    }

    @Bean
    public UndoRedoService<TrackEvent> undoRedoService(EventStore<TrackEvent> eventStore, Clock clock,
                                                       ArrangementProperties properties) {
        return new UndoRedoService<>(eventStore, clock, properties.undoMaxDepth(), properties.undoMaxBatch());
    }

    @Bean
    public TrackHistoryService trackHistoryService(EventStore<TrackEvent> eventStore, Clock clock) {
        return new TrackHistoryService(eventStore, clock);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ArrangementMetrics arrangementMetrics(UndoRedoService<TrackEvent> undoRedoService, MeterRegistry registry) {
        ArrangementMetrics metrics = new ArrangementMetrics(undoRedoService);
        metrics.bindTo(registry);
        return metrics;
    }

    @Bean
    public ArrangementMediator arrangementMediator(ArrangementMetrics metrics,
                                                   EventSourcedTrackRepository repository,
                                                   UndoRedoService<TrackEvent> undoRedoService,
                                                   TrackHistoryService historyService,
                                                   Clock clock,
                                                   ArrangementProperties properties) {
        ArrangementMediator mediator = new ArrangementMediator(metrics);
        HandlerRegistrations.registerAll(mediator, repository, undoRedoService, historyService, clock,
            properties.defaultBpm());
        return mediator;
    }
}
