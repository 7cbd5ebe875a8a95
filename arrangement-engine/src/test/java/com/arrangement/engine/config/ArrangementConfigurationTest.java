package com.arrangement.engine.config;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.model.TrackType;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.CommandResult;
import com.arrangement.engine.command.TrackCommands.CreateTrack;
import com.arrangement.engine.dispatch.ArrangementMediator;
import com.arrangement.engine.metrics.ArrangementMetrics;
import com.arrangement.engine.undo.UndoRedoService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringJUnitConfig(ArrangementConfiguration.class)
@TestPropertySource(properties = "arrangement.undo.max-batch=10")
@DisplayName("Arrangement configuration")
class ArrangementConfigurationTest {

    @Autowired
    private ArrangementProperties properties;

    @Autowired
    private ArrangementMediator mediator;

    @Autowired
    private UndoRedoService<TrackEvent> undoRedoService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Properties come from arrangement.properties with test overrides")
    void testPropertiesBound() {
        assertEquals(50, properties.undoMaxDepth());
        assertEquals(10, properties.undoMaxBatch());
        assertEquals(100, properties.snapshotInterval());
        assertEquals(120.0, properties.defaultBpm());
        assertEquals(10, undoRedoService.maxBatchSize());
    }

    @Test
    @DisplayName("Mediator has every command and query registered")
    void testHandlersRegistered() {
        assertThat(mediator.registeredCommands()).containsExactlyInAnyOrder(
            "CreateTrack", "AddClip", "RemoveClip", "MoveClip", "UpdateTrackMetadata",
            "AddMidiNote", "RemoveMidiNote", "UpdateMidiNote", "QuantizeMidiClip", "TransposeMidiClip",
            "SetAudioClipGain", "Undo", "Redo", "BatchUndo", "BatchRedo", "ClearHistory");
        assertThat(mediator.registeredQueries()).containsExactlyInAnyOrder(
            "GetTrack", "GetTrackAtVersion", "GetTracksByOwner", "GetTracksByType",
            "GetUndoRedoStatus", "GetTrackHistory");
    }

    @Test
    @DisplayName("Wired mediator dispatches and records metrics")
    void testWiredDispatch() {
        CommandResult<String> result = mediator.send(CreateTrack.of("user-a", TrackType.BUS, "Reverb Bus"),
            CommandContext.forUser("user-a"));

        assertTrue(result.success());
        assertThat(meterRegistry.get(ArrangementMetrics.COMMANDS).tag("command", "CreateTrack").counter().count())
            .isGreaterThanOrEqualTo(1.0);
        assertThat(meterRegistry.get(ArrangementMetrics.UNDO_HISTORIES).gauge()).isNotNull();
    }

    @Test
    @DisplayName("Invalid tunables are rejected")
    void testPropertiesValidation() {
        assertThatThrownBy(() -> new ArrangementProperties(0, 50, 100, 120))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArrangementProperties(50, 50, -1, 120))
            .isInstanceOf(IllegalArgumentException.class);
        assertEquals(ArrangementProperties.defaults(), new ArrangementProperties(50, 50, 100, 120));
    }
}
