package com.arrangement.engine.test;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.QuantizeValue;
import com.arrangement.core.model.TimeRange;
import com.arrangement.core.model.TrackState;
import com.arrangement.core.model.TrackType;
import com.arrangement.core.serialization.JsonSupport;
import com.arrangement.engine.command.Command;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.CommandResult;
import com.arrangement.engine.command.HistoryCommands.Redo;
import com.arrangement.engine.command.HistoryCommands.Undo;
import com.arrangement.engine.command.TrackCommands.AddClip;
import com.arrangement.engine.command.TrackCommands.AddMidiNote;
import com.arrangement.engine.command.TrackCommands.CreateTrack;
import com.arrangement.engine.command.TrackCommands.MoveClip;
import com.arrangement.engine.command.TrackCommands.QuantizeMidiClip;
import com.arrangement.engine.command.TrackCommands.RemoveClip;
import com.arrangement.engine.command.TrackCommands.RemoveMidiNote;
import com.arrangement.engine.command.TrackCommands.SetAudioClipGain;
import com.arrangement.engine.command.TrackCommands.TransposeMidiClip;
import com.arrangement.engine.command.TrackCommands.UpdateMidiNote;
import com.arrangement.engine.command.TrackCommands.UpdateTrackMetadata;
import com.arrangement.engine.dispatch.ArrangementMediator;
import com.arrangement.engine.dispatch.HandlerRegistrations;
import com.arrangement.engine.history.TrackHistoryService;
import com.arrangement.engine.metrics.ArrangementMetrics;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.persistence.InMemoryEventStore;
import com.arrangement.engine.undo.UndoRedoService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.arrangement.engine.test.EngineFixtures.OWNER;
import static com.arrangement.engine.test.EngineFixtures.audioClip;
import static com.arrangement.engine.test.EngineFixtures.midiClip;
import static com.arrangement.engine.test.EngineFixtures.named;
import static com.arrangement.engine.test.EngineFixtures.newStore;
import static com.arrangement.engine.test.EngineFixtures.note;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Replaying a track's event log always produces the same state.
 *
 * Properties covered:
 * 1. Two fresh replays of one log are equal
 * 2. Snapshot plus tail equals full replay
 * 3. Undo followed by redo restores the state after the original edit, for every undoable kind
 * 4. Undoing everything returns to the created state
 */
@DisplayName("Determinism & Replay Tests")
class DeterminismReplayTest {

    private static final String KEYS = "keys";
    private static final String VOCALS = "vocals";

    private TimeController time;
    private InMemoryEventStore<TrackEvent> store;
    private EventSourcedTrackRepository repository;
    private ArrangementMediator mediator;

    @BeforeEach
    void setUp() {
        time = new TimeController();
        store = newStore(time);
        repository = new EventSourcedTrackRepository(store, JsonSupport.newObjectMapper(), time, 4);
        UndoRedoService<TrackEvent> undoRedoService = new UndoRedoService<>(store, time, 50, 50);
        mediator = new ArrangementMediator(new ArrangementMetrics(undoRedoService));
        HandlerRegistrations.registerAll(mediator, repository, undoRedoService,
            new TrackHistoryService(store, time), time, 120);

        send(new CreateTrack(KEYS, OWNER, TrackType.INSTRUMENT, named("Keys"), List.of(midiClip("m1", 0, 8000))));
        send(new CreateTrack(VOCALS, OWNER, TrackType.AUDIO, named("Vocals"), List.of(audioClip("a1", 0, 8000))));
    }

    // ========== Replay ==========

    @Test
    @DisplayName("Multiple replays should produce identical results")
    void testMultipleReplayConsistency() {
        scriptedSession();

        TrackState first = Track.fromHistory(KEYS, store.load(KEYS)).state();
        TrackState second = Track.fromHistory(KEYS, store.load(KEYS)).state();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Snapshot plus tail should match a full replay")
    void testSnapshotReplayEquivalence() {
        scriptedSession();

        assertTrue(store.loadSnapshot(KEYS).isPresent());
        assertEquals(Track.fromHistory(KEYS, store.load(KEYS)).state(), repository.load(KEYS).state());
    }

    // ========== Undo/redo round trips ==========

    @Test
    @DisplayName("Undo then redo restores the edited state for every undoable operation")
    void testUndoRedoRoundTrips() {
        send(new AddMidiNote(KEYS, "m1", note("n1", 60, 130, 400)));
        send(new AddMidiNote(KEYS, "m1", note("n2", 64, 1010, 300)));

        List<Map.Entry<String, Command<?>>> edits = List.of(
            Map.entry("add note", new AddMidiNote(KEYS, "m1", note("n3", 67, 2000, 250))),
            Map.entry("update note", new UpdateMidiNote(KEYS, "m1", MidiNote.of("n1", 62, 90, 130, 500))),
            Map.entry("remove note", new RemoveMidiNote(KEYS, "m1", "n2")),
            Map.entry("quantize", new QuantizeMidiClip(KEYS, "m1", QuantizeValue.QUARTER, null)),
            Map.entry("transpose", new TransposeMidiClip(KEYS, "m1", -5)),
            Map.entry("move clip", new MoveClip(KEYS, "m1", TimeRange.of(1000, 8000))),
            Map.entry("add clip", new AddClip(KEYS, midiClip("m2", 9000, 1000))),
            Map.entry("metadata", new UpdateTrackMetadata(KEYS, named("Piano").withVolume(0.5)))
        );

        edits.forEach(edit -> assertRoundTrip(KEYS, edit.getKey(), edit.getValue()));
        assertRoundTrip(VOCALS, "gain", new SetAudioClipGain(VOCALS, "a1", 0.25));
        assertRoundTrip(KEYS, "remove clip", new RemoveClip(KEYS, "m1"));
    }

    @Test
    @DisplayName("Undoing every edit returns to the created state")
    void testUndoAll() {
        TrackState created = repository.load(KEYS).state();
        int edits = scriptedSession();

        for (int i = 0; i < edits; i++) {
            assertTrue(send(new Undo(KEYS)).success());
        }

        assertEquals(created, repository.load(KEYS).state());
    }

    // ========== Helpers ==========

    private void assertRoundTrip(String trackId, String label, Command<?> command) {
        assertTrue(send(command).success(), label);
        TrackState edited = repository.load(trackId).state();

        assertTrue(send(new Undo(trackId)).success(), label);
        assertTrue(send(new Redo(trackId)).success(), label);

        assertEquals(edited, repository.load(trackId).state(), label);
    }

    private int scriptedSession() {
        List<Command<?>> session = List.of(
            new AddMidiNote(KEYS, "m1", note("n1", 60, 0, 500)),
            new AddMidiNote(KEYS, "m1", note("n2", 64, 520, 480)),
            new AddMidiNote(KEYS, "m1", note("n3", 67, 1010, 470)),
            new TransposeMidiClip(KEYS, "m1", 2),
            new QuantizeMidiClip(KEYS, "m1", QuantizeValue.EIGHTH, 100.0),
            new MoveClip(KEYS, "m1", TimeRange.of(2000, 8000)),
            new UpdateTrackMetadata(KEYS, named("Lead")),
            new RemoveMidiNote(KEYS, "m1", "n2")
        );
        for (Command<?> command : session) {
            time.advanceMillis(250);
            assertTrue(send(command).success(), command.commandName());
        }
        return session.size();
    }

    private <R> CommandResult<R> send(Command<R> command) {
        return mediator.send(command, CommandContext.forUser(OWNER));
    }
}
