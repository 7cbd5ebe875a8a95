package com.arrangement.core.aggregate;

import com.arrangement.core.event.AudioClipGainChanged;
import com.arrangement.core.event.ClipAdded;
import com.arrangement.core.event.ClipMoved;
import com.arrangement.core.event.ClipRemoved;
import com.arrangement.core.event.MidiClipNotesReplaced;
import com.arrangement.core.event.MidiClipQuantized;
import com.arrangement.core.event.MidiClipTransposed;
import com.arrangement.core.event.MidiNoteAdded;
import com.arrangement.core.event.MidiNoteRemoved;
import com.arrangement.core.event.MidiNoteUpdated;
import com.arrangement.core.event.TrackCreated;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.event.TrackMetadataUpdated;
import com.arrangement.core.exception.InvariantViolationException;
import com.arrangement.core.exception.NotFoundException;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.model.AudioClip;
import com.arrangement.core.model.Clip;
import com.arrangement.core.model.ClipType;
import com.arrangement.core.model.MidiClip;
import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.QuantizeValue;
import com.arrangement.core.model.TimeRange;
import com.arrangement.core.model.TrackMetadata;
import com.arrangement.core.model.TrackState;
import com.arrangement.core.model.TrackType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Event-sourced track holding MIDI or audio clips.
 *
 * Invariants:
 * - no two clips on a track have overlapping time ranges
 * - clip kind matches track kind (instrument: MIDI, audio: audio, bus: none)
 * - MIDI operations are rejected on non-instrument tracks
 *
 * <p>Every public operation validates against the current state and raises exactly one event.</p>
 */
public class Track extends EventSourcedAggregate<TrackEvent> {

    private static final Logger log = LoggerFactory.getLogger(Track.class);

    public static final int MAX_TRANSPOSE = 127;

    private final Clock clock;

    private String ownerId;
    private TrackType trackType;
    private TrackMetadata metadata;
    private final Map<String, Clip> clips = new LinkedHashMap<>();

    private Track(String trackId, Clock clock) {
        super(trackId);
        this.clock = clock;
    }

    // ========== Factories ==========

    public static Track create(String trackId, String ownerId, TrackType trackType, TrackMetadata metadata) {
        return create(trackId, ownerId, trackType, metadata, List.of(), Clock.systemUTC());
    }

    public static Track create(String trackId, String ownerId, TrackType trackType,
                               TrackMetadata metadata, List<Clip> initialClips, Clock clock) {
        List<String> errors = new ArrayList<>();
        if (trackId == null || trackId.isBlank()) {
            errors.add("Track ID is required");
        }
        if (ownerId == null || ownerId.isBlank()) {
            errors.add("Owner ID is required");
        }
        if (trackType == null) {
            errors.add("Track type is required");
        }
        if (metadata == null) {
            errors.add("Track metadata is required");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        Map<String, Clip> placed = new LinkedHashMap<>();
        for (Clip clip : initialClips) {
            requirePlaceable(trackType, placed, clip);
            placed.put(clip.clipId(), clip);
        }

        Track track = new Track(trackId, clock);
        track.raise(new TrackCreated(trackId, clock.instant(), ownerId, trackType, metadata, initialClips));
        return track;
    }

    /**
     * Rebuild a track by applying its events in order, starting from empty state.
     */
    public static Track fromHistory(String trackId, List<? extends TrackEvent> events) {
        return fromHistory(trackId, events, Clock.systemUTC());
    }

    public static Track fromHistory(String trackId, List<? extends TrackEvent> events, Clock clock) {
        Track track = new Track(trackId, clock);
        track.loadFromHistory(events);
        return track;
    }

    /**
     * Resume from a snapshot at the given version and apply the events stored after it.
     */
    public static Track fromSnapshot(TrackState state, long snapshotVersion,
                                     List<? extends TrackEvent> eventsAfter, Clock clock) {
        Track track = new Track(state.trackId(), clock);
        track.ownerId = state.ownerId();
        track.trackType = state.trackType();
        track.metadata = state.metadata();
        track.clips.putAll(state.clips());
        track.restoreVersion(snapshotVersion);
        track.loadFromHistory(eventsAfter);
        return track;
    }

    // ========== Clip operations ==========

    public void addClip(Clip clip) {
        requireCreated();
        requirePlaceable(trackType, clips, clip);
        raise(new ClipAdded(getId(), now(), clip));
    }

    public void removeClip(String clipId) {
        requireCreated();
        Clip clip = requireClip(clipId);
        raise(new ClipRemoved(getId(), now(), clipId, clip));
    }

    public void moveClip(String clipId, TimeRange newRange) {
        requireCreated();
        Clip clip = requireClip(clipId);
        requireNoOverlap(clips, clipId, newRange);
        raise(new ClipMoved(getId(), now(), clipId, clip.range(), newRange));
    }

    public void updateMetadata(TrackMetadata newMetadata) {
        requireCreated();
        if (newMetadata == null) {
            throw new ValidationException("Track metadata is required");
        }
        raise(new TrackMetadataUpdated(getId(), now(), metadata, newMetadata));
    }

    public void setAudioClipGain(String clipId, double gain) {
        requireCreated();
        requireTrackType(TrackType.AUDIO, "setAudioClipGain");
        AudioClip.requireValidGain(gain);
        Clip clip = requireClip(clipId);
        if (!(clip instanceof AudioClip audioClip)) {
            throw InvariantViolationException.clipTypeMismatch(trackType.name(), clip.type().name());
        }
        raise(new AudioClipGainChanged(getId(), now(), clipId, audioClip.gain(), gain));
    }

    // ========== MIDI operations ==========

    public void addMidiNote(String clipId, MidiNote note) {
        requireCreated();
        requireTrackType(TrackType.INSTRUMENT, "addMidiNote");
        MidiClip clip = requireMidiClip(clipId);
        if (clip.note(note.noteId()).isPresent()) {
            throw new InvariantViolationException(InvariantViolationException.DUPLICATE_NOTE,
                String.format("Note %s already exists in clip %s", note.noteId(), clipId));
        }
        clip.requireAccepts(note);
        raise(new MidiNoteAdded(getId(), now(), clipId, note));
    }

    public void removeMidiNote(String clipId, String noteId) {
        requireCreated();
        requireTrackType(TrackType.INSTRUMENT, "removeMidiNote");
        MidiClip clip = requireMidiClip(clipId);
        MidiNote note = clip.requireNote(noteId);
        raise(new MidiNoteRemoved(getId(), now(), clipId, noteId, note));
    }

    /**
     * Replace the note carrying the same id as {@code updated}.
     */
    public void updateMidiNote(String clipId, MidiNote updated) {
        requireCreated();
        requireTrackType(TrackType.INSTRUMENT, "updateMidiNote");
        MidiClip clip = requireMidiClip(clipId);
        MidiNote previous = clip.requireNote(updated.noteId());
        clip.requireAccepts(updated);
        raise(new MidiNoteUpdated(getId(), now(), clipId, updated.noteId(), previous, updated));
    }

    public void quantizeMidiClip(String clipId, QuantizeValue quantizeValue, double bpm) {
        requireCreated();
        requireTrackType(TrackType.INSTRUMENT, "quantizeMidiClip");
        MidiClip clip = requireMidiClip(clipId);
        List<MidiNote> original = List.copyOf(clip.noteList());
        List<MidiNote> quantized = clip.mapNotes(n -> n.quantize(quantizeValue, bpm));
        clip.requireAcceptsAll(quantized);
        raise(new MidiClipQuantized(getId(), now(), clipId, quantizeValue, bpm, original, quantized));
    }

    public void transposeMidiClip(String clipId, int semitones) {
        requireCreated();
        requireTrackType(TrackType.INSTRUMENT, "transposeMidiClip");
        if (Math.abs(semitones) > MAX_TRANSPOSE) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_ARGUMENT,
                String.format("Transpose must be within +/-%d semitones, got %d", MAX_TRANSPOSE, semitones));
        }
        MidiClip clip = requireMidiClip(clipId);
        List<MidiNote> original = List.copyOf(clip.noteList());
        List<MidiNote> transposed = clip.mapNotes(n -> n.transpose(semitones));
        clip.requireAcceptsAll(transposed);
        raise(new MidiClipTransposed(getId(), now(), clipId, semitones, original, transposed));
    }

    // ========== Event application ==========

    @Override
    protected void apply(TrackEvent event) {
        switch (event.kind()) {
            case TRACK_CREATED -> {
                TrackCreated created = (TrackCreated) event;
                ownerId = created.ownerId();
                trackType = created.trackType();
                metadata = created.metadata();
                created.initialClips().forEach(c -> clips.put(c.clipId(), c));
            }
            case TRACK_METADATA_UPDATED -> metadata = ((TrackMetadataUpdated) event).metadata();
            case CLIP_ADDED -> {
                Clip clip = ((ClipAdded) event).clip();
                clips.put(clip.clipId(), clip);
            }
            case CLIP_REMOVED -> clips.remove(((ClipRemoved) event).clipId());
            case CLIP_MOVED -> {
                ClipMoved moved = (ClipMoved) event;
                clips.computeIfPresent(moved.clipId(), (id, clip) -> clip.withRange(moved.range()));
            }
            case MIDI_NOTE_ADDED -> {
                MidiNoteAdded added = (MidiNoteAdded) event;
                updateMidiClip(added.clipId(), clip -> clip.withNote(added.note()));
            }
            case MIDI_NOTE_REMOVED -> {
                MidiNoteRemoved removed = (MidiNoteRemoved) event;
                updateMidiClip(removed.clipId(), clip -> clip.withoutNote(removed.noteId()));
            }
            case MIDI_NOTE_UPDATED -> {
                MidiNoteUpdated updated = (MidiNoteUpdated) event;
                updateMidiClip(updated.clipId(), clip -> clip.withoutNote(updated.noteId()).withNote(updated.note()));
            }
            case MIDI_CLIP_QUANTIZED -> {
                MidiClipQuantized quantized = (MidiClipQuantized) event;
                updateMidiClip(quantized.clipId(), clip -> clip.withNotes(quantized.quantizedNotes()));
            }
            case MIDI_CLIP_TRANSPOSED -> {
                MidiClipTransposed transposed = (MidiClipTransposed) event;
                updateMidiClip(transposed.clipId(), clip -> clip.withNotes(transposed.transposedNotes()));
            }
            case MIDI_CLIP_NOTES_REPLACED -> {
                MidiClipNotesReplaced replaced = (MidiClipNotesReplaced) event;
                updateMidiClip(replaced.clipId(), clip -> clip.withNotes(replaced.notes()));
            }
            case AUDIO_CLIP_GAIN_CHANGED -> {
                AudioClipGainChanged changed = (AudioClipGainChanged) event;
                Clip clip = clips.get(changed.clipId());
                if (clip instanceof AudioClip audioClip) {
                    clips.put(audioClip.clipId(), audioClip.withGain(changed.gain()));
                } else {
                    log.debug("Gain change for missing audio clip {} on track {} ignored", changed.clipId(), getId());
                }
            }
            case UNRECOGNIZED -> log.warn("Ignoring unrecognized event kind {} on track {}", event.eventKind(), getId());
        }
    }

    private void updateMidiClip(String clipId, UnaryOperator<MidiClip> change) {
        Clip clip = clips.get(clipId);
        if (clip instanceof MidiClip midiClip) {
            clips.put(clipId, change.apply(midiClip));
        } else {
            log.debug("Event for missing MIDI clip {} on track {} ignored", clipId, getId());
        }
    }

    // ========== Queries ==========

    public String getOwnerId() {
        return ownerId;
    }

    public TrackType getTrackType() {
        return trackType;
    }

    public TrackMetadata getMetadata() {
        return metadata;
    }

    public Map<String, Clip> getClips() {
        return Map.copyOf(clips);
    }

    public Optional<Clip> getClip(String clipId) {
        return Optional.ofNullable(clips.get(clipId));
    }

    public List<Clip> clipsInRange(TimeRange range) {
        return sortedClips().stream()
            .filter(c -> c.range().intersects(range))
            .collect(Collectors.toList());
    }

    public List<Clip> clipsAt(double time) {
        return sortedClips().stream()
            .filter(c -> c.range().contains(time))
            .collect(Collectors.toList());
    }

    public List<Clip> clipsOfType(ClipType clipType) {
        return sortedClips().stream()
            .filter(c -> c.type() == clipType)
            .collect(Collectors.toList());
    }

    public boolean hasClips() {
        return !clips.isEmpty();
    }

    public boolean isEmpty() {
        return clips.isEmpty();
    }

    public int clipCount() {
        return clips.size();
    }

    /**
     * End of the last clip in milliseconds, or 0 for an empty track.
     */
    public double duration() {
        return clips.values().stream()
            .mapToDouble(c -> c.range().end())
            .max()
            .orElse(0);
    }

    public TrackState state() {
        return new TrackState(getId(), ownerId, trackType, metadata, clips);
    }

    // ========== Invariant helpers ==========

    private void requireCreated() {
        if (trackType == null) {
            throw new NotFoundException("Track", getId());
        }
    }

    private void requireTrackType(TrackType required, String operation) {
        if (trackType != required) {
            throw InvariantViolationException.trackTypeMismatch(operation, trackType.name());
        }
    }

    private Clip requireClip(String clipId) {
        Clip clip = clips.get(clipId);
        if (clip == null) {
            throw new NotFoundException("Clip", clipId);
        }
        return clip;
    }

    private MidiClip requireMidiClip(String clipId) {
        Clip clip = requireClip(clipId);
        if (!(clip instanceof MidiClip midiClip)) {
            throw InvariantViolationException.clipTypeMismatch(trackType.name(), clip.type().name());
        }
        return midiClip;
    }

    private static void requirePlaceable(TrackType trackType, Map<String, Clip> existing, Clip clip) {
        if (!trackType.accepts(clip.type())) {
            throw InvariantViolationException.clipTypeMismatch(trackType.name(), clip.type().name());
        }
        if (existing.containsKey(clip.clipId())) {
            throw new InvariantViolationException(InvariantViolationException.DUPLICATE_CLIP,
                String.format("Clip %s already exists", clip.clipId()));
        }
        requireNoOverlap(existing, clip.clipId(), clip.range());
    }

    private static void requireNoOverlap(Map<String, Clip> existing, String clipId, TimeRange range) {
        for (Clip other : existing.values()) {
            if (!other.clipId().equals(clipId) && other.range().intersects(range)) {
                throw InvariantViolationException.clipOverlap(clipId, other.clipId());
            }
        }
    }

    private List<Clip> sortedClips() {
        return clips.values().stream()
            .sorted(Comparator.comparingDouble((Clip c) -> c.range().start()).thenComparing(Clip::clipId))
            .collect(Collectors.toList());
    }

    private Instant now() {
        return clock.instant();
    }
}
