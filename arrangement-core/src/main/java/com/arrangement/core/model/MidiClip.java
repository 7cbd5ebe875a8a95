package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;
import com.arrangement.core.exception.NotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Clip holding MIDI notes keyed by note id.
 *
 * Invariants checked by {@link #requireAccepts(MidiNote)} and {@link #requireAcceptsAll(List)}:
 * - every note lies inside the clip range
 * - no two notes with the same pitch overlap
 */
public record MidiClip(
    String clipId,
    TimeRange range,
    InstrumentRef instrument,
    ClipMetadata metadata,
    Map<String, MidiNote> notes
) implements Clip {

    public MidiClip {
        Objects.requireNonNull(clipId, "clipId");
        Objects.requireNonNull(range, "range");
        notes = notes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(notes));
    }

    public static MidiClip empty(String clipId, TimeRange range, InstrumentRef instrument, String name) {
        return new MidiClip(clipId, range, instrument, ClipMetadata.named(name), Map.of());
    }

    @Override
    public ClipType type() {
        return ClipType.MIDI;
    }

    @Override
    public MidiClip withRange(TimeRange newRange) {
        // Notes are stored in absolute time, so they travel with the clip.
        double offset = newRange.start() - range.start();
        Map<String, MidiNote> shifted = new TreeMap<>();
        notes.values().forEach(n ->
            shifted.put(n.noteId(), new MidiNote(n.noteId(), n.pitch(), n.velocity(), n.range().shift(offset))));
        return new MidiClip(clipId, newRange, instrument, metadata, shifted);
    }

    public Optional<MidiNote> note(String noteId) {
        return Optional.ofNullable(notes.get(noteId));
    }

    public MidiNote requireNote(String noteId) {
        return note(noteId).orElseThrow(() -> new NotFoundException("MidiNote", noteId));
    }

    public Collection<MidiNote> noteList() {
        return notes.values();
    }

    /**
     * Validate that the note could be placed in this clip, ignoring any note with the same id.
     */
    public void requireAccepts(MidiNote note) {
        requireInside(note);
        requireNoOverlap(note, notes.values());
    }

    /**
     * Validate a full replacement of the note collection, as produced by quantize or transpose.
     * Notes are checked against each other, not against the current notes.
     */
    public void requireAcceptsAll(List<MidiNote> replacement) {
        for (int i = 0; i < replacement.size(); i++) {
            MidiNote note = replacement.get(i);
            requireInside(note);
            requireNoOverlap(note, replacement.subList(0, i));
        }
    }

    private void requireInside(MidiNote note) {
        if (!range.contains(note.range())) {
            throw new InvariantViolationException(InvariantViolationException.NOTE_OUTSIDE_CLIP,
                String.format("Note %s is outside clip %s", note.noteId(), clipId));
        }
    }

    private static void requireNoOverlap(MidiNote note, Collection<MidiNote> others) {
        for (MidiNote existing : others) {
            if (!existing.noteId().equals(note.noteId()) && existing.overlaps(note)) {
                throw new InvariantViolationException(InvariantViolationException.NOTE_OVERLAP,
                    String.format("Note %s overlaps note %s at pitch %d", note.noteId(), existing.noteId(), note.pitch()));
            }
        }
    }

    public MidiClip withNote(MidiNote note) {
        Map<String, MidiNote> updated = new TreeMap<>(notes);
        updated.put(note.noteId(), note);
        return new MidiClip(clipId, range, instrument, metadata, updated);
    }

    public MidiClip withoutNote(String noteId) {
        if (!notes.containsKey(noteId)) {
            return this;
        }
        Map<String, MidiNote> updated = new TreeMap<>(notes);
        updated.remove(noteId);
        return new MidiClip(clipId, range, instrument, metadata, updated);
    }

    public MidiClip withNotes(List<MidiNote> replacement) {
        Map<String, MidiNote> updated = new TreeMap<>();
        replacement.forEach(n -> updated.put(n.noteId(), n));
        return new MidiClip(clipId, range, instrument, metadata, updated);
    }

    public List<MidiNote> mapNotes(UnaryOperator<MidiNote> mapper) {
        return notes.values().stream().map(mapper).toList();
    }
}
