package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MidiNoteTest {

    @ParameterizedTest
    @ValueSource(ints = {-1, 128})
    void constructor_shouldRejectPitchOutsideMidiRange(int pitch) {
        assertThatThrownBy(() -> MidiNote.of("n1", pitch, 100, 0, 100))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("pitch");
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 128})
    void constructor_shouldRejectVelocityOutsideMidiRange(int velocity) {
        assertThatThrownBy(() -> MidiNote.of("n1", 60, velocity, 0, 100))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("velocity");
    }

    @Test
    void constructor_shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> MidiNote.of("n1", 60, 100, 0, 0))
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void transpose_shouldClampAndKeepIdentity() {
        MidiNote note = MidiNote.of("n1", 120, 100, 0, 100);

        MidiNote up = note.transpose(12);
        MidiNote down = note.transpose(-130);

        assertThat(up.pitch()).isEqualTo(127);
        assertThat(down.pitch()).isZero();
        assertThat(up.noteId()).isEqualTo("n1");
    }

    @Test
    void quantize_shouldSnapStartToNearestGridPoint() {
        // 120 bpm: a sixteenth note is 125 ms
        MidiNote note = MidiNote.of("n1", 60, 100, 190, 100);

        MidiNote quantized = note.quantize(QuantizeValue.SIXTEENTH, 120);

        assertThat(quantized.range()).isEqualTo(TimeRange.of(250, 100));
    }

    @Test
    void quantizeValue_gridMillis_shouldFollowTempo() {
        assertThat(QuantizeValue.QUARTER.gridMillis(120)).isEqualTo(500.0);
        assertThat(QuantizeValue.WHOLE.gridMillis(60)).isEqualTo(4000.0);
        assertThat(QuantizeValue.EIGHTH_TRIPLET.gridMillis(120)).isCloseTo(166.667, within(0.001));
        assertThat(QuantizeValue.fromLabel("1/8T")).isEqualTo(QuantizeValue.EIGHTH_TRIPLET);
    }

    @Test
    void noteName_shouldUseScientificPitchNotation() {
        assertThat(MidiNote.of("n1", 60, 100, 0, 1).noteName()).isEqualTo("C4");
        assertThat(MidiNote.of("n2", 69, 100, 0, 1).noteName()).isEqualTo("A4");
    }
}
