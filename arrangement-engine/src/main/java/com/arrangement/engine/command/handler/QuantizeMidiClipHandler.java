package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.QuantizeMidiClip;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class QuantizeMidiClipHandler extends TrackCommandHandler<QuantizeMidiClip, Long> {

    private final double defaultBpm;

    public QuantizeMidiClipHandler(EventSourcedTrackRepository repository,
                                   UndoRedoService<TrackEvent> undoRedoService,
                                   double defaultBpm) {
        super(repository, undoRedoService);
        this.defaultBpm = defaultBpm;
    }

    @Override
    protected void validate(QuantizeMidiClip command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (command.quantizeValue() == null) {
            errors.add("Quantize value is required");
        }
        if (command.bpm() != null && !(command.bpm() > 0)) {
            errors.add("Tempo must be positive");
        }
    }

    @Override
    protected Long execute(QuantizeMidiClip command, Track track, CommandContext context) {
        double bpm = command.bpm() != null ? command.bpm() : defaultBpm;
        track.quantizeMidiClip(command.clipId(), command.quantizeValue(), bpm);
        return track.getVersion();
    }
}
