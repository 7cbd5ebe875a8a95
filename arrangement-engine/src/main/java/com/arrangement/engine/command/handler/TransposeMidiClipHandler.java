package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.TransposeMidiClip;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class TransposeMidiClipHandler extends TrackCommandHandler<TransposeMidiClip, Long> {

    public TransposeMidiClipHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(TransposeMidiClip command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (command.semitones() == 0) {
            errors.add("Semitones must not be zero");
        }
    }

    @Override
    protected Long execute(TransposeMidiClip command, Track track, CommandContext context) {
        track.transposeMidiClip(command.clipId(), command.semitones());
        return track.getVersion();
    }
}
