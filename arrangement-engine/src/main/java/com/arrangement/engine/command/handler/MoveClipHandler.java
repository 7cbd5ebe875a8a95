package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.MoveClip;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class MoveClipHandler extends TrackCommandHandler<MoveClip, Long> {

    public MoveClipHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(MoveClip command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (command.newRange() == null) {
            errors.add("New range is required");
        }
    }

    @Override
    protected Long execute(MoveClip command, Track track, CommandContext context) {
        track.moveClip(command.clipId(), command.newRange());
        return track.getVersion();
    }
}
