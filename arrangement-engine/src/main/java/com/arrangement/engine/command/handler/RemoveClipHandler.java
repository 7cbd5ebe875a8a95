package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.RemoveClip;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class RemoveClipHandler extends TrackCommandHandler<RemoveClip, Long> {

    public RemoveClipHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(RemoveClip command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
    }

    @Override
    protected Long execute(RemoveClip command, Track track, CommandContext context) {
        track.removeClip(command.clipId());
        return track.getVersion();
    }
}
