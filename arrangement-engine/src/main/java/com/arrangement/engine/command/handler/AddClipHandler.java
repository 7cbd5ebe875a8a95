package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.AddClip;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class AddClipHandler extends TrackCommandHandler<AddClip, Long> {

    public AddClipHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(AddClip command, List<String> errors) {
        if (command.clip() == null) {
            errors.add("Clip is required");
        }
    }

    @Override
    protected Long execute(AddClip command, Track track, CommandContext context) {
        track.addClip(command.clip());
        return track.getVersion();
    }
}
