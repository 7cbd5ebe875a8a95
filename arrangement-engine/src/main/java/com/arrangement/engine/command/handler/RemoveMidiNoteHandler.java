package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.RemoveMidiNote;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class RemoveMidiNoteHandler extends TrackCommandHandler<RemoveMidiNote, Long> {

    public RemoveMidiNoteHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(RemoveMidiNote command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (isBlank(command.noteId())) {
            errors.add("Note ID is required");
        }
    }

    @Override
    protected Long execute(RemoveMidiNote command, Track track, CommandContext context) {
        track.removeMidiNote(command.clipId(), command.noteId());
        return track.getVersion();
    }
}
