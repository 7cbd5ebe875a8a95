package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.AddMidiNote;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class AddMidiNoteHandler extends TrackCommandHandler<AddMidiNote, Long> {

    public AddMidiNoteHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(AddMidiNote command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (command.note() == null) {
            errors.add("Note is required");
        }
    }

    @Override
    protected Long execute(AddMidiNote command, Track track, CommandContext context) {
        track.addMidiNote(command.clipId(), command.note());
        return track.getVersion();
    }
}
