package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.UpdateMidiNote;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class UpdateMidiNoteHandler extends TrackCommandHandler<UpdateMidiNote, Long> {

    public UpdateMidiNoteHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(UpdateMidiNote command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
        if (command.note() == null) {
            errors.add("Note is required");
        }
    }

    @Override
    protected Long execute(UpdateMidiNote command, Track track, CommandContext context) {
        track.updateMidiNote(command.clipId(), command.note());
        return track.getVersion();
    }
}
