package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.UpdateTrackMetadata;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class UpdateTrackMetadataHandler extends TrackCommandHandler<UpdateTrackMetadata, Long> {

    public UpdateTrackMetadataHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(UpdateTrackMetadata command, List<String> errors) {
        if (command.metadata() == null) {
            errors.add("Metadata is required");
        }
    }

    @Override
    protected Long execute(UpdateTrackMetadata command, Track track, CommandContext context) {
        track.updateMetadata(command.metadata());
        return track.getVersion();
    }
}
