package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.CreateTrack;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.time.Clock;
import java.util.List;

/**
 * Creates a track instead of loading one. The append at expected version 0 also rejects a
 * create that races another for the same id.
 */
public class CreateTrackHandler extends TrackCommandHandler<CreateTrack, String> {

    private final Clock clock;

    public CreateTrackHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService,
                              Clock clock) {
        super(repository, undoRedoService);
        this.clock = clock;
    }

    @Override
    protected void validate(CreateTrack command, List<String> errors) {
        if (isBlank(command.ownerId())) {
            errors.add("Owner ID is required");
        }
        if (command.trackType() == null) {
            errors.add("Track type is required");
        }
        if (command.metadata() == null) {
            errors.add("Track metadata is required");
        }
    }

    @Override
    protected Track loadTrack(CreateTrack command, CommandContext context) {
        if (repository.exists(command.trackId())) {
            throw new ValidationException("Track already exists: " + command.trackId());
        }
        return Track.create(command.trackId(), command.ownerId(), command.trackType(), command.metadata(),
            command.initialClips(), clock);
    }

    @Override
    protected String execute(CreateTrack command, Track track, CommandContext context) {
        return track.getId();
    }
}
