package com.arrangement.engine.command;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.store.StoredEvent;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Common shape of every track-changing command:
 * <ol>
 *   <li>validate required fields, before touching the store</li>
 *   <li>load the track by replay</li>
 *   <li>run the domain operation</li>
 *   <li>append the raised events with the pre-operation version as expected version</li>
 *   <li>record undoable events at the versions the store assigned them</li>
 * </ol>
 * A failed append throws before step 5, so a rejected command leaves no trace in the store or
 * the undo history.
 */
public abstract class TrackCommandHandler<C extends TrackCommand<R>, R> implements CommandHandler<C, R> {

    private static final Logger log = LoggerFactory.getLogger(TrackCommandHandler.class);

    protected final EventSourcedTrackRepository repository;
    protected final UndoRedoService<TrackEvent> undoRedoService;

    protected TrackCommandHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        this.repository = repository;
        this.undoRedoService = undoRedoService;
    }

    @Override
    public final CommandResult<R> handle(C command, CommandContext context) {
        List<String> errors = new ArrayList<>();
        if (isBlank(command.trackId())) {
            errors.add("Track ID is required");
        }
        if (context == null || isBlank(context.userId())) {
            errors.add("User ID is required");
        }
        validate(command, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        Track track = loadTrack(command, context);
        R result = execute(command, track, context);

        List<TrackEvent> raised = track.getUncommittedEvents();
        List<StoredEvent> stored = repository.save(track);

        int recorded = 0;
        if (context.undoTracking()) {
            for (int i = 0; i < raised.size(); i++) {
                if (undoRedoService.record(raised.get(i), track.getId(), stored.get(i).version(), context.userId())) {
                    recorded++;
                }
            }
        }

        log.info("{} on track {} stored {} event(s), {} undoable", command.commandName(), track.getId(),
            raised.size(), recorded);
        return CommandResult.success(result, raised.size(), recorded);
    }

    /**
     * Add a message for each malformed field.
     */
    protected void validate(C command, List<String> errors) {
    }

    protected Track loadTrack(C command, CommandContext context) {
        return repository.load(command.trackId());
    }

    protected abstract R execute(C command, Track track, CommandContext context);

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
