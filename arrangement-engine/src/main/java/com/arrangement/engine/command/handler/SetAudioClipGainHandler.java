package com.arrangement.engine.command.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.TrackCommandHandler;
import com.arrangement.engine.command.TrackCommands.SetAudioClipGain;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.List;

public class SetAudioClipGainHandler extends TrackCommandHandler<SetAudioClipGain, Long> {

    public SetAudioClipGainHandler(EventSourcedTrackRepository repository, UndoRedoService<TrackEvent> undoRedoService) {
        super(repository, undoRedoService);
    }

    @Override
    protected void validate(SetAudioClipGain command, List<String> errors) {
        if (isBlank(command.clipId())) {
            errors.add("Clip ID is required");
        }
    }

    @Override
    protected Long execute(SetAudioClipGain command, Track track, CommandContext context) {
        track.setAudioClipGain(command.clipId(), command.gain());
        return track.getVersion();
    }
}
