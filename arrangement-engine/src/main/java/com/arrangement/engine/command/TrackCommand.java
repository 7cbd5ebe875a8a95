package com.arrangement.engine.command;

public interface TrackCommand<R> extends Command<R> {

    String trackId();

    @Override
    default String aggregateId() {
        return trackId();
    }
}
