package com.arrangement.engine.query;

public interface QueryHandler<Q, R> {

    R handle(Q query);
}
