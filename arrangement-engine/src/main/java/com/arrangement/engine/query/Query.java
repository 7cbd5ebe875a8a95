package com.arrangement.engine.query;

/**
 * A read-only request.
 *
 * @param <R> type of the answer
 */
public interface Query<R> {

    default String queryName() {
        return getClass().getSimpleName();
    }
}
