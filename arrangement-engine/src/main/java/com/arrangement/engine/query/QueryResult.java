package com.arrangement.engine.query;

import com.arrangement.core.exception.ArrangementException;

public record QueryResult<R>(boolean success, R result, String error, String errorCode) {

    public static <R> QueryResult<R> success(R result) {
        return new QueryResult<>(true, result, null, null);
    }

    public static <R> QueryResult<R> failure(String errorCode, String error) {
        return new QueryResult<>(false, null, error, errorCode);
    }

    public static <R> QueryResult<R> failure(ArrangementException e) {
        return failure(e.getErrorCode(), e.getMessage());
    }
}
