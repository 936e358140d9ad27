package com.abroadhelper.resources.model;

public record FetchOutcome(FetchStatus status, HttpFetchResult lastResult, int attempts) {

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    public int statusCode() {
        return lastResult == null ? 0 : lastResult.statusCode();
    }

    public String body() {
        return lastResult == null ? null : lastResult.body();
    }
}
